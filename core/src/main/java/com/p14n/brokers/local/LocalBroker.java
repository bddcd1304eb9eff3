package com.p14n.brokers.local;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.brokers.broker.AsyncExecutor;
import com.p14n.brokers.broker.Broker;
import com.p14n.brokers.broker.BrokerListener;
import com.p14n.brokers.broker.BrokerSupport;
import com.p14n.brokers.broker.CallOptions;
import com.p14n.brokers.broker.DefaultExecutor;
import com.p14n.brokers.broker.Delivery;
import com.p14n.brokers.broker.MessageSubscriber;
import com.p14n.brokers.broker.PublishOptions;
import com.p14n.brokers.broker.QueueNames;
import com.p14n.brokers.broker.Responder;
import com.p14n.brokers.broker.Subscription;
import com.p14n.brokers.data.BrokerConfig;
import com.p14n.brokers.serialization.Serializer;

import static com.p14n.brokers.telemetry.OpenTelemetryFunctions.traceparentOf;
import static com.p14n.brokers.telemetry.OpenTelemetryFunctions.withTraceContext;

import io.opentelemetry.api.OpenTelemetry;

/**
 * A broker whose transport is a {@link LocalExchange} in the same process.
 *
 * <p>
 * Brokers sharing an exchange behave like processes sharing an AMQP server:
 * queue names follow {@link QueueNames}, so brokers with the same group and
 * subgroup compete for messages while other groups each receive a copy. There
 * is no acknowledgement; a failing subscriber is reported through
 * {@link BrokerListener#onError}.
 * </p>
 *
 * <pre>{@code
 * LocalExchange exchange = new LocalExchange();
 * LocalBroker<Object> broker = new LocalBroker<>(exchange, new ConfigData("app", null, true),
 *         JsonSerializer.generic(), OpenTelemetry.noop());
 * }</pre>
 *
 * @param <T> The payload type
 */
public class LocalBroker<T> implements Broker<T, Responder<T>> {
    private static final Logger logger = LoggerFactory.getLogger(LocalBroker.class);

    private final LocalExchange exchange;
    private final BrokerConfig config;
    private final AsyncExecutor executor;
    private final boolean ownsExecutor;
    private final BrokerSupport<T, Responder<T>> support;
    private final Map<String, Subscription> consumers = new ConcurrentHashMap<>();
    private final String replyQueue;
    private final String replyTag;

    public LocalBroker(LocalExchange exchange, BrokerConfig config, Serializer<T> serializer, OpenTelemetry ot) {
        this(exchange, config, serializer, new DefaultExecutor(), true, ot);
    }

    public LocalBroker(LocalExchange exchange, BrokerConfig config, Serializer<T> serializer,
            AsyncExecutor executor, OpenTelemetry ot) {
        this(exchange, config, serializer, executor, false, ot);
    }

    private LocalBroker(LocalExchange exchange, BrokerConfig config, Serializer<T> serializer,
            AsyncExecutor executor, boolean ownsExecutor, OpenTelemetry ot) {
        this.exchange = exchange;
        this.config = config;
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
        this.support = new BrokerSupport<>(serializer, executor, ot, "local_broker");
        this.replyQueue = "local.reply." + UUID.randomUUID();
        exchange.declareQueue(replyQueue);
        this.replyTag = exchange.consume(replyQueue, m -> support.handleReply(m.correlationId(), m.body()));
    }

    @Override
    public CompletableFuture<List<Subscription>> subscribe(Collection<String> events,
            MessageSubscriber<Delivery<T, Responder<T>>> subscriber) {
        var subscriptions = new ArrayList<Subscription>();
        for (String event : events) {
            support.addSubscriber(event, subscriber);
            subscriptions.add(ensureConsumer(event));
        }
        return CompletableFuture.completedFuture(subscriptions);
    }

    private synchronized Subscription ensureConsumer(String event) {
        Subscription existing = consumers.get(event);
        if (existing != null) {
            return existing;
        }
        String queue = QueueNames.of(config.group(), config.subgroup(), event);
        exchange.declareQueue(queue);
        exchange.bind(queue, config.group(), event);
        String tag = exchange.consume(queue, m -> onMessage(event, m));
        var subscription = new Subscription(event, queue, tag);
        consumers.put(event, subscription);
        support.metrics().recordSubscriptionAdded(event);
        logger.atInfo().addArgument(event).addArgument(queue).log("Subscribed to {} on queue {}");
        return subscription;
    }

    private void onMessage(String event, LocalMessage message) {
        var responder = new LocalResponder<T>(exchange, message, support::serialize);
        try {
            if (!support.handleMessage(event, message.body(), responder, traceparentOf(message.headers()))) {
                logger.atDebug().addArgument(event).log("Dropped message for {}");
            }
        } catch (RuntimeException e) {
            support.emitError(e);
        }
    }

    @Override
    public synchronized CompletableFuture<Map<String, Boolean>> unsubscribe(Collection<String> events) {
        Map<String, Boolean> result = new LinkedHashMap<>();
        for (String event : events) {
            support.removeSubscribers(event);
            Subscription subscription = consumers.remove(event);
            if (subscription == null) {
                result.put(event, false);
                continue;
            }
            exchange.cancel(subscription.handle());
            support.metrics().recordSubscriptionRemoved(event);
            logger.atInfo().addArgument(event).log("Unsubscribed from {}");
            result.put(event, true);
        }
        return CompletableFuture.completedFuture(result);
    }

    @Override
    public void publish(String event, T data, PublishOptions options) {
        support.ensureOpen();
        byte[] body = support.serialize(data);
        send(event, new LocalMessage(event, body, null, null, headers(event, options)));
    }

    @Override
    public CompletableFuture<T> call(String event, T data, CallOptions options) {
        support.ensureOpen();
        if (!config.rpc()) {
            throw new IllegalStateException("Broker is not in RPC mode");
        }
        byte[] body = support.serialize(data);
        String id = support.newCorrelationId();
        Duration timeout = options.timeout() != null ? options.timeout() : config.callTimeout();
        CompletableFuture<T> response = support.awaitResponse(event, id, timeout, options.cancellation());
        send(event, new LocalMessage(event, body, replyQueue, id, headers(event, options.publish())));
        return response;
    }

    private void send(String event, LocalMessage message) {
        try {
            exchange.publish(config.group(), event, message);
            support.metrics().recordPublished(event);
        } catch (IllegalStateException e) {
            if (message.correlationId() != null) {
                support.rejectCall(message.correlationId(), e);
            } else {
                support.emitError(e);
            }
        }
    }

    private Map<String, Object> headers(String event, PublishOptions options) {
        return withTraceContext(support.openTelemetry(), support.tracer(), event, options.headers());
    }

    @Override
    public void addListener(BrokerListener listener) {
        support.addListener(listener);
    }

    @Override
    public void removeListener(BrokerListener listener) {
        support.removeListener(listener);
    }

    public String replyQueue() {
        return replyQueue;
    }

    public int pendingCalls() {
        return support.pendingCalls();
    }

    @Override
    public synchronized void close() {
        if (support.isClosed()) {
            return;
        }
        consumers.values().forEach(s -> exchange.cancel(s.handle()));
        consumers.clear();
        exchange.cancel(replyTag);
        exchange.deleteQueue(replyQueue);
        support.close();
        if (ownsExecutor) {
            executor.close();
        }
        logger.atInfo().addArgument(config.group()).log("Local broker for group {} closed");
    }
}
