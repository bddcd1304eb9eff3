package com.p14n.brokers.amqp;

import java.io.IOException;
import java.net.URISyntaxException;
import java.security.KeyManagementException;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.brokers.broker.AsyncExecutor;
import com.p14n.brokers.broker.Broker;
import com.p14n.brokers.broker.BrokerException;
import com.p14n.brokers.broker.BrokerListener;
import com.p14n.brokers.broker.BrokerSupport;
import com.p14n.brokers.broker.CallOptions;
import com.p14n.brokers.broker.ConnectionLostException;
import com.p14n.brokers.broker.DefaultExecutor;
import com.p14n.brokers.broker.Delivery;
import com.p14n.brokers.broker.MessageSubscriber;
import com.p14n.brokers.broker.PublishOptions;
import com.p14n.brokers.broker.QueueNames;
import com.p14n.brokers.broker.Subscription;
import com.p14n.brokers.data.ReconnectBackoff;
import com.p14n.brokers.serialization.JsonSerializer;
import com.p14n.brokers.serialization.Serializer;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.Consumer;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import com.rabbitmq.client.impl.DefaultExceptionHandler;

import static com.p14n.brokers.telemetry.OpenTelemetryFunctions.traceparentOf;
import static com.p14n.brokers.telemetry.OpenTelemetryFunctions.withTraceContext;

import io.opentelemetry.api.OpenTelemetry;

/**
 * A broker for AMQP 0-9-1 servers such as RabbitMQ.
 *
 * <p>
 * The broker publishes to a direct exchange named after its group. Each
 * subscribed event gets a queue named by {@link QueueNames}, bound to the
 * exchange with the event as routing key. Calls are answered through an
 * exclusive, server-named reply queue and matched by correlation id.
 * </p>
 *
 * <p>
 * When connected from a descriptor or a {@link ConnectionFactory}, failed
 * attempts and non-fatal connection losses are retried after
 * {@link AmqpConfig#reconnectTimeout()} without limit; each failure is reported
 * through {@link BrokerListener#onClose}. Every successful (re)connect opens a
 * fresh channel, asserts the exchange and reply queue, and restores the
 * consumers of all events that still have subscribers. Calls outstanding when
 * the connection is lost fail with {@link ConnectionLostException}; operations
 * attempted before the new channel is ready fail with
 * {@link NoChannelException}.
 * </p>
 *
 * <pre>{@code
 * AmqpBroker<Object> broker = new AmqpBroker<>(new AmqpConfigData("app", null, true),
 *         JsonSerializer.generic(), OpenTelemetry.noop());
 * broker.connect("guest:guest@localhost:5672").join();
 * broker.subscribe(List.of("ping"), d -> {
 *     d.response().reply("pong");
 *     d.response().ack();
 * }).join();
 * Object pong = broker.call("ping", "hello").join();
 * }</pre>
 *
 * @param <T> The payload type
 */
public class AmqpBroker<T> implements Broker<T, AmqpResponder<T>> {
    private static final Logger logger = LoggerFactory.getLogger(AmqpBroker.class);

    private final AmqpConfig config;
    private final AsyncExecutor executor;
    private final boolean ownsExecutor;
    private final BrokerSupport<T, AmqpResponder<T>> support;
    private final ReconnectBackoff backoff;
    private final Map<String, Subscription> consumers = new ConcurrentHashMap<>();
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.DISCONNECTED);
    private final AtomicInteger attempts = new AtomicInteger();

    private volatile Connection connection;
    private volatile Channel channel;
    private volatile String callbackQueue;
    private volatile ScheduledFuture<?> pendingReconnect;
    private volatile CompletableFuture<Connection> pendingConnect;
    private volatile boolean stopped;

    public AmqpBroker(AmqpConfig config, Serializer<T> serializer, OpenTelemetry ot) {
        this(config, serializer, new DefaultExecutor(), true, ot);
    }

    public AmqpBroker(AmqpConfig config, Serializer<T> serializer, AsyncExecutor executor, OpenTelemetry ot) {
        this(config, serializer, executor, false, ot);
    }

    private AmqpBroker(AmqpConfig config, Serializer<T> serializer, AsyncExecutor executor, boolean ownsExecutor,
            OpenTelemetry ot) {
        this.config = config;
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
        this.support = new BrokerSupport<>(serializer, executor, ot, "amqp_broker");
        this.backoff = new ReconnectBackoff(config);
    }

    /**
     * Creates a broker for a group that exchanges generic JSON values.
     */
    public static AmqpBroker<Object> create(String group, OpenTelemetry ot) {
        return new AmqpBroker<>(new AmqpConfigData(group), JsonSerializer.generic(), ot);
    }

    /**
     * Connects to the server described by {@code descriptor}, either a full
     * {@code amqp://} URI or the part after the scheme.
     *
     * @return completes once connected and the topology is in place; fails only
     *         on a fatal error or when the broker is closed first
     */
    public CompletableFuture<Connection> connect(String descriptor) {
        var factory = new ConnectionFactory();
        try {
            factory.setUri(descriptor.contains("://") ? descriptor : "amqp://" + descriptor);
        } catch (URISyntaxException | NoSuchAlgorithmException | KeyManagementException e) {
            throw new IllegalArgumentException("Invalid AMQP connection descriptor", e);
        }
        return connect(factory);
    }

    /**
     * Connects with a prepared factory. The factory's automatic recovery is
     * switched off; this broker reconnects by itself.
     *
     * @throws IllegalStateException if the broker is already connected or
     *                               connecting
     */
    public CompletableFuture<Connection> connect(ConnectionFactory factory) {
        support.ensureOpen();
        beginConnect();
        factory.setAutomaticRecoveryEnabled(false);
        factory.setExceptionHandler(new ForwardingExceptionHandler());
        attempts.set(0);
        var result = new CompletableFuture<Connection>();
        pendingConnect = result;
        result.whenComplete((c, e) -> {
            if (pendingConnect == result) {
                pendingConnect = null;
            }
        });
        executor.execute(() -> attemptConnect(factory, result));
        return result;
    }

    /**
     * Uses an established connection. Such a connection is not re-established
     * when it is lost.
     *
     * @throws IllegalStateException if the broker is already connected or
     *                               connecting
     */
    public CompletableFuture<Connection> connect(Connection existing) {
        support.ensureOpen();
        beginConnect();
        return CompletableFuture.supplyAsync(() -> {
            try {
                establish(existing, null);
                return existing;
            } catch (IOException e) {
                state.set(ConnectionState.DISCONNECTED);
                throw new BrokerException("Unable to set up channel on connection", e);
            }
        }, executor);
    }

    private void beginConnect() {
        if (!state.compareAndSet(ConnectionState.DISCONNECTED, ConnectionState.CONNECTING)) {
            throw new IllegalStateException("Broker is already " + state.get().name().toLowerCase(Locale.ROOT));
        }
        stopped = false;
    }

    private static BrokerException closedBeforeConnect() {
        return new BrokerException("Broker closed before a connection was established");
    }

    private void attemptConnect(ConnectionFactory factory, CompletableFuture<Connection> result) {
        if (stopped) {
            result.completeExceptionally(closedBeforeConnect());
            return;
        }
        Connection conn = null;
        try {
            logger.atInfo().addArgument(config.group()).log("Connecting broker for group {}");
            conn = factory.newConnection();
            if (stopped) {
                conn.abort();
                result.completeExceptionally(closedBeforeConnect());
                return;
            }
            establish(conn, factory);
            attempts.set(0);
            result.complete(conn);
        } catch (Exception e) {
            if (conn != null) {
                conn.abort();
            }
            if (stopped) {
                result.completeExceptionally(closedBeforeConnect());
                return;
            }
            support.emitClose(e);
            if (ConnectionFaults.isFatal(e)) {
                state.set(ConnectionState.DISCONNECTED);
                logger.atError().setCause(e).log("Fatal connection error, giving up");
                result.completeExceptionally(e);
                return;
            }
            scheduleReconnect(() -> attemptConnect(factory, result));
        }
    }

    private void scheduleReconnect(Runnable attempt) {
        if (stopped) {
            state.set(ConnectionState.DISCONNECTED);
            return;
        }
        int n = attempts.incrementAndGet();
        long delay = backoff.delayMillis(n);
        support.metrics().recordReconnect();
        logger.atInfo()
                .addArgument(delay)
                .addArgument(n)
                .log("Reconnecting in {}ms (attempt {})");
        state.set(ConnectionState.CONNECTING);
        try {
            pendingReconnect = executor.schedule(() -> executor.execute(attempt), delay, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            state.set(ConnectionState.DISCONNECTED);
            logger.atWarn().setCause(e).log("Executor rejected reconnect, broker stays disconnected");
        }
    }

    private void establish(Connection conn, ConnectionFactory factory) throws IOException {
        Channel ch = conn.createChannel();
        int prefetch = config.consume().prefetch();
        if (prefetch > 0) {
            ch.basicQos(prefetch);
        }
        String callback = ch.queueDeclare("", false, true, true, null).getQueue();
        ch.basicConsume(callback, true, new ReplyConsumer(ch));
        ch.exchangeDeclare(config.group(), BuiltinExchangeType.DIRECT);

        dropConsumers();
        this.connection = conn;
        this.callbackQueue = callback;
        this.channel = ch;
        state.set(ConnectionState.CONNECTED);
        // close() may have run while the topology was set up
        if (stopped) {
            connection = null;
            channel = null;
            callbackQueue = null;
            state.set(ConnectionState.DISCONNECTED);
            conn.abort();
            throw closedBeforeConnect();
        }
        // called at once if the connection already died
        conn.addShutdownListener(cause -> onConnectionShutdown(conn, cause, factory));

        logger.atInfo()
                .addArgument(config.group())
                .addArgument(callback)
                .log("Connected to exchange {} with reply queue {}");
        restoreConsumers(ch);
    }

    private void restoreConsumers(Channel ch) {
        for (String event : support.events()) {
            try {
                ensureConsumer(ch, event);
            } catch (IOException | RuntimeException e) {
                support.emitError(new BrokerException("Unable to restore consumer for " + event, e));
            }
        }
    }

    private void onConnectionShutdown(Connection conn, ShutdownSignalException cause, ConnectionFactory factory) {
        if (conn != connection) {
            return;
        }
        connection = null;
        channel = null;
        callbackQueue = null;
        dropConsumers();
        support.failPendingCalls(new ConnectionLostException("AMQP connection lost", cause));

        if (stopped || cause.isInitiatedByApplication()) {
            state.set(ConnectionState.DISCONNECTED);
            logger.atInfo().addArgument(config.group()).log("Connection for group {} closed");
            return;
        }
        support.emitClose(cause);
        if (factory == null) {
            state.set(ConnectionState.DISCONNECTED);
            logger.atWarn().log("Connection supplied by the caller was lost and will not be re-established");
            return;
        }
        if (ConnectionFaults.isFatal(cause)) {
            state.set(ConnectionState.DISCONNECTED);
            logger.atError().setCause(cause).log("Connection closed with a fatal error, not reconnecting");
            return;
        }
        scheduleReconnect(() -> attemptConnect(factory, new CompletableFuture<>()));
    }

    private void dropConsumers() {
        consumers.keySet().forEach(event -> support.metrics().recordSubscriptionRemoved(event));
        consumers.clear();
    }

    /**
     * Asserts the queue of an event and binds it to the exchange.
     *
     * @return the queue name
     */
    public CompletableFuture<String> createQueue(String event) {
        Channel ch = channel();
        return CompletableFuture.supplyAsync(() -> {
            try {
                return declareQueue(ch, event);
            } catch (IOException e) {
                throw new BrokerException("Unable to create queue for " + event, e);
            }
        }, executor);
    }

    private String declareQueue(Channel ch, String event) throws IOException {
        String queue = QueueNames.of(config.group(), config.subgroup(), event);
        QueueOptions options = config.queueOptions();
        ch.queueDeclare(queue, options.durable(), options.exclusive(), options.autoDelete(), options.arguments());
        ch.queueBind(queue, config.group(), event);
        return queue;
    }

    @Override
    public CompletableFuture<List<Subscription>> subscribe(Collection<String> events,
            MessageSubscriber<Delivery<T, AmqpResponder<T>>> subscriber) {
        support.ensureOpen();
        Channel ch = channel();
        List<String> requested = List.copyOf(events);
        requested.forEach(event -> support.addSubscriber(event, subscriber));
        return CompletableFuture.supplyAsync(() -> {
            var subscriptions = new ArrayList<Subscription>();
            for (String event : requested) {
                try {
                    subscriptions.add(ensureConsumer(ch, event));
                } catch (IOException e) {
                    throw new BrokerException("Unable to subscribe to " + event, e);
                }
            }
            return subscriptions;
        }, executor);
    }

    private synchronized Subscription ensureConsumer(Channel ch, String event) throws IOException {
        Subscription existing = consumers.get(event);
        if (existing != null) {
            return existing;
        }
        if (!support.hasSubscribers(event)) {
            throw new BrokerException("Subscription to " + event + " was cancelled before its consumer started");
        }
        String queue = declareQueue(ch, event);
        ConsumeOptions options = config.consume();
        String tag = ch.basicConsume(queue, options.autoAck(), "", options.noLocal(), options.exclusive(),
                options.arguments(), new EventConsumer(ch, event));
        var subscription = new Subscription(event, queue, tag);
        consumers.put(event, subscription);
        support.metrics().recordSubscriptionAdded(event);
        logger.atInfo()
                .addArgument(event)
                .addArgument(queue)
                .addArgument(tag)
                .log("Consuming {} from queue {} as {}");
        return subscription;
    }

    @Override
    public CompletableFuture<Map<String, Boolean>> unsubscribe(Collection<String> events) {
        List<String> requested = List.copyOf(events);
        return CompletableFuture.supplyAsync(() -> {
            Map<String, Boolean> result = new LinkedHashMap<>();
            for (String event : requested) {
                result.put(event, cancelConsumer(event));
            }
            return result;
        }, executor);
    }

    private synchronized boolean cancelConsumer(String event) {
        Subscription subscription = consumers.remove(event);
        if (subscription == null) {
            support.removeSubscribers(event);
            logger.atDebug().addArgument(event).log("No consumer for {}");
            return false;
        }
        support.metrics().recordSubscriptionRemoved(event);
        try {
            channel().basicCancel(subscription.handle());
        } catch (IOException e) {
            throw new BrokerException("Unable to cancel consumer for " + event, e);
        } finally {
            support.removeSubscribers(event);
        }
        logger.atInfo().addArgument(event).log("Unsubscribed from {}");
        return true;
    }

    @Override
    public void publish(String event, T data, PublishOptions options) {
        support.ensureOpen();
        Channel ch = channel();
        byte[] body = support.serialize(data);
        try {
            send(ch, event, properties(event, options).build(), body);
        } catch (IOException | ShutdownSignalException e) {
            support.emitError(new BrokerException("Unable to publish " + event, e));
        }
    }

    /**
     * Publishes with raw AMQP properties.
     */
    public void publish(String event, T data, AMQP.BasicProperties properties) {
        support.ensureOpen();
        Channel ch = channel();
        byte[] body = support.serialize(data);
        try {
            send(ch, event, properties, body);
        } catch (IOException | ShutdownSignalException e) {
            support.emitError(new BrokerException("Unable to publish " + event, e));
        }
    }

    @Override
    public CompletableFuture<T> call(String event, T data, CallOptions options) {
        support.ensureOpen();
        if (!config.rpc()) {
            throw new IllegalStateException("Broker is not in RPC mode");
        }
        Channel ch = channel();
        String replyTo = callbackQueue;
        if (replyTo == null) {
            throw new NoChannelException();
        }
        byte[] body = support.serialize(data);
        String id = support.newCorrelationId();
        Duration timeout = options.timeout() != null ? options.timeout() : config.callTimeout();

        var properties = properties(event, options.publish())
                .correlationId(id)
                .replyTo(replyTo);
        if (timeout != null && options.publish().expiration() == null) {
            // an unanswered request is useless once the caller gave up
            properties.expiration(String.valueOf(timeout.toMillis()));
        }

        CompletableFuture<T> response = support.awaitResponse(event, id, timeout, options.cancellation());
        try {
            send(ch, event, properties.build(), body);
        } catch (IOException | ShutdownSignalException e) {
            support.rejectCall(id, new BrokerException("Unable to send call " + event, e));
        }
        return response;
    }

    private void send(Channel ch, String event, AMQP.BasicProperties properties, byte[] body) throws IOException {
        ch.basicPublish(config.group(), event, properties, body);
        support.metrics().recordPublished(event);
        logger.atDebug().addArgument(event).addArgument(config.group()).log("Published {} to {}");
    }

    private AMQP.BasicProperties.Builder properties(String event, PublishOptions options) {
        var builder = new AMQP.BasicProperties.Builder()
                .headers(withTraceContext(support.openTelemetry(), support.tracer(), event, options.headers()))
                .contentType(options.contentType())
                .priority(options.priority());
        if (options.persistent()) {
            builder.deliveryMode(2);
        }
        if (options.expiration() != null) {
            builder.expiration(String.valueOf(options.expiration()));
        }
        return builder;
    }

    /**
     * @throws NoChannelException if the broker is not connected
     */
    protected Channel channel() {
        Channel ch = channel;
        if (ch == null) {
            throw new NoChannelException();
        }
        return ch;
    }

    /**
     * @return the current connection state
     */
    public ConnectionState state() {
        return state.get();
    }

    /**
     * Gets the server-named queue on which call replies arrive.
     *
     * @return the reply queue, or null while disconnected
     */
    public String callbackQueue() {
        return callbackQueue;
    }

    /**
     * @return the configuration this broker was created with
     */
    public AmqpConfig config() {
        return config;
    }

    /**
     * Gets the consumers currently registered on the channel. Emptied when the
     * connection is lost and refilled after a reconnect.
     *
     * @return a snapshot keyed by event
     */
    public Map<String, Subscription> subscriptions() {
        return Map.copyOf(consumers);
    }

    /**
     * @return the number of calls waiting for a reply
     */
    public int pendingCalls() {
        return support.pendingCalls();
    }

    @Override
    public void addListener(BrokerListener listener) {
        support.addListener(listener);
    }

    @Override
    public void removeListener(BrokerListener listener) {
        support.removeListener(listener);
    }

    @Override
    public void close() {
        if (support.isClosed()) {
            return;
        }
        stopped = true;
        ScheduledFuture<?> reconnect = pendingReconnect;
        if (reconnect != null) {
            reconnect.cancel(false);
        }
        CompletableFuture<Connection> connecting = pendingConnect;
        if (connecting != null) {
            connecting.completeExceptionally(closedBeforeConnect());
        }
        Connection conn = connection;
        connection = null;
        channel = null;
        callbackQueue = null;
        dropConsumers();
        support.close();
        state.set(ConnectionState.DISCONNECTED);
        if (conn != null && conn.isOpen()) {
            try {
                conn.close();
            } catch (IOException | ShutdownSignalException e) {
                logger.atWarn().setCause(e).log("Error closing AMQP connection");
            }
        }
        if (ownsExecutor) {
            executor.close();
        }
        logger.atInfo().addArgument(config.group()).log("AMQP broker for group {} closed");
    }

    private final class EventConsumer extends DefaultConsumer {
        private final String event;

        EventConsumer(Channel channel, String event) {
            super(channel);
            this.event = event;
        }

        @Override
        public void handleDelivery(String consumerTag, Envelope envelope, AMQP.BasicProperties properties,
                byte[] body) {
            var responder = new ChannelResponder<T>(getChannel(), envelope.getDeliveryTag(), properties,
                    support::serialize, config.consume().autoAck());
            try {
                boolean dispatched = support.handleMessage(event, body, responder,
                        traceparentOf(properties == null ? null : properties.getHeaders()));
                // delivered after unsubscribe; hand it back to the queue
                if (!dispatched) {
                    responder.rejectIfUnsettled(true);
                }
            } catch (RuntimeException e) {
                try {
                    responder.rejectIfUnsettled(false);
                } catch (RuntimeException rejectFailure) {
                    e.addSuppressed(rejectFailure);
                }
                support.emitError(e);
            }
        }

        @Override
        public void handleCancel(String consumerTag) {
            Subscription current = consumers.get(event);
            if (current != null && consumerTag.equals(current.handle())) {
                consumers.remove(event, current);
                support.metrics().recordSubscriptionRemoved(event);
            }
            support.emitError(new BrokerException("Consumer for " + event + " was cancelled by the server"));
        }
    }

    private final class ReplyConsumer extends DefaultConsumer {

        ReplyConsumer(Channel channel) {
            super(channel);
        }

        @Override
        public void handleDelivery(String consumerTag, Envelope envelope, AMQP.BasicProperties properties,
                byte[] body) {
            support.handleReply(properties == null ? null : properties.getCorrelationId(), body);
        }
    }

    private final class ForwardingExceptionHandler extends DefaultExceptionHandler {

        @Override
        public void handleUnexpectedConnectionDriverException(Connection conn, Throwable exception) {
            support.emitError(exception);
        }

        @Override
        public void handleConsumerException(Channel channel, Throwable exception, Consumer consumer,
                String consumerTag, String methodName) {
            support.emitError(exception);
        }
    }
}
