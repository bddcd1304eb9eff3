package com.p14n.brokers.broker;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.brokers.serialization.SerializationException;
import com.p14n.brokers.serialization.Serializer;
import com.p14n.brokers.telemetry.BrokerMetrics;

import static com.p14n.brokers.telemetry.OpenTelemetryFunctions.processWithTelemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

/**
 * Transport independent half of a broker. Every transport owns one instance and
 * hands it inbound messages and replies; the helper decodes them, runs the
 * registered subscribers or completes the matching call, and fans faults out to
 * the {@link BrokerListener}s.
 *
 * <p>
 * Subscribers of one event are invoked in registration order on the thread that
 * delivered the message, so the transport's delivery order is kept. A failing
 * subscriber does not prevent the others from running.
 * </p>
 *
 * @param <T> The payload type
 * @param <R> The responder type handed to subscribers
 */
public class BrokerSupport<T, R extends Responder<T>> implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(BrokerSupport.class);

    private final ConcurrentHashMap<String, Set<MessageSubscriber<Delivery<T, R>>>> eventSubscribers = new ConcurrentHashMap<>();
    private final Set<BrokerListener> listeners = new CopyOnWriteArraySet<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Serializer<T> serializer;
    private final CorrelationTable<T> correlations;
    private final BrokerMetrics metrics;
    private final Tracer tracer;
    private final OpenTelemetry openTelemetry;

    public BrokerSupport(Serializer<T> serializer, AsyncExecutor executor, OpenTelemetry ot, String scopeName) {
        this.serializer = Objects.requireNonNull(serializer, "serializer");
        this.correlations = new CorrelationTable<>(executor);
        this.metrics = new BrokerMetrics(ot.getMeter(scopeName));
        this.tracer = ot.getTracer(scopeName);
        this.openTelemetry = ot;
    }

    public BrokerMetrics metrics() {
        return metrics;
    }

    public OpenTelemetry openTelemetry() {
        return openTelemetry;
    }

    public Tracer tracer() {
        return tracer;
    }

    public void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Broker is closed");
        }
    }

    public byte[] serialize(T data) {
        return serializer.serialize(data);
    }

    /**
     * Registers a subscriber for an event.
     *
     * @return true if this is the first subscriber of the event
     */
    public boolean addSubscriber(String event, MessageSubscriber<Delivery<T, R>> subscriber) {
        ensureOpen();
        if (subscriber == null) {
            throw new IllegalArgumentException("Subscriber cannot be null");
        }
        if (event == null) {
            throw new IllegalArgumentException("Event cannot be null");
        }
        var created = new AtomicBoolean(false);
        eventSubscribers.computeIfAbsent(event, k -> {
            created.set(true);
            return new CopyOnWriteArraySet<>();
        }).add(subscriber);
        return created.get();
    }

    /**
     * Forgets every subscriber of an event.
     *
     * @return true if the event had subscribers
     */
    public boolean removeSubscribers(String event) {
        return eventSubscribers.remove(event) != null;
    }

    public boolean hasSubscribers(String event) {
        var s = eventSubscribers.get(event);
        return s != null && !s.isEmpty();
    }

    public Set<String> events() {
        return Set.copyOf(eventSubscribers.keySet());
    }

    /**
     * Decodes an inbound message and runs every subscriber of its event.
     *
     * @param event       the event the message was routed with
     * @param body        the raw message body
     * @param responder   the response affordances for this message
     * @param traceparent the publisher's trace context, may be null
     * @return false if the event has no subscribers and the message was not
     *         dispatched
     * @throws DispatchException if the body could not be decoded or a subscriber
     *                           failed; every subscriber has run by then
     */
    public boolean handleMessage(String event, byte[] body, R responder, String traceparent) {
        T data;
        try {
            data = serializer.deserialize(body);
        } catch (SerializationException e) {
            throw new DispatchException(event, "Unable to decode message for event " + event, e);
        }
        metrics.recordReceived(event);

        Set<MessageSubscriber<Delivery<T, R>>> subscribers = eventSubscribers.get(event);
        if (subscribers == null || subscribers.isEmpty()) {
            logger.atDebug().addArgument(event).log("No subscribers for event {}");
            return false;
        }

        var delivery = new Delivery<>(event, data, responder);
        DispatchException failure = processWithTelemetry(openTelemetry, tracer, "process_message", event,
                traceparent, () -> deliver(delivery, subscribers));
        if (failure != null) {
            throw failure;
        }
        return true;
    }

    private DispatchException deliver(Delivery<T, R> delivery, Set<MessageSubscriber<Delivery<T, R>>> subscribers) {
        DispatchException failure = null;
        for (MessageSubscriber<Delivery<T, R>> subscriber : subscribers) {
            try {
                subscriber.onMessage(delivery);
            } catch (Exception e) {
                try {
                    subscriber.onError(e);
                } catch (Exception inner) {
                    e.addSuppressed(inner);
                }
                if (failure == null) {
                    failure = new DispatchException(delivery.event(),
                            "Subscriber failed on event " + delivery.event(), e);
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        return failure;
    }

    /**
     * Completes the call waiting for this reply. Replies without a matching
     * pending call are dropped.
     *
     * @return true if a pending call was completed
     */
    public boolean handleReply(String correlationId, byte[] body) {
        if (correlationId == null || !correlations.isPending(correlationId)) {
            logger.atDebug().addArgument(correlationId).log("Dropping reply with unknown correlation id {}");
            return false;
        }
        T data;
        try {
            data = serializer.deserialize(body);
        } catch (SerializationException e) {
            return correlations.reject(correlationId, e);
        }
        return correlations.resolve(correlationId, data);
    }

    public String newCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Registers a pending call; must happen before the request is sent.
     */
    public CompletableFuture<T> awaitResponse(String event, String correlationId, Duration timeout,
            CompletionStage<?> cancellation) {
        ensureOpen();
        metrics.recordCall(event);
        CompletableFuture<T> response = correlations.register(correlationId, timeout, cancellation);
        response.whenComplete((r, e) -> {
            if (e != null) {
                metrics.recordCallFailure(failureReason(e));
            }
        });
        return response;
    }

    public boolean rejectCall(String correlationId, Throwable error) {
        return correlations.reject(correlationId, error);
    }

    public int pendingCalls() {
        return correlations.size();
    }

    public int failPendingCalls(Throwable cause) {
        int failed = correlations.failAll(cause);
        if (failed > 0) {
            logger.atWarn().addArgument(failed).setCause(cause).log("Failed {} outstanding calls");
        }
        return failed;
    }

    public void addListener(BrokerListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(BrokerListener listener) {
        listeners.remove(listener);
    }

    public void emitError(Throwable error) {
        logger.atWarn().setCause(error).log("Broker error");
        for (BrokerListener l : listeners) {
            try {
                l.onError(error);
            } catch (Exception e) {
                logger.atError().setCause(e).log("Error listener failed");
            }
        }
    }

    public void emitClose(Throwable cause) {
        logger.atWarn().setCause(cause).log("Broker connection closed");
        for (BrokerListener l : listeners) {
            try {
                l.onClose(cause);
            } catch (Exception e) {
                logger.atError().setCause(e).log("Close listener failed");
            }
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            failPendingCalls(new ConnectionLostException("Broker closed"));
            eventSubscribers.clear();
            listeners.clear();
        }
    }

    private static String failureReason(Throwable e) {
        if (e instanceof CallTimeoutException) {
            return "timeout";
        }
        if (e instanceof CallCancelledException || e instanceof CancellationException) {
            return "cancelled";
        }
        if (e instanceof ConnectionLostException) {
            return "connection_lost";
        }
        return "error";
    }
}
