package com.p14n.brokers.broker;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Transport independent publish/subscribe and request/response broker.
 *
 * <p>
 * Operations never block the caller; those that need the transport complete a
 * future. Faults that happen after an operation returned, such as a failed
 * delivery or a subscriber throwing, are reported to the registered
 * {@link BrokerListener}s.
 * </p>
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * broker.subscribe(List.of("orders"), d -> {
 *     handle(d.data());
 *     d.response().reply(result);
 * }).join();
 *
 * broker.publish("orders", order);
 * Object answer = broker.call("orders", order, CallOptions.withTimeout(Duration.ofSeconds(5))).join();
 * }</pre>
 *
 * @param <T> The payload type
 * @param <R> The response capability handed to subscribers
 */
public interface Broker<T, R extends Responder<T>> extends AutoCloseable {

    /**
     * Registers a subscriber for events and makes sure the transport consumes
     * each of them. Subscribing to an event that already has a consumer only
     * adds the subscriber.
     *
     * @param events     The events to subscribe to
     * @param subscriber The subscriber receiving each decoded message
     * @return the transport subscription of every event, in request order
     */
    CompletableFuture<List<Subscription>> subscribe(Collection<String> events,
            MessageSubscriber<Delivery<T, R>> subscriber);

    default CompletableFuture<Subscription> subscribe(String event, MessageSubscriber<Delivery<T, R>> subscriber) {
        return subscribe(List.of(event), subscriber).thenApply(s -> s.get(0));
    }

    /**
     * Cancels the transport consumer and drops the subscribers of each event.
     *
     * @param events The events to unsubscribe from
     * @return per event, true if a consumer was cancelled and false if none was
     *         found
     */
    CompletableFuture<Map<String, Boolean>> unsubscribe(Collection<String> events);

    default CompletableFuture<Boolean> unsubscribe(String event) {
        return unsubscribe(List.of(event)).thenApply(r -> r.get(event));
    }

    /**
     * Sends a message without waiting for any acknowledgement. Delivery failures
     * are reported through {@link BrokerListener#onError}.
     *
     * @param event   The event, used as routing key
     * @param data    The payload
     * @param options Message properties
     */
    void publish(String event, T data, PublishOptions options);

    default void publish(String event, T data) {
        publish(event, data, PublishOptions.defaults());
    }

    /**
     * Sends a request and waits for exactly one correlated reply.
     *
     * @param event   The event, used as routing key
     * @param data    The request payload
     * @param options Timeout, cancellation and message properties
     * @return the decoded reply; fails with {@link CallTimeoutException},
     *         {@link CallCancelledException} or {@link ConnectionLostException}
     */
    CompletableFuture<T> call(String event, T data, CallOptions options);

    default CompletableFuture<T> call(String event, T data) {
        return call(event, data, CallOptions.defaults());
    }

    void addListener(BrokerListener listener);

    void removeListener(BrokerListener listener);

    /**
     * Stops the broker, failing outstanding calls and releasing the transport.
     */
    @Override
    void close();
}
