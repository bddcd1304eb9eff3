package com.p14n.brokers.broker;

/**
 * Interface for message subscribers that can receive messages and error
 * notifications.
 *
 * @param <T> The type of messages this subscriber handles
 */
@FunctionalInterface
public interface MessageSubscriber<T> {

    /**
     * Called when a new message is available for processing.
     *
     * @param message The message to process
     */
    void onMessage(T message);

    /**
     * Called when this subscriber's own {@link #onMessage} failed.
     *
     * @param error The error that occurred
     */
    default void onError(Throwable error) {
    }
}
