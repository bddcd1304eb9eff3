package com.p14n.brokers.broker;

/**
 * Response capability handed to subscribers alongside each decoded message.
 * Transports extend it with their own settlement operations.
 *
 * @param <T> The payload type of the broker
 */
public interface Responder<T> {

    /**
     * Sends a reply to the caller of the message. May be used once.
     *
     * @param data The reply payload
     * @throws IllegalStateException if the message expects no reply or a reply
     *                               was already sent
     */
    void reply(T data);

    /**
     * @return true if the message carries a reply destination
     */
    boolean expectsReply();
}
