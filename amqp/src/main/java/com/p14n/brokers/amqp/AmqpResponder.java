package com.p14n.brokers.amqp;

import com.p14n.brokers.broker.Responder;

/**
 * Response affordances of a message consumed from an AMQP queue.
 *
 * <p>
 * A message is settled exactly once: after {@link #ack}, {@link #nack} or
 * {@link #reject} any further settlement throws
 * {@link IllegalStateException}. Messages consumed with auto-ack are settled on
 * arrival. {@link #reply} is independent of settlement.
 * </p>
 *
 * @param <T> The payload type
 */
public interface AmqpResponder<T> extends Responder<T> {

    void ack();

    /**
     * @param allUpTo also settle every earlier unacknowledged message on the
     *                channel
     * @param requeue return the message to its queue
     */
    void nack(boolean allUpTo, boolean requeue);

    default void nack() {
        nack(false, true);
    }

    void reject(boolean requeue);

    default void reject() {
        reject(true);
    }

    boolean isSettled();
}
