package com.p14n.brokers.broker;

/**
 * A transport level consumer for one event.
 *
 * @param event  The subscribed event name
 * @param queue  The queue the consumer reads from
 * @param handle The transport handle used to cancel the consumer
 */
public record Subscription(String event, String queue, String handle) {
}
