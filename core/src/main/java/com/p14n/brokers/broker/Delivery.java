package com.p14n.brokers.broker;

/**
 * A decoded inbound message together with its response affordances.
 *
 * @param event    The event name the message was routed with
 * @param data     The decoded payload
 * @param response The transport specific response capability
 * @param <T>      The payload type
 * @param <R>      The responder type
 */
public record Delivery<T, R extends Responder<T>>(String event, T data, R response) {
}
