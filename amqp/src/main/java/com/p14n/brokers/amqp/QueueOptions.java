package com.p14n.brokers.amqp;

import java.util.Map;

/**
 * Options used when asserting event queues.
 *
 * @param durable    The queue survives a server restart
 * @param exclusive  The queue is used by this connection only
 * @param autoDelete The queue is deleted when its last consumer goes away
 * @param arguments  Extra queue arguments, e.g. {@code x-message-ttl}
 */
public record QueueOptions(boolean durable,
        boolean exclusive,
        boolean autoDelete,
        Map<String, Object> arguments) {

    private static final QueueOptions DEFAULTS = new QueueOptions(true, false, false, Map.of());

    public QueueOptions {
        arguments = arguments == null ? Map.of() : Map.copyOf(arguments);
    }

    public static QueueOptions defaults() {
        return DEFAULTS;
    }
}
