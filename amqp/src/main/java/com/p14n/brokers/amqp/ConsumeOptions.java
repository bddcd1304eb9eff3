package com.p14n.brokers.amqp;

import java.util.Map;

/**
 * Options for the consumers registered by {@link AmqpBroker#subscribe}.
 *
 * @param autoAck   Messages are settled by the server on delivery
 * @param exclusive Only this consumer may read the queue
 * @param noLocal   Do not deliver messages published on this connection
 * @param prefetch  Channel prefetch count, 0 for unlimited
 * @param arguments Extra consumer arguments
 */
public record ConsumeOptions(boolean autoAck,
        boolean exclusive,
        boolean noLocal,
        int prefetch,
        Map<String, Object> arguments) {

    private static final ConsumeOptions DEFAULTS = new ConsumeOptions(false, false, false, 0, Map.of());

    public ConsumeOptions {
        if (prefetch < 0) {
            throw new IllegalArgumentException("prefetch must not be negative: " + prefetch);
        }
        arguments = arguments == null ? Map.of() : Map.copyOf(arguments);
    }

    public static ConsumeOptions defaults() {
        return DEFAULTS;
    }
}
