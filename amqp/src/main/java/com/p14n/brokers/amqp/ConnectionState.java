package com.p14n.brokers.amqp;

/**
 * Connection lifecycle of an {@link AmqpBroker}.
 *
 * <pre>
 * DISCONNECTED -> CONNECTING -> CONNECTED
 * CONNECTED -> CONNECTING     (non-fatal loss, reconnect scheduled)
 * CONNECTED -> DISCONNECTED   (fatal loss or close)
 * </pre>
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED
}
