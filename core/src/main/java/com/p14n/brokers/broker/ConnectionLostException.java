package com.p14n.brokers.broker;

/**
 * Completes every outstanding call when the transport loses its connection or
 * the broker is closed.
 */
public class ConnectionLostException extends BrokerException {

    public ConnectionLostException(String message) {
        super(message);
    }

    public ConnectionLostException(String message, Throwable cause) {
        super(message, cause);
    }
}
