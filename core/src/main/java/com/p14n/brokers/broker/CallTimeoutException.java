package com.p14n.brokers.broker;

import java.time.Duration;

/**
 * Completes a pending call when no correlated reply arrived within its window.
 */
public class CallTimeoutException extends BrokerException {

    private final String correlationId;
    private final Duration timeout;

    public CallTimeoutException(String correlationId, Duration timeout) {
        super("No reply for call " + correlationId + " within " + timeout.toMillis() + "ms");
        this.correlationId = correlationId;
        this.timeout = timeout;
    }

    public String correlationId() {
        return correlationId;
    }

    public Duration timeout() {
        return timeout;
    }
}
