package com.p14n.brokers.broker;

/**
 * Completes a pending call that was abandoned through its cancellation signal.
 * The request may still be processed remotely; only the local wait is given up.
 */
public class CallCancelledException extends BrokerException {

    private final String correlationId;

    public CallCancelledException(String correlationId) {
        super("Call " + correlationId + " was cancelled");
        this.correlationId = correlationId;
    }

    public String correlationId() {
        return correlationId;
    }
}
