package com.p14n.brokers.broker;

/**
 * Raised when an inbound message could not be decoded or when at least one
 * subscriber failed on it. Further subscriber failures for the same message are
 * attached as suppressed exceptions.
 */
public class DispatchException extends BrokerException {

    private final String event;

    public DispatchException(String event, String message, Throwable cause) {
        super(message, cause);
        this.event = event;
    }

    public String event() {
        return event;
    }
}
