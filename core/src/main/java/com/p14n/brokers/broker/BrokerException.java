package com.p14n.brokers.broker;

/**
 * Base type of every fault raised by a broker.
 */
public class BrokerException extends RuntimeException {

    public BrokerException(String message) {
        super(message);
    }

    public BrokerException(String message, Throwable cause) {
        super(message, cause);
    }
}
