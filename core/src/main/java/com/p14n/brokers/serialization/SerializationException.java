package com.p14n.brokers.serialization;

import com.p14n.brokers.broker.BrokerException;

/**
 * Raised when a value cannot be encoded or a message body cannot be decoded.
 */
public class SerializationException extends BrokerException {

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
