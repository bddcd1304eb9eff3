package com.p14n.brokers.amqp;

import com.p14n.brokers.broker.BrokerException;

/**
 * Raised by operations that need the AMQP channel before {@code connect} has
 * completed, or while a lost connection is being re-established.
 */
public class NoChannelException extends BrokerException {

    public NoChannelException() {
        super("no available amqp channel");
    }
}
