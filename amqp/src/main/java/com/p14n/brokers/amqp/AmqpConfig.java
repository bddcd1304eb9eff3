package com.p14n.brokers.amqp;

import com.p14n.brokers.data.BrokerConfig;

/**
 * Configuration of an {@link AmqpBroker}. The group is also the name of the
 * direct exchange the broker publishes to.
 */
public interface AmqpConfig extends BrokerConfig {

    /**
     * @return options for event consumers
     */
    ConsumeOptions consume();

    /**
     * @return options for asserting event queues
     */
    QueueOptions queueOptions();
}
