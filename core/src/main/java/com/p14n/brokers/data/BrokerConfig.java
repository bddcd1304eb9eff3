package com.p14n.brokers.data;

import java.time.Duration;

/**
 * Configuration interface shared by every broker transport.
 * Defines naming of queues, request/response mode and reconnection timing.
 */
public interface BrokerConfig {

    /**
     * Default group used when none is configured.
     */
    String DEFAULT_GROUP = "default";

    /**
     * Default delay between reconnect attempts.
     */
    Duration DEFAULT_RECONNECT_TIMEOUT = Duration.ofSeconds(10);

    /**
     * Gets the group of this broker. For AMQP this is also the exchange name.
     *
     * @return The group name
     */
    String group();

    /**
     * Gets the optional subgroup, an extra identifier in queue names that lets
     * several groups of queues receive the same data.
     *
     * @return The subgroup or null
     */
    String subgroup();

    /**
     * Whether request/response calls are enabled.
     *
     * @return true in RPC mode
     */
    boolean rpc();

    /**
     * Gets the delay before the first reconnect attempt after a connection
     * failure.
     *
     * @return The reconnect delay
     */
    Duration reconnectTimeout();

    /**
     * Gets the default time a call waits for its reply.
     *
     * @return The call timeout, or null to wait indefinitely
     */
    Duration callTimeout();

    /**
     * Growth factor applied to the reconnect delay on consecutive failures.
     * The default of 1.0 keeps the delay fixed.
     *
     * @return The multiplier, at least 1.0
     */
    default double reconnectMultiplier() {
        return 1.0;
    }

    /**
     * Upper bound of the reconnect delay.
     *
     * @return The largest delay between attempts
     */
    default Duration maxReconnectTimeout() {
        return reconnectTimeout();
    }
}
