package com.p14n.brokers.data;

import java.time.Duration;

/**
 * Implementation of BrokerConfig for transports without options of their own.
 *
 * <p>
 * A null group or reconnect timeout takes the {@link BrokerConfig} default.
 * </p>
 *
 * @param group            The broker group; the exchange name for AMQP
 * @param subgroup         Optional extra queue name segment, may be null
 * @param rpc              Enables request/response calls
 * @param reconnectTimeout Delay before reconnecting after a connection failure
 * @param callTimeout      Default reply window of a call, null for no limit
 */
public record ConfigData(String group,
        String subgroup,
        boolean rpc,
        Duration reconnectTimeout,
        Duration callTimeout) implements BrokerConfig {

    public ConfigData {
        group = group == null ? DEFAULT_GROUP : group;
        reconnectTimeout = reconnectTimeout == null ? DEFAULT_RECONNECT_TIMEOUT : reconnectTimeout;
    }

    /**
     * Creates a configuration with the default reconnect timeout and no call
     * timeout.
     *
     * @param group    The broker group
     * @param subgroup Optional subgroup, may be null
     * @param rpc      Enables request/response calls
     */
    public ConfigData(String group, String subgroup, boolean rpc) {
        this(group, subgroup, rpc, DEFAULT_RECONNECT_TIMEOUT, null);
    }

    /**
     * Creates a publish/subscribe only configuration for a group.
     *
     * @param group The broker group
     */
    public ConfigData(String group) {
        this(group, null, false);
    }
}
