package com.p14n.brokers.amqp;

import java.time.Duration;
import java.util.Properties;

/**
 * Implementation of AmqpConfig holding the settings of an {@link AmqpBroker}.
 *
 * <p>
 * Null values take their defaults: group {@code "default"}, a reconnect
 * timeout of 10 seconds, a maximum reconnect timeout equal to the reconnect
 * timeout, and the default consume and queue options. A multiplier below 1.0
 * is raised to 1.0.
 * </p>
 *
 * @param group               The broker group, also the exchange name
 * @param subgroup            Optional extra queue name segment, may be null
 * @param rpc                 Enables request/response calls
 * @param reconnectTimeout    Delay before the first reconnect attempt
 * @param callTimeout         Default reply window of a call, null for no limit
 * @param reconnectMultiplier Growth of the delay between consecutive attempts
 * @param maxReconnectTimeout Upper bound of the delay between attempts
 * @param consume             Options of the event consumers
 * @param queueOptions        Options used when asserting event queues
 */
public record AmqpConfigData(String group,
        String subgroup,
        boolean rpc,
        Duration reconnectTimeout,
        Duration callTimeout,
        double reconnectMultiplier,
        Duration maxReconnectTimeout,
        ConsumeOptions consume,
        QueueOptions queueOptions) implements AmqpConfig {

    /**
     * Prefix of the keys read by {@link #fromProperties(Properties)}.
     */
    public static final String PREFIX = "amqp.";

    public AmqpConfigData {
        group = group == null ? DEFAULT_GROUP : group;
        reconnectTimeout = reconnectTimeout == null ? DEFAULT_RECONNECT_TIMEOUT : reconnectTimeout;
        reconnectMultiplier = reconnectMultiplier < 1.0 ? 1.0 : reconnectMultiplier;
        maxReconnectTimeout = maxReconnectTimeout == null ? reconnectTimeout : maxReconnectTimeout;
        consume = consume == null ? ConsumeOptions.defaults() : consume;
        queueOptions = queueOptions == null ? QueueOptions.defaults() : queueOptions;
    }

    /**
     * Creates a configuration with a fixed reconnect delay and default options.
     *
     * @param group            The broker group
     * @param subgroup         Optional subgroup, may be null
     * @param rpc              Enables request/response calls
     * @param reconnectTimeout Delay between reconnect attempts
     */
    public AmqpConfigData(String group, String subgroup, boolean rpc, Duration reconnectTimeout) {
        this(group, subgroup, rpc, reconnectTimeout, null, 1.0, null, null, null);
    }

    /**
     * Creates a configuration with the default reconnect delay.
     *
     * @param group    The broker group
     * @param subgroup Optional subgroup, may be null
     * @param rpc      Enables request/response calls
     */
    public AmqpConfigData(String group, String subgroup, boolean rpc) {
        this(group, subgroup, rpc, DEFAULT_RECONNECT_TIMEOUT);
    }

    /**
     * Creates a publish/subscribe only configuration for a group.
     *
     * @param group The broker group
     */
    public AmqpConfigData(String group) {
        this(group, null, false);
    }

    /**
     * @param callTimeout The default reply window, null for no limit
     * @return a copy with the given call timeout
     */
    public AmqpConfigData withCallTimeout(Duration callTimeout) {
        return new AmqpConfigData(group, subgroup, rpc, reconnectTimeout, callTimeout, reconnectMultiplier,
                maxReconnectTimeout, consume, queueOptions);
    }

    /**
     * @param multiplier Growth of the delay between consecutive attempts
     * @param max        Upper bound of the delay
     * @return a copy with growing reconnect delays
     */
    public AmqpConfigData withReconnectBackoff(double multiplier, Duration max) {
        return new AmqpConfigData(group, subgroup, rpc, reconnectTimeout, callTimeout, multiplier, max, consume,
                queueOptions);
    }

    /**
     * @return a copy with the given consumer options
     */
    public AmqpConfigData withConsume(ConsumeOptions consume) {
        return new AmqpConfigData(group, subgroup, rpc, reconnectTimeout, callTimeout, reconnectMultiplier,
                maxReconnectTimeout, consume, queueOptions);
    }

    /**
     * @return a copy with the given queue options
     */
    public AmqpConfigData withQueueOptions(QueueOptions queueOptions) {
        return new AmqpConfigData(group, subgroup, rpc, reconnectTimeout, callTimeout, reconnectMultiplier,
                maxReconnectTimeout, consume, queueOptions);
    }

    /**
     * Reads a configuration from {@code amqp.*} properties. Missing keys keep
     * their defaults.
     *
     * <ul>
     * <li>{@code amqp.group}, {@code amqp.subgroup}, {@code amqp.rpc}</li>
     * <li>{@code amqp.reconnectTimeoutMs}, {@code amqp.reconnectMultiplier},
     * {@code amqp.maxReconnectTimeoutMs}</li>
     * <li>{@code amqp.callTimeoutMs}</li>
     * <li>{@code amqp.prefetch}, {@code amqp.autoAck}</li>
     * <li>{@code amqp.durable}, {@code amqp.autoDelete}</li>
     * </ul>
     *
     * @throws IllegalArgumentException if a numeric property is malformed
     */
    public static AmqpConfigData fromProperties(Properties props) {
        var consumeDefaults = ConsumeOptions.defaults();
        var queueDefaults = QueueOptions.defaults();
        var consume = new ConsumeOptions(
                bool(props, "autoAck", consumeDefaults.autoAck()),
                consumeDefaults.exclusive(),
                consumeDefaults.noLocal(),
                (int) number(props, "prefetch", consumeDefaults.prefetch()),
                consumeDefaults.arguments());
        var queue = new QueueOptions(
                bool(props, "durable", queueDefaults.durable()),
                queueDefaults.exclusive(),
                bool(props, "autoDelete", queueDefaults.autoDelete()),
                queueDefaults.arguments());
        String multiplier = props.getProperty(PREFIX + "reconnectMultiplier");
        return new AmqpConfigData(
                props.getProperty(PREFIX + "group"),
                props.getProperty(PREFIX + "subgroup"),
                bool(props, "rpc", false),
                duration(props, "reconnectTimeoutMs"),
                duration(props, "callTimeoutMs"),
                multiplier == null ? 1.0 : Double.parseDouble(multiplier.trim()),
                duration(props, "maxReconnectTimeoutMs"),
                consume,
                queue);
    }

    private static boolean bool(Properties props, String key, boolean fallback) {
        String value = props.getProperty(PREFIX + key);
        return value == null ? fallback : Boolean.parseBoolean(value.trim());
    }

    private static long number(Properties props, String key, long fallback) {
        String value = props.getProperty(PREFIX + key);
        if (value == null) {
            return fallback;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + PREFIX + key + " is not a number: " + value, e);
        }
    }

    private static Duration duration(Properties props, String key) {
        String value = props.getProperty(PREFIX + key);
        return value == null ? null : Duration.ofMillis(number(props, key, 0));
    }
}
