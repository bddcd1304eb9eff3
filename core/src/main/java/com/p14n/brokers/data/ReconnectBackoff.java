package com.p14n.brokers.data;

/**
 * Computes the delay before a reconnect attempt.
 *
 * <pre>
 * delay = min(reconnectTimeout * multiplier^(attempt-1), maxReconnectTimeout)
 * </pre>
 *
 * <p>
 * With the default multiplier of 1.0 every attempt waits the configured
 * reconnect timeout. There is no attempt limit.
 * </p>
 */
public class ReconnectBackoff {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double multiplier;

    public ReconnectBackoff(BrokerConfig config) {
        this(config.reconnectTimeout().toMillis(), config.maxReconnectTimeout().toMillis(),
                config.reconnectMultiplier());
    }

    public ReconnectBackoff(long baseDelayMs, long maxDelayMs, double multiplier) {
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException(
                    "baseDelayMs must not be negative (current: " + baseDelayMs + ")");
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                    "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException(
                    "multiplier must be at least 1.0 (current: " + multiplier + ")");
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.multiplier = multiplier;
    }

    /**
     * @param attempt the attempt about to be made, starting at 1
     * @return the delay in milliseconds
     */
    public long delayMillis(int attempt) {
        if (attempt <= 0) {
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        }
        double delay = baseDelayMs * Math.pow(multiplier, attempt - 1);
        // pow overflows to infinity for long outages
        if (Double.isInfinite(delay) || delay >= maxDelayMs) {
            return maxDelayMs;
        }
        return (long) delay;
    }
}
