package com.p14n.brokers.broker;

import java.time.Duration;
import java.util.concurrent.CompletionStage;

/**
 * Options for a request/response call.
 *
 * @param timeout      How long to wait for the reply; null uses the broker
 *                     default, which itself may be null for no limit
 * @param cancellation Completing this stage abandons the call locally; may be
 *                     null
 * @param publish      Properties of the request message
 */
public record CallOptions(Duration timeout, CompletionStage<?> cancellation, PublishOptions publish) {

    private static final CallOptions DEFAULTS = new CallOptions(null, null, PublishOptions.defaults());

    public CallOptions {
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        publish = publish == null ? PublishOptions.defaults() : publish;
    }

    public static CallOptions defaults() {
        return DEFAULTS;
    }

    public static CallOptions withTimeout(Duration timeout) {
        return new CallOptions(timeout, null, PublishOptions.defaults());
    }

    public CallOptions cancelledBy(CompletionStage<?> cancellation) {
        return new CallOptions(timeout, cancellation, publish);
    }

    public CallOptions withPublish(PublishOptions publish) {
        return new CallOptions(timeout, cancellation, publish);
    }
}
