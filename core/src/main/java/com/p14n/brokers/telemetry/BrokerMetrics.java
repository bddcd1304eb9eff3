package com.p14n.brokers.telemetry;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongUpDownCounter;
import io.opentelemetry.api.metrics.Meter;

/**
 * Manages OpenTelemetry metrics for broker operations.
 *
 * <p>
 * Instruments:
 * </p>
 * <ul>
 * <li>messages_published: messages handed to the transport per event</li>
 * <li>messages_received: inbound messages decoded per event</li>
 * <li>active_subscriptions: transport consumers currently registered per
 * event</li>
 * <li>rpc_calls: calls issued per event</li>
 * <li>rpc_failures: calls completed by timeout, cancellation or connection
 * loss, per reason</li>
 * <li>reconnects: reconnect attempts scheduled</li>
 * </ul>
 */
public class BrokerMetrics {
        private static final AttributeKey<String> EVENT = AttributeKey.stringKey("event");
        private static final AttributeKey<String> REASON = AttributeKey.stringKey("reason");

        private final LongCounter publishedMessages;
        private final LongCounter receivedMessages;
        private final LongUpDownCounter activeSubscriptions;
        private final LongCounter calls;
        private final LongCounter callFailures;
        private final LongCounter reconnects;

        /**
         * Creates a new BrokerMetrics instance with the provided OpenTelemetry meter.
         *
         * @param meter OpenTelemetry meter used to create the metric instruments
         */
        public BrokerMetrics(Meter meter) {
                publishedMessages = meter.counterBuilder("messages_published")
                                .setDescription("Number of messages published")
                                .build();

                receivedMessages = meter.counterBuilder("messages_received")
                                .setDescription("Number of messages received from the transport")
                                .build();

                activeSubscriptions = meter.upDownCounterBuilder("active_subscriptions")
                                .setDescription("Number of active transport consumers")
                                .build();

                calls = meter.counterBuilder("rpc_calls")
                                .setDescription("Number of request/response calls issued")
                                .build();

                callFailures = meter.counterBuilder("rpc_failures")
                                .setDescription("Number of calls that completed without a reply")
                                .build();

                reconnects = meter.counterBuilder("reconnects")
                                .setDescription("Number of scheduled reconnect attempts")
                                .build();
        }

        public void recordPublished(String event) {
                publishedMessages.add(1, Attributes.of(EVENT, event));
        }

        public void recordReceived(String event) {
                receivedMessages.add(1, Attributes.of(EVENT, event));
        }

        public void recordSubscriptionAdded(String event) {
                activeSubscriptions.add(1, Attributes.of(EVENT, event));
        }

        public void recordSubscriptionRemoved(String event) {
                activeSubscriptions.add(-1, Attributes.of(EVENT, event));
        }

        public void recordCall(String event) {
                calls.add(1, Attributes.of(EVENT, event));
        }

        /**
         * @param reason short failure kind, e.g. {@code timeout}
         */
        public void recordCallFailure(String reason) {
                callFailures.add(1, Attributes.of(REASON, reason));
        }

        public void recordReconnect() {
                reconnects.add(1);
        }
}
