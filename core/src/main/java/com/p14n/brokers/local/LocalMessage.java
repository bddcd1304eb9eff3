package com.p14n.brokers.local;

import java.util.Map;

/**
 * A message travelling through a {@link LocalExchange}.
 *
 * @param routingKey    The event name
 * @param body          The encoded payload
 * @param replyTo       Queue expecting the reply, or null
 * @param correlationId Correlation id of a request or reply, or null
 * @param headers       Application headers
 */
public record LocalMessage(String routingKey,
        byte[] body,
        String replyTo,
        String correlationId,
        Map<String, Object> headers) {

    public LocalMessage {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }
}
