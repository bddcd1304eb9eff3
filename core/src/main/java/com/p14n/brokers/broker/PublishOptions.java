package com.p14n.brokers.broker;

import java.util.HashMap;
import java.util.Map;

/**
 * Transport neutral message properties for a publish.
 *
 * @param headers     Application headers, never null
 * @param persistent  Ask the transport to persist the message where supported
 * @param priority    Message priority, or null
 * @param expiration  Per-message time to live in milliseconds, or null
 * @param contentType MIME type of the body, or null
 */
public record PublishOptions(Map<String, Object> headers,
        boolean persistent,
        Integer priority,
        Long expiration,
        String contentType) {

    private static final PublishOptions DEFAULTS = new PublishOptions(Map.of(), false, null, null, null);

    public PublishOptions {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static PublishOptions defaults() {
        return DEFAULTS;
    }

    public PublishOptions withHeader(String name, Object value) {
        var h = new HashMap<>(headers);
        h.put(name, value);
        return new PublishOptions(h, persistent, priority, expiration, contentType);
    }

    public PublishOptions withPersistent(boolean persistent) {
        return new PublishOptions(headers, persistent, priority, expiration, contentType);
    }

    public PublishOptions withPriority(Integer priority) {
        return new PublishOptions(headers, persistent, priority, expiration, contentType);
    }

    public PublishOptions withExpiration(Long expiration) {
        return new PublishOptions(headers, persistent, priority, expiration, contentType);
    }

    public PublishOptions withContentType(String contentType) {
        return new PublishOptions(headers, persistent, priority, expiration, contentType);
    }
}
