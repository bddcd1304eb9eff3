package com.p14n.brokers.data;

import java.time.Duration;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ReconnectBackoffTest {

    @Test
    void shouldUseFixedDelayByDefault() {
        var backoff = new ReconnectBackoff(new ConfigData("g", null, false, Duration.ofMillis(250), null));

        assertEquals(250, backoff.delayMillis(1));
        assertEquals(250, backoff.delayMillis(10));
    }

    @Test
    void shouldGrowUpToMaximum() {
        var backoff = new ReconnectBackoff(100, 1000, 2.0);

        assertEquals(100, backoff.delayMillis(1));
        assertEquals(200, backoff.delayMillis(2));
        assertEquals(800, backoff.delayMillis(4));
        assertEquals(1000, backoff.delayMillis(5));
        assertEquals(1000, backoff.delayMillis(5000));
    }

    @Test
    void shouldRejectInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> new ReconnectBackoff(-1, 10, 1.0));
        assertThrows(IllegalArgumentException.class, () -> new ReconnectBackoff(100, 10, 1.0));
        assertThrows(IllegalArgumentException.class, () -> new ReconnectBackoff(100, 1000, 0.5));
        assertThrows(IllegalArgumentException.class, () -> new ReconnectBackoff(100, 1000, 2.0).delayMillis(0));
    }
}
