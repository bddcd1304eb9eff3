package com.p14n.brokers.amqp;

import java.time.Duration;
import java.util.Properties;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AmqpConfigDataTest {

    @Test
    void shouldApplyDefaults() {
        var config = new AmqpConfigData(null);

        assertEquals("default", config.group());
        assertNull(config.subgroup());
        assertFalse(config.rpc());
        assertEquals(Duration.ofSeconds(10), config.reconnectTimeout());
        assertEquals(Duration.ofSeconds(10), config.maxReconnectTimeout());
        assertEquals(1.0, config.reconnectMultiplier());
        assertEquals(ConsumeOptions.defaults(), config.consume());
        assertEquals(QueueOptions.defaults(), config.queueOptions());
    }

    @Test
    void shouldReadProperties() {
        var props = new Properties();
        props.setProperty("amqp.group", "orders");
        props.setProperty("amqp.subgroup", "audit");
        props.setProperty("amqp.rpc", "true");
        props.setProperty("amqp.reconnectTimeoutMs", "500");
        props.setProperty("amqp.reconnectMultiplier", "2");
        props.setProperty("amqp.maxReconnectTimeoutMs", "4000");
        props.setProperty("amqp.callTimeoutMs", "1500");
        props.setProperty("amqp.prefetch", "20");
        props.setProperty("amqp.durable", "false");
        props.setProperty("amqp.autoDelete", "true");

        var config = AmqpConfigData.fromProperties(props);

        assertEquals("orders", config.group());
        assertEquals("audit", config.subgroup());
        assertTrue(config.rpc());
        assertEquals(Duration.ofMillis(500), config.reconnectTimeout());
        assertEquals(2.0, config.reconnectMultiplier());
        assertEquals(Duration.ofMillis(4000), config.maxReconnectTimeout());
        assertEquals(Duration.ofMillis(1500), config.callTimeout());
        assertEquals(20, config.consume().prefetch());
        assertFalse(config.queueOptions().durable());
        assertTrue(config.queueOptions().autoDelete());
    }

    @Test
    void shouldRejectMalformedNumbers() {
        var props = new Properties();
        props.setProperty("amqp.prefetch", "lots");

        assertThrows(IllegalArgumentException.class, () -> AmqpConfigData.fromProperties(props));
    }

    @Test
    void shouldCopyWithChanges() {
        var config = new AmqpConfigData("g", null, true)
                .withCallTimeout(Duration.ofSeconds(2))
                .withReconnectBackoff(1.5, Duration.ofMinutes(1));

        assertEquals("g", config.group());
        assertEquals(Duration.ofSeconds(2), config.callTimeout());
        assertEquals(1.5, config.reconnectMultiplier());
        assertEquals(Duration.ofMinutes(1), config.maxReconnectTimeout());
    }
}
