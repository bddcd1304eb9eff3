package com.p14n.brokers.serialization;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JsonSerializerTest {

    public record Order(String id, int quantity) {
    }

    @Test
    void shouldDecodeStructuredValues() {
        var serializer = JsonSerializer.generic();

        Object value = serializer.deserialize("{\"items\":[1,\"two\",null],\"ok\":true}"
                .getBytes(StandardCharsets.UTF_8));

        assertEquals(Map.of("items", java.util.Arrays.asList(1, "two", null), "ok", true), value);
    }

    @Test
    void shouldEncodeMapsAsJsonObjects() {
        var serializer = JsonSerializer.generic();

        String json = new String(serializer.serialize(Map.of("n", List.of(1, 2))), StandardCharsets.UTF_8);

        assertEquals("{\"n\":[1,2]}", json);
    }

    @Test
    void shouldBindToConcreteType() {
        var serializer = JsonSerializer.of(Order.class);

        Order order = serializer.deserialize(serializer.serialize(new Order("o-1", 3)));

        assertEquals(new Order("o-1", 3), order);
    }

    @Test
    void shouldRejectMalformedBody() {
        var serializer = JsonSerializer.generic();

        assertThrows(SerializationException.class,
                () -> serializer.deserialize("{oops".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void shouldRejectMissingBody() {
        assertThrows(SerializationException.class, () -> JsonSerializer.generic().deserialize(null));
    }
}
