package com.p14n.brokers.serialization;

import java.io.IOException;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * JSON {@link Serializer} backed by Jackson.
 *
 * <p>
 * {@link #generic()} decodes bodies into plain structured values: maps, lists,
 * strings, numbers, booleans and null. {@link #of(Class)} binds bodies to a
 * concrete type.
 * </p>
 *
 * @param <T> The application value type
 */
public class JsonSerializer<T> implements Serializer<T> {

    private final static ObjectMapper DEFAULT_MAPPER = new ObjectMapper();

    private final ObjectMapper mapper;
    private final JavaType type;

    public JsonSerializer(ObjectMapper mapper, Class<T> type) {
        this.mapper = mapper;
        this.type = mapper.constructType(type);
    }

    public static JsonSerializer<Object> generic() {
        return new JsonSerializer<>(DEFAULT_MAPPER, Object.class);
    }

    public static <T> JsonSerializer<T> of(Class<T> type) {
        return new JsonSerializer<>(DEFAULT_MAPPER, type);
    }

    @Override
    public byte[] serialize(T value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (IOException e) {
            throw new SerializationException("Unable to encode value of " + classOf(value), e);
        }
    }

    @Override
    public T deserialize(byte[] body) {
        if (body == null) {
            throw new SerializationException("Message body is missing", null);
        }
        try {
            return mapper.readValue(body, type);
        } catch (IOException e) {
            throw new SerializationException("Unable to decode " + body.length + " bytes as " + type, e);
        }
    }

    private static String classOf(Object value) {
        return value == null ? "null" : value.getClass().getName();
    }
}
