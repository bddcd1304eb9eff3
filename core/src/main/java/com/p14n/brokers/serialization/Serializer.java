package com.p14n.brokers.serialization;

/**
 * Converts application values to and from message bodies.
 *
 * @param <T> The application value type
 */
public interface Serializer<T> {

    /**
     * @param value the value to encode
     * @return the wire bytes
     * @throws SerializationException if the value cannot be encoded
     */
    byte[] serialize(T value);

    /**
     * @param body the wire bytes
     * @return the decoded value
     * @throws SerializationException if the body cannot be decoded
     */
    T deserialize(byte[] body);
}
