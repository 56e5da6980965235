package io.restfn.json.spi;

import java.io.InputStream;
import java.lang.reflect.Type;

/**
 * Minimal JSON codec used by the default wire protocol.
 * Implementations wrap a specific JSON library (Jackson, Gson, etc.).
 *
 * <p>Decoding targets are {@link Type}s rather than classes so that handler parameters
 * such as {@code List<Order>} keep their element type.
 */
public interface JsonCodec {

    // ===== Serialization =====

    /**
     * Serializes a value to JSON bytes.
     * @param value the value to serialize (may be null, which encodes as {@code null})
     * @return JSON bytes
     * @throws JsonException if serialization fails
     */
    byte[] writeBytes(Object value) throws JsonException;

    // ===== Deserialization =====

    /**
     * Deserializes JSON bytes to a value of the given type.
     * @param data JSON bytes
     * @param type target type
     * @return deserialized value
     * @throws JsonException if deserialization fails
     */
    <T> T readValue(byte[] data, Type type) throws JsonException;

    /**
     * Deserializes a JSON input stream to a value of the given type.
     * @param input JSON input stream
     * @param type target type
     * @return deserialized value
     * @throws JsonException if deserialization fails
     */
    <T> T readValue(InputStream input, Type type) throws JsonException;
}
