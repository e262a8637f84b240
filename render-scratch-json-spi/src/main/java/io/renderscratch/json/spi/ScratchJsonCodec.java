package io.renderscratch.json.spi;

import io.renderscratch.core.ScratchValue;

import java.io.InputStream;

/**
 * Minimal JSON codec for scratch values.
 * Implementations wrap specific JSON libraries and are discovered with {@link ScratchJsonCodecs}.
 *
 * <p>JSON has no counterpart for booleans or {@code null} in the scratch value model;
 * readers reject them.
 */
public interface ScratchJsonCodec {

    // ===== Serialization =====

    /**
     * Serializes a scratch value to a JSON byte array.
     * @param value the value to serialize
     * @return UTF-8 JSON bytes
     * @throws JsonException if serialization fails
     */
    byte[] writeBytes(ScratchValue value) throws JsonException;

    /**
     * Serializes a scratch value to a JSON string.
     * @param value the value to serialize
     * @return JSON string
     * @throws JsonException if serialization fails
     */
    String writeString(ScratchValue value) throws JsonException;

    // ===== Deserialization =====

    /**
     * Parses JSON bytes to a scratch value.
     * @param data JSON bytes
     * @return the parsed value
     * @throws JsonException if the data is not valid JSON or contains booleans or nulls
     */
    ScratchValue readValue(byte[] data) throws JsonException;

    /**
     * Parses a JSON string to a scratch value.
     * @param json JSON text
     * @return the parsed value
     * @throws JsonException if the text is not valid JSON or contains booleans or nulls
     */
    ScratchValue readValue(String json) throws JsonException;

    /**
     * Parses a JSON input stream to a scratch value. The stream is not closed.
     * @param input JSON input stream
     * @return the parsed value
     * @throws JsonException if the input is not valid JSON or contains booleans or nulls
     */
    ScratchValue readValue(InputStream input) throws JsonException;
}
