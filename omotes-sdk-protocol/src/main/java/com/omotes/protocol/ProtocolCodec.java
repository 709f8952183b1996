package com.omotes.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Objects;

/**
 * Encodes and decodes protocol messages to and from their binary wire form (UTF-8 JSON).
 * Null fields are omitted when encoding so that field presence survives a round trip;
 * unknown fields are ignored when decoding so older peers can read newer messages.
 */
public final class ProtocolCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private ProtocolCodec() {
    }

    /**
     * Serializes a protocol message.
     *
     * @param message the message to encode
     * @return wire bytes
     * @throws ProtocolException when the message cannot be serialized
     */
    public static byte[] encode(Object message) {
        Objects.requireNonNull(message, "message");
        try {
            return MAPPER.writeValueAsBytes(message);
        } catch (IOException e) {
            throw new ProtocolException("Failed to encode " + message.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Deserializes a protocol message of the given type.
     *
     * @param bytes wire bytes as received from the message bus
     * @param type  expected message class
     * @return the decoded message (never null)
     * @throws ProtocolException when the bytes are empty or not a valid message of that type
     */
    public static <T> T decode(byte[] bytes, Class<T> type) {
        Objects.requireNonNull(type, "type");
        if (bytes == null || bytes.length == 0) {
            throw new ProtocolException("Cannot decode " + type.getSimpleName() + " from an empty message");
        }
        try {
            T message = MAPPER.readValue(bytes, type);
            if (message == null) {
                throw new ProtocolException("Decoded " + type.getSimpleName() + " is null");
            }
            return message;
        } catch (IOException e) {
            throw new ProtocolException("Failed to decode " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }
}
