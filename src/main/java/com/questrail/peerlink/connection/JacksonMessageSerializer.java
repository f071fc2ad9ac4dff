package com.questrail.peerlink.connection;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.peerlink.api.MessageDecodeException;

import java.io.IOException;
import java.util.Objects;

/**
 * Default {@link MessageSerializer}: Jackson JSON for records and POJOs.
 *
 * <p>Unknown properties are ignored so a newer peer can add fields without
 * breaking an older one.</p>
 */
public final class JacksonMessageSerializer implements MessageSerializer {

    private final ObjectMapper objectMapper;

    public JacksonMessageSerializer() {
        this(createConfiguredObjectMapper());
    }

    public JacksonMessageSerializer(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public static ObjectMapper createConfiguredObjectMapper() {
        return new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public byte[] serialize(Object message) {
        Objects.requireNonNull(message, "message");
        try {
            return objectMapper.writeValueAsBytes(message);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + message.getClass().getName(), e);
        }
    }

    @Override
    public <T> T deserialize(byte[] data, int offset, int length, Class<T> type) {
        final T value;
        try {
            value = objectMapper.readValue(data, offset, length, type);
        } catch (IOException e) {
            throw new MessageDecodeException("Malformed " + type.getName() + " body", e);
        }
        if (value == null) {
            throw new MessageDecodeException("Empty " + type.getName() + " body");
        }
        return value;
    }
}
