package com.questrail.peerlink.connection;

import com.questrail.peerlink.api.MessageDecodeException;

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * MessagePacker
 * -----------------------------------------------------------------------------
 * Builds and parses message envelopes.
 *
 * <pre>
 *   +----------------------+---------------------------+
 *   | type key (4 bytes BE) | serialized body (N bytes) |
 *   +----------------------+---------------------------+
 * </pre>
 *
 * <p>Stream transports put their own 2-byte length prefix in front of the
 * envelope; that prefix never appears here.</p>
 */
public final class MessagePacker {

    public static final int TYPE_KEY_LENGTH = 4;

    private final MessageSerializer serializer;

    public MessagePacker(MessageSerializer serializer) {
        this.serializer = Objects.requireNonNull(serializer, "serializer");
    }

    public byte[] pack(Object message) {
        Objects.requireNonNull(message, "message");
        byte[] body = serializer.serialize(message);
        return ByteBuffer.allocate(TYPE_KEY_LENGTH + body.length)
            .putInt(MessageTypes.typeKey(message.getClass()))
            .put(body)
            .array();
    }

    /**
     * @throws MessageDecodeException if the frame is too short to hold a type key
     */
    public int unpackTypeKey(byte[] frame) {
        if (frame.length < TYPE_KEY_LENGTH) {
            throw new MessageDecodeException("Frame of " + frame.length + " bytes has no type key");
        }
        return ByteBuffer.wrap(frame, 0, TYPE_KEY_LENGTH).getInt();
    }

    /**
     * @throws MessageDecodeException if the body is not a valid {@code type}
     */
    public <T> T unpackBody(byte[] frame, Class<T> type) {
        return serializer.deserialize(frame, TYPE_KEY_LENGTH, frame.length - TYPE_KEY_LENGTH, type);
    }
}
