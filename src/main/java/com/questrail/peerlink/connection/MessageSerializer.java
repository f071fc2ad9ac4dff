package com.questrail.peerlink.connection;

/**
 * Converts message bodies to and from bytes. The type key is handled by
 * {@link MessagePacker}; a serializer only sees the body.
 */
public interface MessageSerializer {

    /**
     * @throws IllegalArgumentException if the message cannot be serialized
     */
    byte[] serialize(Object message);

    /**
     * Read a body from {@code data[offset, offset + length)}.
     *
     * @throws com.questrail.peerlink.api.MessageDecodeException if the bytes do
     *         not form a valid {@code type}
     */
    <T> T deserialize(byte[] data, int offset, int length, Class<T> type);
}
