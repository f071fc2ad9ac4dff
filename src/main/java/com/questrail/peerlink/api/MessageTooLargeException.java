package com.questrail.peerlink.api;

/**
 * An encoded message exceeds the maximum size the channel declares for the
 * requested {@link ChannelKind}. Raised before anything reaches the wire.
 */
public final class MessageTooLargeException extends NetworkException
{
    private final int size;
    private final int maxSize;

    public MessageTooLargeException(int size, int maxSize) {
        super("Message of " + size + " bytes exceeds maximum of " + maxSize + " bytes");
        this.size = size;
        this.maxSize = maxSize;
    }

    public int size() {
        return size;
    }

    public int maxSize() {
        return maxSize;
    }
}
