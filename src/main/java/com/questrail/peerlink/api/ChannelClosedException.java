package com.questrail.peerlink.api;

/**
 * The underlying transport channel is closed, or was closed by the transport
 * because the peer stopped responding.
 */
public final class ChannelClosedException extends NetworkException
{
    public ChannelClosedException(String message) {
        super(message);
    }
}
