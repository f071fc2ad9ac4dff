package com.questrail.peerlink.api;

/**
 * A send was attempted without an open connection.
 */
public final class NotConnectedException extends NetworkException
{
    public NotConnectedException(String message) {
        super(message);
    }
}
