package com.questrail.peerlink.api;

/**
 * A server was asked to listen on the network without a transport.
 */
public final class MissingTransportException extends NetworkException
{
    public MissingTransportException(String message) {
        super(message);
    }
}
