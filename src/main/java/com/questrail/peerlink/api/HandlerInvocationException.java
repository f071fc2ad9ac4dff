package com.questrail.peerlink.api;

/**
 * Wraps an exception thrown by an application message handler so it can be
 * reported. It is never propagated; the connection keeps processing.
 */
public final class HandlerInvocationException extends NetworkException
{
    public HandlerInvocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
