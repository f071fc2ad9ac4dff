package com.questrail.peerlink.api;

/**
 * A handler was registered for a type key that already has one on the same
 * connection. Raised for a second registration of the same type and for two
 * distinct types whose names hash to the same key.
 */
public final class DuplicateHandlerException extends NetworkException
{
    public DuplicateHandlerException(String message) {
        super(message);
    }
}
