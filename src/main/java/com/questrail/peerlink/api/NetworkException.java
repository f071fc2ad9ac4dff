package com.questrail.peerlink.api;

/**
 * Root of the runtime's exception hierarchy.
 *
 * <p>All failures are unchecked. Asynchronous operations report them by
 * completing their {@code CompletableFuture} exceptionally; nothing in the
 * runtime lets one escape a read loop.</p>
 */
public class NetworkException extends RuntimeException
{
    public NetworkException(String message) {
        super(message);
    }

    public NetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}
