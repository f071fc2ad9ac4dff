package com.questrail.peerlink.api;

/**
 * An inbound frame could not be turned into a message: it is shorter than the
 * type key, or its body does not deserialize into the registered type.
 *
 * <p>Terminates the read loop of the connection that received it.</p>
 */
public final class MessageDecodeException extends NetworkException
{
    public MessageDecodeException(String message) {
        super(message);
    }

    public MessageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
