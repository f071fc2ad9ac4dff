package com.questrail.peerlink.observability;

import java.net.SocketAddress;
import java.time.Instant;

/**
 * Lifecycle milestone of a single connection.
 *
 * @param remoteAddress peer address, {@code null} for in-memory channels
 */
public record ConnectionEvent(
    Instant timestamp,
    Role role,
    long connectionId,
    SocketAddress remoteAddress,
    Kind kind
) {
    public enum Kind {
        /** Admitted into the server's active set. */
        ACCEPTED,
        /** Refused by the server because it was full. */
        REJECTED,
        CONNECTED,
        AUTHENTICATED,
        /** The authenticator rejected the peer or failed. */
        AUTHENTICATION_FAILED,
        DISCONNECTED
    }
}
