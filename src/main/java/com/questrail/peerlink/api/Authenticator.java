package com.questrail.peerlink.api;

import com.questrail.peerlink.connection.NetworkConnection;

import java.util.concurrent.CompletionStage;

/**
 * Authenticator
 * -----------------------------------------------------------------------------
 * Application capability that decides whether a freshly connected peer may
 * exchange application traffic.
 *
 * <p>The runtime calls one of these methods right after the connection's
 * {@code connected} notification and before its read loop starts. Until the
 * returned stage completes with {@code true}, handlers registered with
 * {@code requireAuthenticated = true} do not run for that connection.
 * Completing with {@code false}, or exceptionally, disconnects the peer.</p>
 *
 * <p>An authenticator usually registers its own handshake handlers with
 * {@code requireAuthenticated = false} on the connection it is given and sends
 * credentials through it. Handlers may be added while the read loop is
 * running.</p>
 */
public interface Authenticator
{
    /**
     * Server side: decide whether to admit the peer behind {@code connection}.
     */
    CompletionStage<Boolean> onServerAuthenticate(NetworkConnection connection);

    /**
     * Client side: prove this client to the server behind {@code connection}.
     */
    CompletionStage<Boolean> onClientAuthenticate(NetworkConnection connection);
}
