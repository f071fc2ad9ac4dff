package com.questrail.peerlink.connection;

import com.questrail.peerlink.api.Authenticator;
import com.questrail.peerlink.observability.ConnectionEvent;
import com.questrail.peerlink.observability.NetworkErrorEvent;
import com.questrail.peerlink.observability.NetworkObservabilitySink;
import com.questrail.peerlink.observability.Role;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;

/**
 * AuthenticationGate
 * -----------------------------------------------------------------------------
 * Promotes a connection to authenticated, either immediately (no authenticator
 * configured) or once the authenticator accepts it. Rejection or failure
 * disconnects the peer.
 *
 * <p>The callback fires at most once per connection, and never for a
 * connection that closed before the decision arrived.</p>
 */
public final class AuthenticationGate {

    private final Authenticator authenticator;
    private final Role role;
    private final NetworkObservabilitySink sink;
    private final Consumer<NetworkConnection> onAuthenticated;

    /**
     * @param authenticator   may be {@code null}: every connection is accepted
     * @param onAuthenticated called with each connection that passes
     */
    public AuthenticationGate(Authenticator authenticator,
                              Role role,
                              NetworkObservabilitySink sink,
                              Consumer<NetworkConnection> onAuthenticated) {
        this.authenticator = authenticator;
        this.role = Objects.requireNonNull(role, "role");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.onAuthenticated = Objects.requireNonNull(onAuthenticated, "onAuthenticated");
    }

    public void begin(NetworkConnection connection) {
        Objects.requireNonNull(connection, "connection");

        if (authenticator == null) {
            accept(connection);
            return;
        }

        CompletionStage<Boolean> decision;
        try {
            decision = role == Role.SERVER
                ? authenticator.onServerAuthenticate(connection)
                : authenticator.onClientAuthenticate(connection);
        } catch (RuntimeException e) {
            decision = CompletableFuture.failedFuture(e);
        }
        if (decision == null) {
            decision = CompletableFuture.failedFuture(
                new IllegalStateException("Authenticator returned no decision"));
        }

        decision.whenComplete((accepted, error) -> {
            if (error == null && Boolean.TRUE.equals(accepted)) {
                accept(connection);
            } else {
                reject(connection, error);
            }
        });
    }

    private void accept(NetworkConnection connection) {
        if (connection.isConnected() && connection.markAuthenticated()) {
            sink.onConnectionEvent(connection.lifecycleEvent(ConnectionEvent.Kind.AUTHENTICATED));
            onAuthenticated.accept(connection);
        }
    }

    private void reject(NetworkConnection connection, Throwable error) {
        sink.onConnectionEvent(connection.lifecycleEvent(ConnectionEvent.Kind.AUTHENTICATION_FAILED));
        if (error != null) {
            sink.onError(new NetworkErrorEvent(
                Instant.now(), "Authentication of " + connection + " failed", NetworkConnection.unwrap(error)));
        }
        connection.disconnect();
    }
}
