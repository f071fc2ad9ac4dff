package com.questrail.peerlink.transport;

import java.net.URI;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Transport
 * =============================================================================
 * Pluggable connection establishment over one medium.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #listenAsync(TransportListener)} starts accepting peers; the
 *       future completes once the transport is accepting</li>
 *   <li>{@link #disconnect()} stops accepting and reports
 *       {@link TransportListener#onStopped(Throwable)}; channels already handed
 *       out stay open until their owners close them</li>
 *   <li>{@link #close()} releases threads and sockets; the transport cannot be
 *       used afterwards</li>
 * </ul>
 *
 * <p>A stopped transport may listen again.</p>
 */
public interface Transport extends AutoCloseable
{
    /**
     * URI schemes this transport dials, preferred first.
     */
    List<String> schemes();

    /**
     * Start accepting peers. Fails with {@code IllegalStateException} if already
     * listening.
     */
    CompletableFuture<Void> listenAsync(TransportListener listener);

    /**
     * Dial a peer. Fails with {@code ConnectFailedException} when the peer is
     * unreachable, refuses, or does not answer within the dial timeout.
     */
    CompletableFuture<TransportChannel> connectAsync(URI uri);

    /**
     * Stop accepting peers. No-op when not listening.
     */
    void disconnect();

    @Override
    void close();
}
