package com.questrail.peerlink.transport.pipe;

import com.questrail.peerlink.api.ConnectFailedException;
import com.questrail.peerlink.transport.Transport;
import com.questrail.peerlink.transport.TransportChannel;
import com.questrail.peerlink.transport.TransportListener;

import java.net.URI;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * InMemoryTransport
 * -----------------------------------------------------------------------------
 * A {@link Transport} whose "network" is this object: a server listens on it
 * and any client holding the same instance dials it with a {@code mem:} URI.
 * Each dial creates a {@link PipeTransportChannel} pair and hands one end to
 * the listener.
 *
 * <p>The instance is shared explicitly between the roles; there is no
 * process-wide registry.</p>
 */
public final class InMemoryTransport implements Transport {

    public static final String SCHEME = "mem";

    private final int maxMessageSize;
    private final AtomicReference<TransportListener> listener = new AtomicReference<>();

    public InMemoryTransport() {
        this(Integer.MAX_VALUE);
    }

    /**
     * @param maxMessageSize frame limit applied to every pipe this transport creates
     */
    public InMemoryTransport(int maxMessageSize) {
        if (maxMessageSize <= 0) {
            throw new IllegalArgumentException("maxMessageSize must be > 0");
        }
        this.maxMessageSize = maxMessageSize;
    }

    @Override
    public List<String> schemes() {
        return List.of(SCHEME);
    }

    @Override
    public CompletableFuture<Void> listenAsync(TransportListener listener) {
        Objects.requireNonNull(listener, "listener");
        if (!this.listener.compareAndSet(null, listener)) {
            return CompletableFuture.failedFuture(new IllegalStateException("Already listening"));
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<TransportChannel> connectAsync(URI uri) {
        Objects.requireNonNull(uri, "uri");
        TransportListener l = listener.get();
        if (l == null) {
            return CompletableFuture.failedFuture(new ConnectFailedException("Nothing listening at " + uri));
        }

        PipeTransportChannel.Pipe pipe = PipeTransportChannel.createPipe(maxMessageSize);
        l.onConnected(pipe.second());
        return CompletableFuture.completedFuture(pipe.first());
    }

    @Override
    public void disconnect() {
        TransportListener l = listener.getAndSet(null);
        if (l != null) {
            l.onStopped(null);
        }
    }

    @Override
    public void close() {
        disconnect();
    }
}
