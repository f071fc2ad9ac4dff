package com.questrail.peerlink.server;

import com.questrail.peerlink.api.Authenticator;
import com.questrail.peerlink.api.CapacityExceededException;
import com.questrail.peerlink.api.ChannelKind;
import com.questrail.peerlink.api.MissingTransportException;
import com.questrail.peerlink.api.ServerState;
import com.questrail.peerlink.config.ServerConfig;
import com.questrail.peerlink.connection.AuthenticationGate;
import com.questrail.peerlink.connection.JacksonMessageSerializer;
import com.questrail.peerlink.connection.MessagePacker;
import com.questrail.peerlink.connection.MessageSerializer;
import com.questrail.peerlink.connection.NetworkConnection;
import com.questrail.peerlink.event.NetworkEvent;
import com.questrail.peerlink.internal.exec.RuntimeExecutors;
import com.questrail.peerlink.internal.time.MonotonicClock;
import com.questrail.peerlink.internal.time.SystemMonotonicClock;
import com.questrail.peerlink.observability.ConnectionEvent;
import com.questrail.peerlink.observability.NetworkErrorEvent;
import com.questrail.peerlink.observability.NetworkObservabilitySink;
import com.questrail.peerlink.observability.Role;
import com.questrail.peerlink.observability.Slf4jNetworkObservabilitySink;
import com.questrail.peerlink.observability.StateTransitionEvent;
import com.questrail.peerlink.time.NetworkPingMessage;
import com.questrail.peerlink.time.NetworkTime;
import com.questrail.peerlink.transport.Transport;
import com.questrail.peerlink.transport.TransportChannel;
import com.questrail.peerlink.transport.TransportListener;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicReference;

/**
 * NetworkServer
 * =============================================================================
 * Server role: admits peers from a {@link Transport} (or from in-process
 * host-mode clients), owns their {@link NetworkConnection}s and broadcasts to
 * them.
 *
 * <h2>State machine</h2>
 * <pre>
 *   IDLE --listenAsync--> LISTENING --disconnect--> IDLE
 * </pre>
 * The machine is restartable: after {@link #disconnect()} the server may listen
 * again.
 *
 * <h2>Admission</h2>
 * Every new channel, remote or local, goes through {@link #accept(TransportChannel)}:
 * <ol>
 *   <li>At {@code maxConnections}: the peer is disconnected immediately and
 *       never enters the active set.</li>
 *   <li>Otherwise: add to the active set, fire {@link #connected()}, start
 *       authentication, start the read loop.</li>
 * </ol>
 * The check and the add happen under one lock, so concurrent accepts cannot
 * overshoot the limit. Removal happens only when the read loop ends, which also
 * fires {@link #disconnected()} exactly once per admitted connection.
 *
 * <h2>Default handlers</h2>
 * Every admitted connection answers time-sync pings; that handler does not
 * require authentication.
 */
public final class NetworkServer implements AutoCloseable {

    private final Transport transport;
    private final Authenticator authenticator;
    private final NetworkObservabilitySink sink;
    private final ServerConfig config;
    private final MessagePacker packer;
    private final MonotonicClock clock;
    private final Executor executor;
    private final ExecutorService ownedExecutor;

    private final AtomicReference<ServerState> state = new AtomicReference<>(ServerState.IDLE);
    private final Set<NetworkConnection> connections = ConcurrentHashMap.newKeySet();
    private final Object admissionLock = new Object();
    private final AuthenticationGate authenticationGate;
    private final TransportListener transportListener = new ServerTransportListener();

    private final NetworkEvent<NetworkServer> started;
    private final NetworkEvent<NetworkConnection> connected;
    private final NetworkEvent<NetworkConnection> authenticated;
    private final NetworkEvent<NetworkConnection> disconnected;
    private final NetworkEvent<NetworkServer> stopped;

    private NetworkServer(Builder b) {
        this.transport = b.transport;
        this.authenticator = b.authenticator;
        this.sink = Objects.requireNonNull(b.sink, "sink");
        this.config = Objects.requireNonNull(b.config, "config");
        this.packer = new MessagePacker(Objects.requireNonNull(b.serializer, "serializer"));
        this.clock = Objects.requireNonNull(b.clock, "clock");
        this.ownedExecutor = b.executor == null ? RuntimeExecutors.newReadLoopPool("peerlink-server") : null;
        this.executor = b.executor != null ? b.executor : ownedExecutor;

        this.started = new NetworkEvent<>("server.started", sink);
        this.connected = new NetworkEvent<>("server.connected", sink);
        this.authenticated = new NetworkEvent<>("server.authenticated", sink);
        this.disconnected = new NetworkEvent<>("server.disconnected", sink);
        this.stopped = new NetworkEvent<>("server.stopped", sink);

        this.authenticationGate = new AuthenticationGate(authenticator, Role.SERVER, sink, authenticated::invoke);
    }

    public static Builder builder() {
        return new Builder();
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    /**
     * Start accepting peers.
     *
     * <p>Fails with {@link MissingTransportException} when the config asks for
     * listening and no transport is set, and with {@link IllegalStateException}
     * when already listening. With {@code listening = false} the server becomes
     * active without touching any transport.</p>
     */
    public CompletableFuture<Void> listenAsync() {
        if (config.listening() && transport == null) {
            return CompletableFuture.failedFuture(
                new MissingTransportException("No transport configured for listening server"));
        }
        if (!transition(ServerState.IDLE, ServerState.LISTENING)) {
            return CompletableFuture.failedFuture(new IllegalStateException("Server is already listening"));
        }

        if (!config.listening()) {
            started.invoke(this);
            return CompletableFuture.completedFuture(null);
        }

        CompletableFuture<Void> bound;
        try {
            bound = transport.listenAsync(transportListener);
        } catch (RuntimeException e) {
            bound = CompletableFuture.failedFuture(e);
        }

        return bound.handle((ignored, error) -> {
            if (error != null) {
                Throwable cause = unwrap(error);
                transition(ServerState.LISTENING, ServerState.IDLE);
                sink.onError(new NetworkErrorEvent(Instant.now(), "Server listen failed", cause));
                throw new CompletionException(cause);
            }
            started.invoke(this);
            return null;
        });
    }

    /**
     * Disconnect every active connection and stop listening. Safe to call in
     * any state.
     */
    public void disconnect() {
        // No accept can land after the snapshot once LISTENING is left under the lock.
        boolean wasListening;
        List<NetworkConnection> snapshot;
        synchronized (admissionLock) {
            wasListening = transition(ServerState.LISTENING, ServerState.IDLE);
            snapshot = List.copyOf(connections);
        }

        for (NetworkConnection connection : snapshot) {
            connection.disconnect();
        }

        if (wasListening && transport != null && config.listening()) {
            try {
                transport.disconnect();
            } catch (RuntimeException e) {
                sink.onError(new NetworkErrorEvent(Instant.now(), "Transport disconnect failed", e));
            }
        }
        if (wasListening) {
            stopped.invoke(this);
        }
    }

    /**
     * Disconnect, then shut down the read-loop pool if this server created it.
     * An injected executor is left running.
     */
    @Override
    public void close() {
        disconnect();
        if (ownedExecutor != null) {
            RuntimeExecutors.shutdown(ownedExecutor);
        }
    }

    // The transport stopped on its own; admitted connections stay up.
    private void stop() {
        boolean stoppedNow;
        synchronized (admissionLock) {
            stoppedNow = transition(ServerState.LISTENING, ServerState.IDLE);
        }
        if (stoppedNow) {
            stopped.invoke(this);
        }
    }

    // -------------------------------------------------------------------------
    // Admission
    // -------------------------------------------------------------------------

    /**
     * Run admission for a newly established channel. Called by the transport
     * listener for remote peers and by host-mode clients for the server end of
     * their pipe.
     *
     * @return {@code true} if the peer was admitted, {@code false} if it was
     *         rejected for capacity and disconnected
     * @throws IllegalStateException if the server is not listening; the channel
     *                               is closed
     */
    public boolean accept(TransportChannel channel) {
        Objects.requireNonNull(channel, "channel");
        NetworkConnection connection = new NetworkConnection(channel, packer, Role.SERVER, sink);

        boolean admitted;
        synchronized (admissionLock) {
            if (state.get() != ServerState.LISTENING) {
                channel.close();
                throw new IllegalStateException("Server is not listening");
            }
            admitted = connections.size() < config.maxConnections() && connections.add(connection);
        }

        if (!admitted) {
            connection.disconnect();
            sink.onConnectionEvent(connection.lifecycleEvent(ConnectionEvent.Kind.REJECTED));
            sink.onError(new NetworkErrorEvent(
                Instant.now(),
                "Rejected " + connection,
                new CapacityExceededException(config.maxConnections())));
            return false;
        }

        sink.onConnectionEvent(connection.lifecycleEvent(ConnectionEvent.Kind.ACCEPTED));
        connection.registerHandler(NetworkPingMessage.class, NetworkTime.serverPingHandler(clock), false);

        connected.invoke(connection);
        authenticationGate.begin(connection);

        connection.processMessagesAsync(executor)
            .whenComplete((ignored, error) -> onConnectionClosed(connection, error));
        return true;
    }

    private void onConnectionClosed(NetworkConnection connection, Throwable error) {
        if (error != null) {
            sink.onError(new NetworkErrorEvent(
                Instant.now(), "Read loop of " + connection + " terminated", unwrap(error)));
        }
        if (connections.remove(connection)) {
            connection.setOwnedEntity(null);
            sink.onConnectionEvent(connection.lifecycleEvent(ConnectionEvent.Kind.DISCONNECTED));
            disconnected.invoke(connection);
        }
    }

    // -------------------------------------------------------------------------
    // Messaging
    // -------------------------------------------------------------------------

    public void sendToAll(Object message) {
        sendToAll(message, ChannelKind.RELIABLE);
    }

    /**
     * Send to every active connection. A failure for one peer is reported and
     * does not stop delivery to the rest.
     */
    public void sendToAll(Object message, ChannelKind kind) {
        NetworkConnection.send(List.copyOf(connections), message, kind);
    }

    // -------------------------------------------------------------------------
    // Queries and events
    // -------------------------------------------------------------------------

    public ServerState state() {
        return state.get();
    }

    public boolean isActive() {
        return state.get() == ServerState.LISTENING;
    }

    public int numPlayers() {
        return connections.size();
    }

    /**
     * Snapshot of the active connections.
     */
    public List<NetworkConnection> connections() {
        return List.copyOf(connections);
    }

    public ServerConfig config() {
        return config;
    }

    public Transport transport() {
        return transport;
    }

    public NetworkEvent<NetworkServer> started() {
        return started;
    }

    public NetworkEvent<NetworkConnection> connected() {
        return connected;
    }

    public NetworkEvent<NetworkConnection> authenticated() {
        return authenticated;
    }

    public NetworkEvent<NetworkConnection> disconnected() {
        return disconnected;
    }

    public NetworkEvent<NetworkServer> stopped() {
        return stopped;
    }

    private boolean transition(ServerState from, ServerState to) {
        if (!state.compareAndSet(from, to)) {
            return false;
        }
        sink.onStateTransition(new StateTransitionEvent(Instant.now(), Role.SERVER, from, to));
        return true;
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    private final class ServerTransportListener implements TransportListener {
        @Override
        public void onConnected(TransportChannel channel) {
            try {
                accept(channel);
            } catch (RuntimeException e) {
                sink.onError(new NetworkErrorEvent(Instant.now(), "Accept of " + channel + " failed", e));
            }
        }

        @Override
        public void onStopped(Throwable cause) {
            if (cause != null) {
                sink.onError(new NetworkErrorEvent(Instant.now(), "Transport stopped", cause));
            }
            stop();
        }
    }

    public static final class Builder {
        private Transport transport;
        private Authenticator authenticator;
        private NetworkObservabilitySink sink = new Slf4jNetworkObservabilitySink();
        private ServerConfig config = ServerConfig.defaults();
        private MessageSerializer serializer = new JacksonMessageSerializer();
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private Executor executor;

        public Builder withTransport(Transport transport) {
            this.transport = transport;
            return this;
        }

        public Builder withAuthenticator(Authenticator authenticator) {
            this.authenticator = authenticator;
            return this;
        }

        public Builder withObservabilitySink(NetworkObservabilitySink sink) {
            this.sink = sink;
            return this;
        }

        public Builder withConfig(ServerConfig config) {
            this.config = config;
            return this;
        }

        public Builder withSerializer(MessageSerializer serializer) {
            this.serializer = serializer;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Executor for read loops. Each admitted connection occupies one thread
         * of it until disconnected.
         */
        public Builder withExecutor(Executor executor) {
            this.executor = executor;
            return this;
        }

        public NetworkServer build() {
            return new NetworkServer(this);
        }
    }
}
