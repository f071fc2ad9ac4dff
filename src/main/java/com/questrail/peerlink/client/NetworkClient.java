package com.questrail.peerlink.client;

import com.questrail.peerlink.api.Authenticator;
import com.questrail.peerlink.api.ChannelKind;
import com.questrail.peerlink.api.ConnectFailedException;
import com.questrail.peerlink.api.ConnectState;
import com.questrail.peerlink.api.NotConnectedException;
import com.questrail.peerlink.config.ClientConfig;
import com.questrail.peerlink.connection.AuthenticationGate;
import com.questrail.peerlink.connection.JacksonMessageSerializer;
import com.questrail.peerlink.connection.MessagePacker;
import com.questrail.peerlink.connection.MessageSerializer;
import com.questrail.peerlink.connection.NetworkConnection;
import com.questrail.peerlink.event.NetworkEvent;
import com.questrail.peerlink.internal.exec.RuntimeExecutors;
import com.questrail.peerlink.internal.time.MonotonicClock;
import com.questrail.peerlink.internal.time.MonotonicScheduler;
import com.questrail.peerlink.internal.time.ScheduledExecutorScheduler;
import com.questrail.peerlink.internal.time.SystemMonotonicClock;
import com.questrail.peerlink.observability.ConnectionEvent;
import com.questrail.peerlink.observability.NetworkErrorEvent;
import com.questrail.peerlink.observability.NetworkObservabilitySink;
import com.questrail.peerlink.observability.Role;
import com.questrail.peerlink.observability.Slf4jNetworkObservabilitySink;
import com.questrail.peerlink.observability.StateTransitionEvent;
import com.questrail.peerlink.server.NetworkServer;
import com.questrail.peerlink.time.NetworkPongMessage;
import com.questrail.peerlink.time.NetworkTime;
import com.questrail.peerlink.transport.Transport;
import com.questrail.peerlink.transport.TransportChannel;
import com.questrail.peerlink.transport.pipe.PipeTransportChannel;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

/**
 * NetworkClient
 * =============================================================================
 * Client role: holds at most one {@link NetworkConnection} to a server, either
 * over a {@link Transport} or, in host mode, over an in-memory pipe to a server
 * in the same process.
 *
 * <h2>State machine</h2>
 * <pre>
 *   DISCONNECTED --connectAsync--> CONNECTING --dial ok--> CONNECTED
 *        ^                             |                      |
 *        +------- dial failed ---------+                      |
 *        +------------- read loop ended ----------------------+
 *
 *   DISCONNECTED --connectHost--> CONNECTED
 * </pre>
 *
 * <h2>Connection teardown</h2>
 * Whether the client disconnects or the server does, cleanup runs on the read
 * loop's termination path: exactly once per connection, followed by exactly
 * one {@link #disconnected()} notification.
 *
 * <h2>Time sync</h2>
 * A remote client pings the server through {@link NetworkTime}. A host-mode
 * client shares the server's clock, registers a no-op pong handler and does not
 * ping.
 *
 * <h2>Connect attempts</h2>
 * Every {@code connectAsync} or {@code connectHost} starts a new attempt. A dial
 * that completes after its attempt was abandoned (by {@link #disconnect()} or a
 * newer attempt) only fails its own future; it never changes the client's state
 * or connection.
 *
 * <p>No automatic reconnection: a failed or dropped connection leaves the
 * client {@link ConnectState#DISCONNECTED} until the caller connects again.</p>
 *
 * <p>Thread pools the client creates for itself (when none are injected) are
 * released by {@link #close()}.</p>
 */
public final class NetworkClient implements AutoCloseable {

    private final Transport transport;
    private final NetworkObservabilitySink sink;
    private final MessagePacker packer;
    private final Executor executor;
    private final ExecutorService ownedExecutor;
    private final ScheduledExecutorService ownedTimer;
    private final NetworkTime time;
    private final AuthenticationGate authenticationGate;

    private final Object lock = new Object();
    private ConnectState state = ConnectState.DISCONNECTED;
    private long attempt;
    private NetworkConnection connection;
    private boolean localClient;

    private final NetworkEvent<NetworkConnection> connected;
    private final NetworkEvent<NetworkConnection> authenticated;
    private final NetworkEvent<NetworkConnection> disconnected;

    private NetworkClient(Builder b) {
        this.transport = b.transport;
        this.sink = Objects.requireNonNull(b.sink, "sink");
        this.packer = new MessagePacker(Objects.requireNonNull(b.serializer, "serializer"));
        this.ownedExecutor = b.executor == null ? RuntimeExecutors.newReadLoopPool("peerlink-client") : null;
        this.executor = b.executor != null ? b.executor : ownedExecutor;

        MonotonicClock clock = Objects.requireNonNull(b.clock, "clock");
        this.ownedTimer = b.scheduler == null ? RuntimeExecutors.newTimer("peerlink-client-ping") : null;
        MonotonicScheduler scheduler = b.scheduler != null
            ? b.scheduler
            : new ScheduledExecutorScheduler(ownedTimer, clock);
        this.time = new NetworkTime(clock, scheduler, Objects.requireNonNull(b.config, "config"));

        this.connected = new NetworkEvent<>("client.connected", sink);
        this.authenticated = new NetworkEvent<>("client.authenticated", sink);
        this.disconnected = new NetworkEvent<>("client.disconnected", sink);

        this.authenticationGate = new AuthenticationGate(b.authenticator, Role.CLIENT, sink, authenticated::invoke);
    }

    public static Builder builder() {
        return new Builder();
    }

    // -------------------------------------------------------------------------
    // Connecting
    // -------------------------------------------------------------------------

    /**
     * Dial {@code uri} through the configured transport.
     *
     * <p>The returned future fails with {@link ConnectFailedException} when no
     * transport is configured or the dial fails (the client is then back in
     * {@code DISCONNECTED}), and with {@link IllegalStateException} when the
     * client is not {@code DISCONNECTED}.</p>
     */
    public CompletableFuture<NetworkConnection> connectAsync(URI uri) {
        Objects.requireNonNull(uri, "uri");
        if (transport == null) {
            return CompletableFuture.failedFuture(new ConnectFailedException("No transport configured"));
        }

        long thisAttempt;
        synchronized (lock) {
            if (state != ConnectState.DISCONNECTED) {
                return CompletableFuture.failedFuture(new IllegalStateException("Client is " + state));
            }
            thisAttempt = ++attempt;
            transition(ConnectState.CONNECTING);
        }

        CompletableFuture<TransportChannel> dial;
        try {
            dial = transport.connectAsync(uri);
        } catch (RuntimeException e) {
            dial = CompletableFuture.failedFuture(e);
        }

        return dial.handle((channel, error) -> {
            if (error != null) {
                Throwable cause = unwrap(error);
                synchronized (lock) {
                    if (isCurrentDial(thisAttempt)) {
                        transition(ConnectState.DISCONNECTED);
                    }
                }
                ConnectFailedException failure = cause instanceof ConnectFailedException cfe
                    ? cfe
                    : new ConnectFailedException("Connect to " + uri + " failed", cause);
                sink.onError(new NetworkErrorEvent(Instant.now(), failure.getMessage(), failure));
                throw new CompletionException(failure);
            }
            return established(uri, channel, thisAttempt);
        });
    }

    /**
     * Dial {@code host} on the transport's default port, using its first scheme.
     */
    public CompletableFuture<NetworkConnection> connectAsync(String host) {
        return connectAsync(host, -1);
    }

    public CompletableFuture<NetworkConnection> connectAsync(String host, int port) {
        Objects.requireNonNull(host, "host");
        if (transport == null) {
            return CompletableFuture.failedFuture(new ConnectFailedException("No transport configured"));
        }
        try {
            return connectAsync(new URI(transport.schemes().get(0), null, host, port, null, null, null));
        } catch (URISyntaxException e) {
            return CompletableFuture.failedFuture(
                new ConnectFailedException("Invalid address " + host + ":" + port, e));
        }
    }

    // Caller holds lock.
    private boolean isCurrentDial(long dialAttempt) {
        return attempt == dialAttempt && state == ConnectState.CONNECTING;
    }

    private NetworkConnection established(URI uri, TransportChannel channel, long dialAttempt) {
        NetworkConnection conn = new NetworkConnection(channel, packer, Role.CLIENT, sink);
        conn.registerHandler(NetworkPongMessage.class, pong -> time.onClientPong(pong), false);

        synchronized (lock) {
            if (!isCurrentDial(dialAttempt)) {
                // abandoned by disconnect() or superseded by a newer attempt
                channel.close();
                throw new CompletionException(
                    new ConnectFailedException("Connect to " + uri + " cancelled"));
            }
            connection = conn;
            localClient = false;
            transition(ConnectState.CONNECTED);
        }

        sink.onConnectionEvent(conn.lifecycleEvent(ConnectionEvent.Kind.CONNECTED));
        start(conn);
        time.start(conn);
        return conn;
    }

    /**
     * Host mode: connect to a server in this process over an in-memory pipe.
     * The server runs its normal admission on the other end of the pipe. The
     * client goes straight to {@code CONNECTED}.
     *
     * @throws IllegalStateException if the client is not disconnected or the
     *                               server is not active
     */
    public NetworkConnection connectHost(NetworkServer server) {
        Objects.requireNonNull(server, "server");

        PipeTransportChannel.Pipe pipe = PipeTransportChannel.createPipe();
        NetworkConnection conn = new NetworkConnection(pipe.first(), packer, Role.CLIENT, sink);
        conn.registerHandler(NetworkPongMessage.class, pong -> { }, false);

        synchronized (lock) {
            if (state != ConnectState.DISCONNECTED) {
                throw new IllegalStateException("Client is " + state);
            }
            attempt++;
            try {
                server.accept(pipe.second());
            } catch (RuntimeException e) {
                pipe.first().close();
                throw e;
            }
            connection = conn;
            localClient = true;
            transition(ConnectState.CONNECTED);
        }

        sink.onConnectionEvent(conn.lifecycleEvent(ConnectionEvent.Kind.CONNECTED));
        start(conn);
        return conn;
    }

    private void start(NetworkConnection conn) {
        connected.invoke(conn);
        authenticationGate.begin(conn);
        conn.processMessagesAsync(executor)
            .whenComplete((ignored, error) -> onConnectionClosed(conn, error));
    }

    private void onConnectionClosed(NetworkConnection conn, Throwable error) {
        if (error != null) {
            sink.onError(new NetworkErrorEvent(
                Instant.now(), "Read loop of " + conn + " terminated", unwrap(error)));
        }

        synchronized (lock) {
            if (connection != conn) {
                return;
            }
            connection = null;
            localClient = false;
            transition(ConnectState.DISCONNECTED);
        }

        time.stop(conn);
        sink.onConnectionEvent(conn.lifecycleEvent(ConnectionEvent.Kind.DISCONNECTED));
        disconnected.invoke(conn);
    }

    /**
     * Close the current connection, or abandon a dial in progress. The
     * {@link #disconnected()} notification follows from the read loop ending.
     */
    public void disconnect() {
        NetworkConnection conn;
        synchronized (lock) {
            conn = connection;
            if (conn == null && state == ConnectState.CONNECTING) {
                transition(ConnectState.DISCONNECTED);
            }
        }
        if (conn != null) {
            conn.disconnect();
        }
    }

    /**
     * Disconnect, stop pinging and shut down the thread pools this client
     * created. Injected executors and schedulers are left running.
     */
    @Override
    public void close() {
        disconnect();
        time.stop();
        if (ownedTimer != null) {
            RuntimeExecutors.shutdown(ownedTimer);
        }
        if (ownedExecutor != null) {
            RuntimeExecutors.shutdown(ownedExecutor);
        }
    }

    // -------------------------------------------------------------------------
    // Messaging
    // -------------------------------------------------------------------------

    public void send(Object message) {
        send(message, ChannelKind.RELIABLE);
    }

    /**
     * Best-effort send over the active connection.
     *
     * @throws NotConnectedException if there is no active connection
     */
    public void send(Object message, ChannelKind kind) {
        requireConnection().send(message, kind);
    }

    public CompletableFuture<Void> sendAsync(Object message) {
        return sendAsync(message, ChannelKind.RELIABLE);
    }

    public CompletableFuture<Void> sendAsync(Object message, ChannelKind kind) {
        NetworkConnection conn = connection();
        if (conn == null) {
            return CompletableFuture.failedFuture(new NotConnectedException("Client is not connected"));
        }
        return conn.sendAsync(message, kind);
    }

    private NetworkConnection requireConnection() {
        NetworkConnection conn = connection();
        if (conn == null) {
            throw new NotConnectedException("Client is not connected");
        }
        return conn;
    }

    // -------------------------------------------------------------------------
    // Queries and events
    // -------------------------------------------------------------------------

    public ConnectState state() {
        synchronized (lock) {
            return state;
        }
    }

    /**
     * The active connection, or {@code null}.
     */
    public NetworkConnection connection() {
        synchronized (lock) {
            return connection;
        }
    }

    public boolean isActive() {
        return state() != ConnectState.DISCONNECTED;
    }

    public boolean isConnected() {
        return state() == ConnectState.CONNECTED;
    }

    public boolean isLocalClient() {
        synchronized (lock) {
            return localClient;
        }
    }

    public NetworkTime time() {
        return time;
    }

    public Transport transport() {
        return transport;
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

    // Caller holds lock.
    private void transition(ConnectState to) {
        ConnectState from = state;
        state = to;
        sink.onStateTransition(new StateTransitionEvent(Instant.now(), Role.CLIENT, from, to));
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    public static final class Builder {
        private Transport transport;
        private Authenticator authenticator;
        private NetworkObservabilitySink sink = new Slf4jNetworkObservabilitySink();
        private ClientConfig config = ClientConfig.defaults();
        private MessageSerializer serializer = new JacksonMessageSerializer();
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private MonotonicScheduler scheduler;
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

        public Builder withConfig(ClientConfig config) {
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

        public Builder withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder withExecutor(Executor executor) {
            this.executor = executor;
            return this;
        }

        public NetworkClient build() {
            return new NetworkClient(this);
        }
    }
}
