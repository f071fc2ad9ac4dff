package com.questrail.peerlink.runtime;

import com.questrail.peerlink.api.Authenticator;
import com.questrail.peerlink.client.NetworkClient;
import com.questrail.peerlink.config.ClientConfig;
import com.questrail.peerlink.config.ServerConfig;
import com.questrail.peerlink.connection.JacksonMessageSerializer;
import com.questrail.peerlink.connection.MessageSerializer;
import com.questrail.peerlink.connection.NetworkConnection;
import com.questrail.peerlink.internal.exec.RuntimeExecutors;
import com.questrail.peerlink.internal.time.MonotonicClock;
import com.questrail.peerlink.internal.time.ScheduledExecutorScheduler;
import com.questrail.peerlink.internal.time.SystemMonotonicClock;
import com.questrail.peerlink.observability.NetworkObservabilitySink;
import com.questrail.peerlink.observability.Slf4jNetworkObservabilitySink;
import com.questrail.peerlink.server.NetworkServer;
import com.questrail.peerlink.transport.Transport;

import java.net.URI;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

/**
 * NetworkRuntime
 * =============================================================================
 * Composition root and lifecycle owner for one process's networking: a
 * {@link NetworkServer} and a {@link NetworkClient} sharing a transport,
 * serializer, observability sink and thread pools.
 *
 * <p>The two roles stay independent; host mode links them only through the
 * in-memory pipe created by {@link NetworkClient#connectHost(NetworkServer)}.</p>
 */
public final class NetworkRuntime implements AutoCloseable {

    private final Transport transport;
    private final NetworkServer server;
    private final NetworkClient client;
    private final ExecutorService readLoops;
    private final ScheduledExecutorService timer;

    private NetworkRuntime(Transport transport,
                           NetworkServer server,
                           NetworkClient client,
                           ExecutorService readLoops,
                           ScheduledExecutorService timer) {
        this.transport = transport;
        this.server = server;
        this.client = client;
        this.readLoops = readLoops;
        this.timer = timer;
    }

    public static Builder builder() {
        return new Builder();
    }

    public CompletableFuture<Void> startServer() {
        return server.listenAsync();
    }

    public CompletableFuture<NetworkConnection> startClient(URI uri) {
        return client.connectAsync(uri);
    }

    /**
     * Start the server, then connect the local client to it in-process.
     */
    public CompletableFuture<NetworkConnection> startHost() {
        return server.listenAsync().thenApply(ignored -> client.connectHost(server));
    }

    public void stopServer() {
        server.disconnect();
    }

    public void stopClient() {
        client.disconnect();
    }

    public void stopHost() {
        client.disconnect();
        server.disconnect();
    }

    public NetworkMode mode() {
        boolean serverActive = server.isActive();
        boolean clientActive = client.isActive();
        if (serverActive && clientActive && client.isLocalClient()) {
            return NetworkMode.HOST;
        }
        if (serverActive) {
            return NetworkMode.SERVER_ONLY;
        }
        if (clientActive) {
            return NetworkMode.CLIENT_ONLY;
        }
        return NetworkMode.OFFLINE;
    }

    public NetworkServer server() {
        return server;
    }

    public NetworkClient client() {
        return client;
    }

    /**
     * Stop both roles, close the transport and release the thread pools.
     */
    @Override
    public void close() {
        stopHost();
        if (transport != null) {
            transport.close();
        }
        RuntimeExecutors.shutdown(timer);
        RuntimeExecutors.shutdown(readLoops);
    }

    public static final class Builder {
        private Transport transport;
        private Authenticator authenticator;
        private NetworkObservabilitySink sink = new Slf4jNetworkObservabilitySink();
        private ServerConfig serverConfig = ServerConfig.defaults();
        private ClientConfig clientConfig = ClientConfig.defaults();
        private MessageSerializer serializer = new JacksonMessageSerializer();
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;

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

        public Builder withServerConfig(ServerConfig serverConfig) {
            this.serverConfig = serverConfig;
            return this;
        }

        public Builder withClientConfig(ClientConfig clientConfig) {
            this.clientConfig = clientConfig;
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

        public NetworkRuntime build() {
            Objects.requireNonNull(sink, "sink");
            Objects.requireNonNull(serializer, "serializer");
            Objects.requireNonNull(clock, "clock");

            // 1. Shared threads
            ExecutorService readLoops = RuntimeExecutors.newReadLoopPool("peerlink-read");
            ScheduledExecutorService timer = RuntimeExecutors.newTimer("peerlink-timer");

            // 2. Roles
            NetworkServer server = NetworkServer.builder()
                .withTransport(transport)
                .withAuthenticator(authenticator)
                .withObservabilitySink(sink)
                .withConfig(serverConfig)
                .withSerializer(serializer)
                .withClock(clock)
                .withExecutor(readLoops)
                .build();

            NetworkClient client = NetworkClient.builder()
                .withTransport(transport)
                .withAuthenticator(authenticator)
                .withObservabilitySink(sink)
                .withConfig(clientConfig)
                .withSerializer(serializer)
                .withClock(clock)
                .withScheduler(new ScheduledExecutorScheduler(timer, clock))
                .withExecutor(readLoops)
                .build();

            return new NetworkRuntime(transport, server, client, readLoops, timer);
        }
    }
}
