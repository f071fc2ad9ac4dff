package com.questrail.peerlink.client;

import com.questrail.peerlink.TestMessages.Chat;
import com.questrail.peerlink.TestMessages.Credentials;
import com.questrail.peerlink.api.Authenticator;
import com.questrail.peerlink.api.ConnectFailedException;
import com.questrail.peerlink.api.ConnectState;
import com.questrail.peerlink.api.NotConnectedException;
import com.questrail.peerlink.config.ServerConfig;
import com.questrail.peerlink.connection.NetworkConnection;
import com.questrail.peerlink.internal.time.DeterministicScheduler;
import com.questrail.peerlink.internal.time.ManualMonotonicClock;
import com.questrail.peerlink.observability.RecordingObservabilitySink;
import com.questrail.peerlink.observability.Role;
import com.questrail.peerlink.observability.StateTransitionEvent;
import com.questrail.peerlink.server.NetworkServer;
import com.questrail.peerlink.transport.Transport;
import com.questrail.peerlink.transport.TransportChannel;
import com.questrail.peerlink.transport.TransportListener;
import com.questrail.peerlink.transport.pipe.InMemoryTransport;
import com.questrail.peerlink.transport.pipe.PipeTransportChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static com.questrail.peerlink.Eventually.await;
import static org.junit.jupiter.api.Assertions.*;

class NetworkClientTest {

    private static final URI SERVER_URI = URI.create("mem://server");

    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final InMemoryTransport transport = new InMemoryTransport();

    private ExecutorService executor;
    private NetworkServer server;
    private NetworkClient client;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        if (client != null) {
            client.close();
        }
        if (server != null) {
            server.disconnect();
        }
        executor.shutdownNow();
    }

    private NetworkServer.Builder serverBuilder() {
        return NetworkServer.builder()
            .withTransport(transport)
            .withObservabilitySink(sink)
            .withExecutor(executor);
    }

    private NetworkClient.Builder clientBuilder() {
        return NetworkClient.builder()
            .withTransport(transport)
            .withObservabilitySink(sink)
            .withExecutor(executor);
    }

    private List<ConnectState> clientStatesVisited() {
        return sink.getStateTransitions().stream()
            .filter(e -> e.role() == Role.CLIENT)
            .map(e -> (ConnectState) e.to())
            .collect(Collectors.toList());
    }

    // -------------------------------------------------------------------------
    // Connect failures
    // -------------------------------------------------------------------------

    @Test
    void connectWithoutTransportFails() {
        client = NetworkClient.builder().withObservabilitySink(sink).withExecutor(executor).build();

        ExecutionException failure = assertThrows(ExecutionException.class,
            () -> client.connectAsync(SERVER_URI).get(1, TimeUnit.SECONDS));
        assertInstanceOf(ConnectFailedException.class, failure.getCause());
        assertEquals(ConnectState.DISCONNECTED, client.state());
    }

    @Test
    void failedDialReturnsToDisconnectedAndSurfacesError() {
        client = clientBuilder().build();

        ExecutionException failure = assertThrows(ExecutionException.class,
            () -> client.connectAsync(SERVER_URI).get(1, TimeUnit.SECONDS));

        assertInstanceOf(ConnectFailedException.class, failure.getCause());
        assertEquals(ConnectState.DISCONNECTED, client.state());
        assertEquals(List.of(ConnectState.CONNECTING, ConnectState.DISCONNECTED), clientStatesVisited());
    }

    @Test
    void connectWhileConnectedFails() throws Exception {
        server = serverBuilder().build();
        server.listenAsync().get(1, TimeUnit.SECONDS);
        client = clientBuilder().build();
        client.connectAsync(SERVER_URI).get(1, TimeUnit.SECONDS);

        ExecutionException failure = assertThrows(ExecutionException.class,
            () -> client.connectAsync(SERVER_URI).get(1, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, failure.getCause());
        assertTrue(client.isConnected());
    }

    @Test
    void connectByHostUsesTransportScheme() throws Exception {
        server = serverBuilder().build();
        server.listenAsync().get(1, TimeUnit.SECONDS);
        client = clientBuilder().build();

        client.connectAsync("localhost").get(1, TimeUnit.SECONDS);

        assertTrue(client.isConnected());
        assertFalse(client.isLocalClient());
    }

    // -------------------------------------------------------------------------
    // Sending without a connection
    // -------------------------------------------------------------------------

    @Test
    void sendWithoutConnectionFails() {
        client = clientBuilder().build();

        assertThrows(NotConnectedException.class, () -> client.send(new Chat("x")));
        ExecutionException failure = assertThrows(ExecutionException.class,
            () -> client.sendAsync(new Chat("x")).get(1, TimeUnit.SECONDS));
        assertInstanceOf(NotConnectedException.class, failure.getCause());
    }

    // -------------------------------------------------------------------------
    // Disconnect
    // -------------------------------------------------------------------------

    @Test
    void localDisconnectFiresDisconnectedExactlyOnce() throws Exception {
        server = serverBuilder().build();
        server.listenAsync().get(1, TimeUnit.SECONDS);
        client = clientBuilder().build();
        AtomicInteger disconnects = new AtomicInteger();
        client.disconnected().addListener(c -> disconnects.incrementAndGet());
        client.connectAsync(SERVER_URI).get(1, TimeUnit.SECONDS);

        client.disconnect();
        client.disconnect();

        await(() -> client.state() == ConnectState.DISCONNECTED, "client disconnected");
        Thread.sleep(50);
        assertEquals(1, disconnects.get());
        assertNull(client.connection());
    }

    @Test
    void remoteDisconnectFiresDisconnectedAndAllowsReconnect() throws Exception {
        server = serverBuilder().build();
        server.listenAsync().get(1, TimeUnit.SECONDS);
        client = clientBuilder().build();
        AtomicInteger disconnects = new AtomicInteger();
        client.disconnected().addListener(c -> disconnects.incrementAndGet());
        client.connectAsync(SERVER_URI).get(1, TimeUnit.SECONDS);

        server.connections().forEach(NetworkConnection::disconnect);

        await(() -> disconnects.get() == 1, "client observes remote close");
        assertEquals(ConnectState.DISCONNECTED, client.state());

        client.connectAsync(SERVER_URI).get(1, TimeUnit.SECONDS);
        assertTrue(client.isConnected());
    }

    // -------------------------------------------------------------------------
    // Host mode
    // -------------------------------------------------------------------------

    @Test
    void hostModeBroadcastReachesLocalClientLikeRemoteSend() throws Exception {
        server = serverBuilder().withConfig(ServerConfig.builder().withListening(false).build()).build();
        server.listenAsync().get(1, TimeUnit.SECONDS);
        client = clientBuilder().build();
        CompletableFuture<Chat> received = new CompletableFuture<>();
        client.connected().addListener(conn -> conn.registerHandler(Chat.class, (Chat msg) -> received.complete(msg)));

        NetworkConnection local = client.connectHost(server);
        server.sendToAll(new Chat("to everyone"));

        assertEquals(new Chat("to everyone"), received.get(2, TimeUnit.SECONDS));
        assertTrue(local.isLocal());
        assertTrue(client.isLocalClient());
        assertEquals(1, server.numPlayers());
        assertEquals(List.of(ConnectState.CONNECTED), clientStatesVisited());
    }

    @Test
    void hostClientMessagesReachServerHandlers() throws Exception {
        server = serverBuilder().withConfig(ServerConfig.builder().withListening(false).build()).build();
        CompletableFuture<Chat> received = new CompletableFuture<>();
        server.connected().addListener(conn -> conn.registerHandler(Chat.class, (Chat msg) -> received.complete(msg)));
        server.listenAsync().get(1, TimeUnit.SECONDS);
        client = clientBuilder().build();

        client.connectHost(server);
        client.send(new Chat("from host"));

        assertEquals(new Chat("from host"), received.get(2, TimeUnit.SECONDS));
    }

    @Test
    void hostModeToInactiveServerFails() {
        server = serverBuilder().build();
        client = clientBuilder().build();

        assertThrows(IllegalStateException.class, () -> client.connectHost(server));
        assertEquals(ConnectState.DISCONNECTED, client.state());
    }

    @Test
    void hostClientDoesNotPing() throws Exception {
        server = serverBuilder().withConfig(ServerConfig.builder().withListening(false).build()).build();
        server.listenAsync().get(1, TimeUnit.SECONDS);
        ManualMonotonicClock clock = new ManualMonotonicClock();
        DeterministicScheduler scheduler = new DeterministicScheduler(clock);
        client = clientBuilder().withClock(clock).withScheduler(scheduler).build();

        client.connectHost(server);
        clock.advanceMillis(10_000);
        scheduler.runDueTasks();

        assertEquals(0, client.time().pingsSent());
    }

    // -------------------------------------------------------------------------
    // Time sync
    // -------------------------------------------------------------------------

    @Test
    void remoteClientPingsOnConnectAndEveryInterval() throws Exception {
        ManualMonotonicClock clock = new ManualMonotonicClock();
        DeterministicScheduler scheduler = new DeterministicScheduler(clock);
        server = serverBuilder().withClock(clock).build();
        server.listenAsync().get(1, TimeUnit.SECONDS);
        client = clientBuilder().withClock(clock).withScheduler(scheduler).build();

        client.connectAsync(SERVER_URI).get(1, TimeUnit.SECONDS);

        assertEquals(1, client.time().pingsSent());
        await(() -> client.time().hasSamples(), "pong received");

        clock.advance(Duration.ofSeconds(2));
        scheduler.runDueTasks();
        assertEquals(2, client.time().pingsSent());
    }

    // -------------------------------------------------------------------------
    // Authentication
    // -------------------------------------------------------------------------

    /**
     * Client presents a token; server admits it only if it matches.
     */
    private static final class TokenAuthenticator implements Authenticator {
        private final String expected;
        private final String presented;

        TokenAuthenticator(String expected, String presented) {
            this.expected = expected;
            this.presented = presented;
        }

        @Override
        public CompletionStage<Boolean> onServerAuthenticate(NetworkConnection connection) {
            CompletableFuture<Boolean> decision = new CompletableFuture<>();
            connection.registerHandler(Credentials.class,
                (Credentials c) -> decision.complete(expected.equals(c.token())), false);
            return decision;
        }

        @Override
        public CompletionStage<Boolean> onClientAuthenticate(NetworkConnection connection) {
            connection.send(new Credentials(presented));
            return CompletableFuture.completedFuture(true);
        }
    }

    @Test
    void validCredentialsUnlockAuthenticatedHandlers() throws Exception {
        List<Chat> received = new CopyOnWriteArrayList<>();
        CompletableFuture<NetworkConnection> serverAuthenticated = new CompletableFuture<>();
        server = serverBuilder().withAuthenticator(new TokenAuthenticator("secret", "unused")).build();
        server.connected().addListener(conn -> conn.registerHandler(Chat.class, (Chat msg) -> received.add(msg)));
        server.authenticated().addListener(serverAuthenticated::complete);
        server.listenAsync().get(1, TimeUnit.SECONDS);

        client = clientBuilder().withAuthenticator(new TokenAuthenticator("unused", "secret")).build();
        client.connectAsync(SERVER_URI).get(1, TimeUnit.SECONDS);

        serverAuthenticated.get(2, TimeUnit.SECONDS);
        client.send(new Chat("authorized"));

        await(() -> received.size() == 1, "authorized message dispatched");
        assertEquals(new Chat("authorized"), received.get(0));
    }

    @Test
    void invalidCredentialsDisconnectClient() throws Exception {
        server = serverBuilder().withAuthenticator(new TokenAuthenticator("secret", "unused")).build();
        server.listenAsync().get(1, TimeUnit.SECONDS);
        AtomicInteger disconnects = new AtomicInteger();

        client = clientBuilder().withAuthenticator(new TokenAuthenticator("unused", "wrong")).build();
        client.disconnected().addListener(c -> disconnects.incrementAndGet());
        client.connectAsync(SERVER_URI).get(1, TimeUnit.SECONDS);

        await(() -> disconnects.get() == 1, "rejected client disconnected");
        assertEquals(0, server.numPlayers());
    }

    @Test
    void stateTransitionsAreReported() throws Exception {
        server = serverBuilder().build();
        server.listenAsync().get(1, TimeUnit.SECONDS);
        client = clientBuilder().build();

        client.connectAsync(SERVER_URI).get(1, TimeUnit.SECONDS);
        client.disconnect();
        await(() -> client.state() == ConnectState.DISCONNECTED, "disconnected");

        List<StateTransitionEvent> transitions = sink.getStateTransitions().stream()
            .filter(e -> e.role() == Role.CLIENT)
            .collect(Collectors.toList());
        assertEquals(ConnectState.DISCONNECTED, transitions.get(0).from());
        assertEquals(List.of(ConnectState.CONNECTING, ConnectState.CONNECTED, ConnectState.DISCONNECTED),
            clientStatesVisited());
    }

    // -------------------------------------------------------------------------
    // Abandoned dials
    // -------------------------------------------------------------------------

    /**
     * Transport whose dials stay pending until the test completes them.
     */
    private static final class ManualDialTransport implements Transport {
        final List<CompletableFuture<TransportChannel>> dials = new CopyOnWriteArrayList<>();

        @Override
        public List<String> schemes() {
            return List.of("manual");
        }

        @Override
        public CompletableFuture<Void> listenAsync(TransportListener listener) {
            return CompletableFuture.failedFuture(new IllegalStateException("Listening is not supported"));
        }

        @Override
        public CompletableFuture<TransportChannel> connectAsync(URI uri) {
            CompletableFuture<TransportChannel> dial = new CompletableFuture<>();
            dials.add(dial);
            return dial;
        }

        @Override
        public void disconnect() {
        }

        @Override
        public void close() {
        }
    }

    @Test
    void lateFailureOfAbandonedDialDoesNotDisturbNewAttempt() throws Exception {
        ManualDialTransport manual = new ManualDialTransport();
        client = NetworkClient.builder()
            .withTransport(manual).withObservabilitySink(sink).withExecutor(executor).build();
        URI uri = URI.create("manual://server");

        CompletableFuture<NetworkConnection> first = client.connectAsync(uri);
        client.disconnect();
        CompletableFuture<NetworkConnection> second = client.connectAsync(uri);

        manual.dials.get(0).completeExceptionally(new ConnectFailedException("refused"));

        ExecutionException failure = assertThrows(ExecutionException.class, () -> first.get(1, TimeUnit.SECONDS));
        assertInstanceOf(ConnectFailedException.class, failure.getCause());
        assertEquals(ConnectState.CONNECTING, client.state());
        assertFalse(second.isDone());

        PipeTransportChannel.Pipe pipe = PipeTransportChannel.createPipe();
        manual.dials.get(1).complete(pipe.first());

        NetworkConnection conn = second.get(1, TimeUnit.SECONDS);
        assertEquals(ConnectState.CONNECTED, client.state());
        assertSame(conn, client.connection());
    }

    @Test
    void lateSuccessOfAbandonedDialIsClosedAndNotAdopted() throws Exception {
        ManualDialTransport manual = new ManualDialTransport();
        client = NetworkClient.builder()
            .withTransport(manual).withObservabilitySink(sink).withExecutor(executor).build();
        URI uri = URI.create("manual://server");

        CompletableFuture<NetworkConnection> first = client.connectAsync(uri);
        client.disconnect();
        CompletableFuture<NetworkConnection> second = client.connectAsync(uri);

        PipeTransportChannel.Pipe stale = PipeTransportChannel.createPipe();
        manual.dials.get(0).complete(stale.first());

        ExecutionException failure = assertThrows(ExecutionException.class, () -> first.get(1, TimeUnit.SECONDS));
        assertInstanceOf(ConnectFailedException.class, failure.getCause());
        assertFalse(stale.second().isOpen());
        assertEquals(ConnectState.CONNECTING, client.state());
        assertNull(client.connection());

        PipeTransportChannel.Pipe fresh = PipeTransportChannel.createPipe();
        manual.dials.get(1).complete(fresh.first());

        second.get(1, TimeUnit.SECONDS);
        assertEquals(ConnectState.CONNECTED, client.state());
        assertTrue(fresh.second().isOpen());
    }

    // -------------------------------------------------------------------------
    // Resources
    // -------------------------------------------------------------------------

    private static Set<Thread> liveThreads(String prefix) {
        return Thread.getAllStackTraces().keySet().stream()
            .filter(t -> t.isAlive() && t.getName().startsWith(prefix))
            .collect(Collectors.toCollection(HashSet::new));
    }

    @Test
    void closeReleasesPoolsItCreated() throws Exception {
        server = serverBuilder().build();
        server.listenAsync().get(1, TimeUnit.SECONDS);
        Set<Thread> before = liveThreads("peerlink-client");
        NetworkClient owning = NetworkClient.builder()
            .withTransport(transport).withObservabilitySink(sink).build();
        owning.connectAsync(SERVER_URI).get(1, TimeUnit.SECONDS);
        assertTrue(owning.time().pingsSent() >= 1);

        owning.close();

        assertEquals(ConnectState.DISCONNECTED, owning.state());
        await(() -> {
            Set<Thread> leftover = liveThreads("peerlink-client");
            leftover.removeAll(before);
            return leftover.isEmpty();
        }, "client pool threads terminated");
    }
}
