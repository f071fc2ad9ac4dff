package com.questrail.peerlink.runtime;

import com.questrail.peerlink.TestMessages.Chat;
import com.questrail.peerlink.config.ServerConfig;
import com.questrail.peerlink.observability.RecordingObservabilitySink;
import com.questrail.peerlink.transport.pipe.InMemoryTransport;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static com.questrail.peerlink.Eventually.await;
import static org.junit.jupiter.api.Assertions.*;

class NetworkRuntimeTest {

    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();

    @Test
    void newRuntimeIsOffline() {
        try (NetworkRuntime runtime = NetworkRuntime.builder().withObservabilitySink(sink).build()) {
            assertEquals(NetworkMode.OFFLINE, runtime.mode());
        }
    }

    @Test
    void hostModeRunsServerAndLocalClient() throws Exception {
        try (NetworkRuntime runtime = NetworkRuntime.builder()
                .withObservabilitySink(sink)
                .withServerConfig(ServerConfig.builder().withListening(false).build())
                .build()) {
            CompletableFuture<Chat> echoed = new CompletableFuture<>();
            runtime.server().connected().addListener(conn ->
                conn.registerHandler(Chat.class, (c, msg) -> c.send(new Chat("echo " + msg.text()))));
            runtime.client().connected().addListener(conn ->
                conn.registerHandler(Chat.class, (Chat msg) -> echoed.complete(msg)));

            runtime.startHost().get(2, TimeUnit.SECONDS);

            assertEquals(NetworkMode.HOST, runtime.mode());
            assertTrue(runtime.client().isLocalClient());
            runtime.client().send(new Chat("hi"));
            assertEquals(new Chat("echo hi"), echoed.get(2, TimeUnit.SECONDS));

            runtime.stopHost();
            await(() -> runtime.mode() == NetworkMode.OFFLINE, "host stopped");
        }
    }

    @Test
    void separateRuntimesActAsServerAndClient() throws Exception {
        InMemoryTransport transport = new InMemoryTransport();
        try (NetworkRuntime serverSide = NetworkRuntime.builder().withTransport(transport).withObservabilitySink(sink).build();
             NetworkRuntime clientSide = NetworkRuntime.builder().withTransport(transport).withObservabilitySink(sink).build()) {

            serverSide.startServer().get(2, TimeUnit.SECONDS);
            clientSide.startClient(URI.create("mem://server")).get(2, TimeUnit.SECONDS);

            assertEquals(NetworkMode.SERVER_ONLY, serverSide.mode());
            assertEquals(NetworkMode.CLIENT_ONLY, clientSide.mode());
            await(() -> serverSide.server().numPlayers() == 1, "server admitted client");

            clientSide.stopClient();
            await(() -> clientSide.mode() == NetworkMode.OFFLINE, "client stopped");
            await(() -> serverSide.server().numPlayers() == 0, "server saw client leave");

            serverSide.stopServer();
            assertEquals(NetworkMode.OFFLINE, serverSide.mode());
        }
    }
}
