package com.questrail.peerlink.connection;

import com.questrail.peerlink.api.ChannelKind;
import com.questrail.peerlink.api.DuplicateHandlerException;
import com.questrail.peerlink.api.HandlerInvocationException;
import com.questrail.peerlink.api.MessageTooLargeException;
import com.questrail.peerlink.api.NotConnectedException;
import com.questrail.peerlink.observability.ConnectionEvent;
import com.questrail.peerlink.observability.MessageDroppedEvent;
import com.questrail.peerlink.observability.NetworkErrorEvent;
import com.questrail.peerlink.observability.NetworkObservabilitySink;
import com.questrail.peerlink.observability.Role;
import com.questrail.peerlink.transport.TransportChannel;

import java.net.SocketAddress;
import java.time.Instant;
import java.util.Collection;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * NetworkConnection
 * =============================================================================
 * One logical peer link, independent of the transport behind it.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Owns the per-connection handler registry, keyed by stable type key
 *       ({@link MessageTypes})</li>
 *   <li>Encodes outbound messages into envelopes ({@link MessagePacker}) and
 *       enforces the channel's size limit before anything reaches the wire</li>
 *   <li>Runs the read loop that turns inbound frames into handler calls</li>
 * </ul>
 *
 * <h2>Read loop</h2>
 * {@link #processMessagesAsync(Executor)} may run once per connection. For each
 * frame, in arrival order:
 * <ol>
 *   <li>Read the type key. A frame too short for one is a decode error.</li>
 *   <li>No handler registered: drop, report, continue.</li>
 *   <li>Handler requires authentication and the connection is not
 *       authenticated: drop, report, continue.</li>
 *   <li>Deserialize the body. Failure is a decode error.</li>
 *   <li>Invoke the handler. An exception is reported and the loop continues.</li>
 * </ol>
 * A decode error ends the loop and the returned future completes exceptionally
 * with {@code MessageDecodeException}. End of stream completes it normally.
 * Either way the connection is disconnected when the loop exits and cannot be
 * reused.
 *
 * <h2>Sending</h2>
 * {@link #sendAsync(Object, ChannelKind)} reports failure through its future.
 * {@link #send(Object, ChannelKind)} is fire-and-forget; failures go to the
 * observability sink. A failed send never closes the connection.
 *
 * <h2>Threading</h2>
 * Handlers of one connection run sequentially on its read-loop thread.
 * Registering handlers is safe from any thread, including while the loop runs.
 */
public class NetworkConnection {

    private record Registration<T>(
        Class<T> type,
        MessageHandler<? super T> handler,
        boolean requireAuthenticated
    ) {}

    private final TransportChannel channel;
    private final MessagePacker packer;
    private final Role role;
    private final NetworkObservabilitySink sink;

    private final ConcurrentMap<Integer, Registration<?>> handlers = new ConcurrentHashMap<>();

    private final AtomicBoolean loopStarted = new AtomicBoolean(false);
    private final AtomicBoolean disconnected = new AtomicBoolean(false);
    private final AtomicBoolean authenticated = new AtomicBoolean(false);

    private volatile boolean ready;
    private volatile Object ownedEntity;

    public NetworkConnection(TransportChannel channel,
                             MessagePacker packer,
                             Role role,
                             NetworkObservabilitySink sink) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.packer = Objects.requireNonNull(packer, "packer");
        this.role = Objects.requireNonNull(role, "role");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public long id() {
        return channel.id();
    }

    /**
     * Peer address, or {@code null} for an in-memory connection.
     */
    public SocketAddress remoteAddress() {
        return channel.remoteAddress();
    }

    /**
     * {@code true} for host-mode and other in-process connections.
     */
    public boolean isLocal() {
        return channel.isLocal();
    }

    public Role role() {
        return role;
    }

    // -------------------------------------------------------------------------
    // Handler registry
    // -------------------------------------------------------------------------

    /**
     * Register a handler that only runs once the connection is authenticated.
     */
    public <T> void registerHandler(Class<T> type, MessageHandler<? super T> handler) {
        registerHandler(type, handler, true);
    }

    /**
     * Register a handler for messages of {@code type}.
     *
     * @param requireAuthenticated if {@code true}, messages arriving before the
     *                             connection is authenticated are dropped
     * @throws DuplicateHandlerException if the type key of {@code type} already
     *                                   has a handler on this connection
     */
    public <T> void registerHandler(Class<T> type, MessageHandler<? super T> handler, boolean requireAuthenticated) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(handler, "handler");

        int key = MessageTypes.typeKey(type);
        Registration<T> registration = new Registration<>(type, handler, requireAuthenticated);
        Registration<?> existing = handlers.putIfAbsent(key, registration);
        if (existing != null) {
            throw new DuplicateHandlerException(existing.type() == type
                ? "Handler for " + type.getName() + " already registered on " + this
                : "Type key of " + type.getName() + " collides with " + existing.type().getName());
        }
    }

    /**
     * Register a handler that ignores the connection argument and only runs once
     * the connection is authenticated.
     */
    public <T> void registerHandler(Class<T> type, Consumer<? super T> handler) {
        registerHandler(type, handler, true);
    }

    public <T> void registerHandler(Class<T> type, Consumer<? super T> handler, boolean requireAuthenticated) {
        Objects.requireNonNull(handler, "handler");
        registerHandler(type, (MessageHandler<T>) (connection, message) -> handler.accept(message), requireAuthenticated);
    }

    /**
     * @return {@code true} if a handler for {@code type} was removed
     */
    public boolean unregisterHandler(Class<?> type) {
        Objects.requireNonNull(type, "type");
        int key = MessageTypes.typeKey(type);
        Registration<?> existing = handlers.get(key);
        return existing != null && existing.type() == type && handlers.remove(key, existing);
    }

    public boolean hasHandler(Class<?> type) {
        Registration<?> existing = handlers.get(MessageTypes.typeKey(type));
        return existing != null && existing.type() == type;
    }

    public void clearHandlers() {
        handlers.clear();
    }

    // -------------------------------------------------------------------------
    // Sending
    // -------------------------------------------------------------------------

    public CompletableFuture<Void> sendAsync(Object message) {
        return sendAsync(message, ChannelKind.RELIABLE);
    }

    /**
     * Encode and submit a message.
     *
     * <p>Fails with {@link NotConnectedException} once disconnected and with
     * {@link MessageTooLargeException} when the envelope exceeds the channel's
     * limit; in both cases nothing is written.</p>
     */
    public CompletableFuture<Void> sendAsync(Object message, ChannelKind kind) {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(kind, "kind");

        if (!isConnected()) {
            return CompletableFuture.failedFuture(new NotConnectedException(this + " is disconnected"));
        }

        final byte[] frame;
        try {
            frame = packer.pack(message);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return sendFrame(frame, kind);
    }

    public void send(Object message) {
        send(message, ChannelKind.RELIABLE);
    }

    /**
     * Fire-and-forget variant of {@link #sendAsync(Object, ChannelKind)}. A
     * failure is reported to the observability sink and not to the caller.
     */
    public void send(Object message, ChannelKind kind) {
        sendAsync(message, kind).whenComplete((ignored, error) -> {
            if (error != null) {
                reportSendFailure(message, unwrap(error));
            }
        });
    }

    /**
     * Send one message to many connections, encoding it once per distinct
     * packer (connections of one role share a packer). A failure for one
     * recipient is reported and does not affect the others.
     */
    public static void send(Collection<? extends NetworkConnection> connections,
                            Object message,
                            ChannelKind kind) {
        Objects.requireNonNull(connections, "connections");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(kind, "kind");

        Map<MessagePacker, byte[]> frames = new IdentityHashMap<>();
        for (NetworkConnection connection : connections) {
            try {
                byte[] frame = frames.computeIfAbsent(connection.packer, packer -> packer.pack(message));
                connection.sendFrame(frame, kind).whenComplete((ignored, error) -> {
                    if (error != null) {
                        connection.reportSendFailure(message, unwrap(error));
                    }
                });
            } catch (RuntimeException e) {
                connection.reportSendFailure(message, e);
            }
        }
    }

    private CompletableFuture<Void> sendFrame(byte[] frame, ChannelKind kind) {
        if (!isConnected()) {
            return CompletableFuture.failedFuture(new NotConnectedException(this + " is disconnected"));
        }

        int max = channel.maxMessageSize(kind);
        if (frame.length > max) {
            return CompletableFuture.failedFuture(new MessageTooLargeException(frame.length, max));
        }

        try {
            return channel.send(frame, kind);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private void reportSendFailure(Object message, Throwable cause) {
        sink.onError(new NetworkErrorEvent(
            Instant.now(),
            "Send of " + message.getClass().getName() + " on " + this + " failed",
            cause));
    }

    // -------------------------------------------------------------------------
    // Read loop
    // -------------------------------------------------------------------------

    /**
     * Start the read loop on {@code executor}.
     *
     * @return completes when the loop exits: normally on end of stream,
     *         exceptionally with {@code MessageDecodeException} on a malformed frame
     * @throws IllegalStateException if the loop was already started
     */
    public CompletableFuture<Void> processMessagesAsync(Executor executor) {
        Objects.requireNonNull(executor, "executor");
        if (!loopStarted.compareAndSet(false, true)) {
            throw new IllegalStateException("Read loop already started for " + this);
        }
        return CompletableFuture.runAsync(this::runReadLoop, executor);
    }

    private void runReadLoop() {
        try {
            while (true) {
                Optional<byte[]> frame = channel.receive();
                if (frame.isEmpty()) {
                    return;
                }
                dispatch(frame.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            disconnected.set(true);
            channel.close();
        }
    }

    private void dispatch(byte[] frame) {
        int key = packer.unpackTypeKey(frame);

        Registration<?> registration = handlers.get(key);
        if (registration == null) {
            sink.onMessageDropped(new MessageDroppedEvent(
                Instant.now(), id(), key, MessageDroppedEvent.Reason.UNREGISTERED_TYPE));
            return;
        }
        if (registration.requireAuthenticated() && !isAuthenticated()) {
            sink.onMessageDropped(new MessageDroppedEvent(
                Instant.now(), id(), key, MessageDroppedEvent.Reason.NOT_AUTHENTICATED));
            return;
        }

        invoke(registration, frame);
    }

    private <T> void invoke(Registration<T> registration, byte[] frame) {
        // Decode failures propagate and end the loop.
        T message = packer.unpackBody(frame, registration.type());

        try {
            registration.handler().handle(this, message);
        } catch (RuntimeException | AssertionError | LinkageError e) {
            // Other errors (out of memory, stack overflow) still end the loop.
            sink.onError(new NetworkErrorEvent(
                Instant.now(),
                "Handler for " + registration.type().getName() + " failed on " + this,
                new HandlerInvocationException(e.getMessage(), e)));
        }
    }

    // -------------------------------------------------------------------------
    // State
    // -------------------------------------------------------------------------

    /**
     * Close the underlying channel. Idempotent; the read loop observes the close
     * and exits.
     */
    public void disconnect() {
        if (disconnected.compareAndSet(false, true)) {
            channel.close();
        }
    }

    public boolean isConnected() {
        return !disconnected.get() && channel.isOpen();
    }

    public boolean isAuthenticated() {
        return authenticated.get();
    }

    /**
     * Mark the connection authenticated.
     *
     * @return {@code true} the first time only
     */
    public boolean markAuthenticated() {
        return authenticated.compareAndSet(false, true);
    }

    public boolean isReady() {
        return ready;
    }

    public void setReady(boolean ready) {
        this.ready = ready;
    }

    /**
     * Application object owned by this connection (for example a player
     * entity). Opaque to the runtime; the server clears it on disconnect.
     */
    public Object ownedEntity() {
        return ownedEntity;
    }

    public void setOwnedEntity(Object ownedEntity) {
        this.ownedEntity = ownedEntity;
    }

    public ConnectionEvent lifecycleEvent(ConnectionEvent.Kind kind) {
        return new ConnectionEvent(Instant.now(), role, id(), remoteAddress(), kind);
    }

    @Override
    public String toString() {
        SocketAddress remote = remoteAddress();
        return "connection#" + id() + "(" + (remote != null ? remote : "local") + ")";
    }

    static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
