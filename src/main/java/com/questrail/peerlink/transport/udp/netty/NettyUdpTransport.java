package com.questrail.peerlink.transport.udp.netty;

import com.questrail.peerlink.api.ConnectFailedException;
import com.questrail.peerlink.config.UdpTransportConfig;
import com.questrail.peerlink.internal.time.Cancellable;
import com.questrail.peerlink.internal.time.MonotonicClock;
import com.questrail.peerlink.internal.time.MonotonicScheduler;
import com.questrail.peerlink.internal.time.ScheduledExecutorScheduler;
import com.questrail.peerlink.internal.time.SystemMonotonicClock;
import com.questrail.peerlink.transport.Transport;
import com.questrail.peerlink.transport.TransportChannel;
import com.questrail.peerlink.transport.TransportListener;
import com.questrail.peerlink.transport.udp.ArqPacket;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * NettyUdpTransport
 * =============================================================================
 * Netty-backed datagram implementation of the {@link Transport} port, with a
 * reliability session ({@link com.questrail.peerlink.transport.udp.ArqSession})
 * per peer.
 *
 * <h2>Handshake</h2>
 * <ol>
 *   <li>The dialing side binds an ephemeral socket, picks a random session id
 *       and sends {@code HELLO} every {@code retransmitInterval}.</li>
 *   <li>The listening side creates a session for the sender, answers
 *       {@code HELLO_ACK} and announces the channel to its listener.</li>
 *   <li>The dial completes on {@code HELLO_ACK}, or fails with
 *       {@link ConnectFailedException} after {@code connectTimeout}.</li>
 * </ol>
 *
 * <h2>Netty containment rule</h2>
 * Netty types MUST NOT escape this package. Datagram payloads are copied into
 * {@code byte[]} before they reach a session.
 *
 * <h2>Threading</h2>
 * One event loop thread does all socket I/O and drives every session's timer.
 * Application threads may send concurrently; sessions synchronize internally.
 */
public final class NettyUdpTransport implements Transport
{
    public static final String SCHEME = "udp";

    private static final Logger log = LoggerFactory.getLogger(NettyUdpTransport.class);

    private final UdpTransportConfig config;
    private final MonotonicClock clock;
    private final EventLoopGroup group;
    private final MonotonicScheduler scheduler;
    private final Duration tickInterval;

    private final Map<InetSocketAddress, UdpSessionChannel> serverSessions = new ConcurrentHashMap<>();
    private final Set<UdpSessionChannel> clientSessions = ConcurrentHashMap.newKeySet();
    private final AtomicReference<Listening> listening = new AtomicReference<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile Cancellable tickTask;

    private record Listening(TransportListener listener, CompletableFuture<Channel> bound) {}

    public NettyUdpTransport(UdpTransportConfig config)
    {
        this(config, SystemMonotonicClock.INSTANCE);
    }

    public NettyUdpTransport(UdpTransportConfig config, MonotonicClock clock)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.group = new NioEventLoopGroup(1);
        this.scheduler = new ScheduledExecutorScheduler(group, clock);

        Duration retransmit = config.retransmitInterval();
        Duration heartbeat = config.heartbeatInterval();
        this.tickInterval = retransmit.compareTo(heartbeat) <= 0 ? retransmit : heartbeat;

        scheduleTick();
    }

    @Override
    public List<String> schemes()
    {
        return List.of(SCHEME);
    }

    // -------------------------------------------------------------------------
    // Listening side
    // -------------------------------------------------------------------------

    @Override
    public CompletableFuture<Void> listenAsync(TransportListener listener)
    {
        Objects.requireNonNull(listener, "listener");

        Listening current = new Listening(listener, new CompletableFuture<>());
        if (!listening.compareAndSet(null, current)) {
            return CompletableFuture.failedFuture(new IllegalStateException("Already listening"));
        }

        Bootstrap bootstrap = new Bootstrap()
            .group(group)
            .channel(NioDatagramChannel.class)
            .option(ChannelOption.SO_BROADCAST, false)
            .handler(new ChannelInitializer<NioDatagramChannel>() {
                @Override
                protected void initChannel(NioDatagramChannel ch)
                {
                    ch.pipeline().addLast(new ServerInboundHandler(listener));
                }
            });

        bootstrap.bind(config.bindAddress()).addListener((ChannelFutureListener) f -> {
            if (f.isSuccess()) {
                log.info("Listening on udp {}", f.channel().localAddress());
                current.bound().complete(f.channel());
            } else {
                listening.compareAndSet(current, null);
                current.bound().completeExceptionally(f.cause());
            }
        });

        return current.bound().thenApply(ch -> null);
    }

    /**
     * The bound server address, e.g. to learn the port after binding port 0.
     */
    public CompletableFuture<SocketAddress> localAddress()
    {
        Listening current = listening.get();
        if (current == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("Not listening"));
        }
        return current.bound().thenApply(Channel::localAddress);
    }

    @Override
    public void disconnect()
    {
        Listening current = listening.getAndSet(null);
        if (current == null) {
            return;
        }

        for (UdpSessionChannel session : List.copyOf(serverSessions.values())) {
            session.close();
        }
        current.bound().thenAccept(Channel::close);
        current.listener().onStopped(null);
    }

    // -------------------------------------------------------------------------
    // Dialing side
    // -------------------------------------------------------------------------

    @Override
    public CompletableFuture<TransportChannel> connectAsync(URI uri)
    {
        Objects.requireNonNull(uri, "uri");
        if (!SCHEME.equals(uri.getScheme())) {
            return CompletableFuture.failedFuture(
                new ConnectFailedException("Unsupported scheme in " + uri + ", expected " + SCHEME));
        }
        if (uri.getHost() == null) {
            return CompletableFuture.failedFuture(new ConnectFailedException("No host in " + uri));
        }
        int port = uri.getPort() != -1 ? uri.getPort() : config.bindAddress().getPort();
        InetSocketAddress remote = new InetSocketAddress(uri.getHost(), port);
        if (remote.isUnresolved()) {
            return CompletableFuture.failedFuture(new ConnectFailedException("Cannot resolve " + uri.getHost()));
        }

        Dial dial = new Dial(uri, remote, newConv());

        Bootstrap bootstrap = new Bootstrap()
            .group(group)
            .channel(NioDatagramChannel.class)
            .handler(new ChannelInitializer<NioDatagramChannel>() {
                @Override
                protected void initChannel(NioDatagramChannel ch)
                {
                    ch.pipeline().addLast(new ClientInboundHandler(dial));
                }
            });

        bootstrap.bind(new InetSocketAddress(0)).addListener((ChannelFutureListener) f -> {
            if (f.isSuccess()) {
                dial.channel = f.channel();
                dial.sendHello();
            } else {
                dial.fail(f.cause());
            }
        });
        return dial.result;
    }

    private static int newConv()
    {
        int conv;
        do {
            conv = ThreadLocalRandom.current().nextInt();
        } while (conv == 0);
        return conv;
    }

    /**
     * One handshake in progress. Touched only from the event loop once bound.
     */
    private final class Dial
    {
        final URI uri;
        final InetSocketAddress remote;
        final int conv;
        final long deadlineNanos;
        final CompletableFuture<TransportChannel> result = new CompletableFuture<>();

        volatile Channel channel;
        volatile UdpSessionChannel session;
        private Cancellable retry;

        Dial(URI uri, InetSocketAddress remote, int conv)
        {
            this.uri = uri;
            this.remote = remote;
            this.conv = conv;
            this.deadlineNanos = clock.nowNanos() + config.connectTimeout().toNanos();
        }

        void sendHello()
        {
            if (result.isDone()) {
                return;
            }
            if (clock.nowNanos() - deadlineNanos >= 0) {
                fail(null);
                return;
            }
            byte[] hello = ArqPacket.control(ArqPacket.Type.HELLO, conv).encode();
            channel.writeAndFlush(new DatagramPacket(Unpooled.wrappedBuffer(hello), remote));
            retry = scheduler.scheduleAfter(config.retransmitInterval(), clock, this::sendHello);
        }

        void onHelloAck()
        {
            if (result.isDone()) {
                return;
            }
            if (retry != null) {
                retry.cancel();
            }
            Channel ch = channel;
            UdpSessionChannel created = new UdpSessionChannel(ch, remote, conv, config, clock, s -> {
                clientSessions.remove(s);
                ch.close();
            });
            session = created;
            clientSessions.add(created);
            result.complete(created);
        }

        void fail(Throwable cause)
        {
            String reason = cause != null ? "Connect to " + uri + " failed" : "Connect to " + uri + " timed out";
            if (result.completeExceptionally(new ConnectFailedException(reason, cause))) {
                Channel ch = channel;
                if (ch != null) {
                    ch.close();
                }
            }
        }
    }

    // -------------------------------------------------------------------------
    // Timers and shutdown
    // -------------------------------------------------------------------------

    private void scheduleTick()
    {
        if (closed.get()) {
            return;
        }
        tickTask = scheduler.scheduleAfter(tickInterval, clock, () -> {
            tickAll();
            scheduleTick();
        });
    }

    private void tickAll()
    {
        for (UdpSessionChannel session : serverSessions.values()) {
            tick(session);
        }
        for (UdpSessionChannel session : clientSessions) {
            tick(session);
        }
    }

    private static void tick(UdpSessionChannel session)
    {
        try {
            session.tick();
        } catch (RuntimeException e) {
            log.warn("Tick of {} failed", session, e);
        }
    }

    @Override
    public void close()
    {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        disconnect();
        for (UdpSessionChannel session : List.copyOf(clientSessions)) {
            session.close();
        }
        Cancellable t = tickTask;
        if (t != null) {
            t.cancel();
        }
        group.shutdownGracefully();
    }

    // -------------------------------------------------------------------------
    // Inbound handlers
    // -------------------------------------------------------------------------

    private static ArqPacket decode(DatagramPacket datagram)
    {
        ByteBuf content = datagram.content();
        byte[] bytes = new byte[content.readableBytes()];
        content.getBytes(content.readerIndex(), bytes);
        try {
            return ArqPacket.decode(bytes);
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring malformed datagram from {}: {}", datagram.sender(), e.getMessage());
            return null;
        }
    }

    /**
     * Routes datagrams on the listening socket to per-sender sessions and
     * creates a session for each new {@code HELLO}.
     */
    private final class ServerInboundHandler extends SimpleChannelInboundHandler<DatagramPacket>
    {
        private final TransportListener listener;

        ServerInboundHandler(TransportListener listener)
        {
            this.listener = listener;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket datagram)
        {
            ArqPacket packet = decode(datagram);
            if (packet == null) {
                return;
            }

            InetSocketAddress sender = datagram.sender();
            UdpSessionChannel existing = serverSessions.get(sender);
            if (existing != null && existing.conv() == packet.conv()) {
                existing.onPacket(packet);
                return;
            }
            if (packet.type() != ArqPacket.Type.HELLO) {
                return;
            }
            if (existing != null) {
                // Same address, new session id: the peer restarted.
                existing.close();
            }

            UdpSessionChannel session = new UdpSessionChannel(
                ctx.channel(), sender, packet.conv(), config, clock,
                s -> serverSessions.remove(sender, s));
            serverSessions.put(sender, session);
            session.sendHelloAck();
            listener.onConnected(session);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            log.warn("Datagram pipeline error on {}", ctx.channel().localAddress(), cause);
        }
    }

    /**
     * Handles the ephemeral socket of one dial: completes the handshake, then
     * feeds the resulting session.
     */
    private static final class ClientInboundHandler extends SimpleChannelInboundHandler<DatagramPacket>
    {
        private final Dial dial;

        ClientInboundHandler(Dial dial)
        {
            this.dial = dial;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket datagram)
        {
            ArqPacket packet = decode(datagram);
            if (packet == null || packet.conv() != dial.conv) {
                return;
            }

            UdpSessionChannel session = dial.session;
            if (session != null) {
                session.onPacket(packet);
            } else if (packet.type() == ArqPacket.Type.HELLO_ACK) {
                dial.onHelloAck();
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception
        {
            UdpSessionChannel session = dial.session;
            if (session != null) {
                session.close();
            }
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            log.warn("Datagram pipeline error on {}", ctx.channel().localAddress(), cause);
        }
    }
}
