package com.questrail.peerlink.transport.tcp.netty;

import com.questrail.peerlink.api.ConnectFailedException;
import com.questrail.peerlink.config.TcpTransportConfig;
import com.questrail.peerlink.transport.Transport;
import com.questrail.peerlink.transport.TransportChannel;
import com.questrail.peerlink.transport.TransportListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.net.URI;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * NettyTcpTransport
 * =============================================================================
 * Netty-backed stream implementation of the {@link Transport} port.
 *
 * <h2>Framing</h2>
 * Each frame is a two-byte big-endian length followed by that many bytes.
 * An inbound length above the configured maximum is a framing error and closes
 * the stream.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. Inbound frames are copied into {@code byte[]}
 * before they leave the pipeline.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>The worker event loop group lives as long as the transport and is shut
 *       down by {@link #close()}.</li>
 *   <li>{@link #listenAsync(TransportListener)} binds a server socket with its
 *       own acceptor group; {@link #disconnect()} unbinds it and leaves
 *       accepted streams open.</li>
 * </ul>
 */
public final class NettyTcpTransport implements Transport
{
    public static final String SCHEME = "tcp4";

    private static final int LENGTH_FIELD_SIZE = 2;

    private static final Logger log = LoggerFactory.getLogger(NettyTcpTransport.class);

    private final TcpTransportConfig config;
    private final EventLoopGroup workerGroup;

    private final AtomicReference<Listening> listening = new AtomicReference<>();

    private record Listening(TransportListener listener, EventLoopGroup bossGroup, CompletableFuture<Channel> bound) {}

    public NettyTcpTransport(TcpTransportConfig config)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.workerGroup = new NioEventLoopGroup();
    }

    @Override
    public List<String> schemes()
    {
        return List.of(SCHEME);
    }

    @Override
    public CompletableFuture<Void> listenAsync(TransportListener listener)
    {
        Objects.requireNonNull(listener, "listener");

        Listening current = new Listening(listener, new NioEventLoopGroup(1), new CompletableFuture<>());
        if (!listening.compareAndSet(null, current)) {
            current.bossGroup().shutdownGracefully();
            return CompletableFuture.failedFuture(new IllegalStateException("Already listening"));
        }

        ServerBootstrap bootstrap = new ServerBootstrap()
            .group(current.bossGroup(), workerGroup)
            .channel(NioServerSocketChannel.class)
            .childOption(ChannelOption.TCP_NODELAY, true)
            .childHandler(new ChannelInitializer<SocketChannel>() {
                @Override
                protected void initChannel(SocketChannel ch)
                {
                    NettyTcpChannel channel = new NettyTcpChannel(ch, config.maxMessageSize());
                    installPipeline(ch.pipeline(), channel, listener);
                }
            });

        bootstrap.bind(config.bindAddress()).addListener((ChannelFutureListener) f -> {
            if (f.isSuccess()) {
                log.info("Listening on {}", f.channel().localAddress());
                current.bound().complete(f.channel());
            } else {
                listening.compareAndSet(current, null);
                current.bossGroup().shutdownGracefully();
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
    public CompletableFuture<TransportChannel> connectAsync(URI uri)
    {
        Objects.requireNonNull(uri, "uri");
        if (!SCHEME.equals(uri.getScheme())) {
            return CompletableFuture.failedFuture(
                new ConnectFailedException("Unsupported scheme in " + uri + ", expected " + SCHEME));
        }
        String host = uri.getHost();
        if (host == null) {
            return CompletableFuture.failedFuture(new ConnectFailedException("No host in " + uri));
        }
        int port = uri.getPort() != -1 ? uri.getPort() : config.bindAddress().getPort();

        AtomicReference<NettyTcpChannel> created = new AtomicReference<>();
        Bootstrap bootstrap = new Bootstrap()
            .group(workerGroup)
            .channel(NioSocketChannel.class)
            .option(ChannelOption.TCP_NODELAY, true)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) config.connectTimeout().toMillis())
            .handler(new ChannelInitializer<SocketChannel>() {
                @Override
                protected void initChannel(SocketChannel ch)
                {
                    NettyTcpChannel channel = new NettyTcpChannel(ch, config.maxMessageSize());
                    created.set(channel);
                    installPipeline(ch.pipeline(), channel, null);
                }
            });

        CompletableFuture<TransportChannel> result = new CompletableFuture<>();
        bootstrap.connect(host, port).addListener((ChannelFutureListener) f -> {
            if (f.isSuccess()) {
                result.complete(created.get());
            } else {
                result.completeExceptionally(new ConnectFailedException("Connect to " + uri + " failed", f.cause()));
            }
        });
        return result;
    }

    @Override
    public void disconnect()
    {
        Listening current = listening.getAndSet(null);
        if (current == null) {
            return;
        }

        current.bound().thenAccept(Channel::close);
        current.bossGroup().shutdownGracefully();
        current.listener().onStopped(null);
    }

    @Override
    public void close()
    {
        disconnect();
        workerGroup.shutdownGracefully();
    }

    private void installPipeline(ChannelPipeline pipeline, NettyTcpChannel channel, TransportListener listener)
    {
        pipeline.addLast(new LengthFieldBasedFrameDecoder(config.maxMessageSize() + LENGTH_FIELD_SIZE, 0, LENGTH_FIELD_SIZE, 0, LENGTH_FIELD_SIZE));
        pipeline.addLast(new LengthFieldPrepender(LENGTH_FIELD_SIZE));
        pipeline.addLast(new InboundHandler(channel, listener));
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Copies each decoded frame into the owning {@link NettyTcpChannel}. On the
     * accepting side it also announces the stream to the listener once active.
     */
    private static final class InboundHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        private final NettyTcpChannel channel;
        private final TransportListener listener;

        InboundHandler(NettyTcpChannel channel, TransportListener listener)
        {
            this.channel = channel;
            this.listener = listener;
        }

        @Override
        public void channelActive(ChannelHandlerContext ctx) throws Exception
        {
            if (listener != null) {
                listener.onConnected(channel);
            }
            super.channelActive(ctx);
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf frame)
        {
            // Copy out of the reference-counted buffer (Netty containment rule).
            byte[] bytes = new byte[frame.readableBytes()];
            frame.getBytes(frame.readerIndex(), bytes);
            channel.onFrame(bytes);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception
        {
            channel.onInactive();
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            log.warn("Closing {} after pipeline error", channel, cause);
            ctx.close();
        }
    }
}
