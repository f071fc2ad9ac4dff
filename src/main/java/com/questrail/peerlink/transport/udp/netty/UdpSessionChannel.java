package com.questrail.peerlink.transport.udp.netty;

import com.questrail.peerlink.api.ChannelClosedException;
import com.questrail.peerlink.api.ChannelKind;
import com.questrail.peerlink.api.MessageTooLargeException;
import com.questrail.peerlink.config.UdpTransportConfig;
import com.questrail.peerlink.internal.time.MonotonicClock;
import com.questrail.peerlink.transport.AbstractTransportChannel;
import com.questrail.peerlink.transport.udp.ArqPacket;
import com.questrail.peerlink.transport.udp.ArqSession;

import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.socket.DatagramPacket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * A reliability session with one datagram peer, exposed as a
 * {@link com.questrail.peerlink.transport.TransportChannel}.
 */
final class UdpSessionChannel extends AbstractTransportChannel implements ArqSession.Output
{
    private static final Logger log = LoggerFactory.getLogger(UdpSessionChannel.class);

    private final Channel datagramChannel;
    private final InetSocketAddress remote;
    private final MonotonicClock clock;
    private final int mtu;
    private final Consumer<UdpSessionChannel> onSessionEnd;
    private final ArqSession session;

    UdpSessionChannel(Channel datagramChannel,
                      InetSocketAddress remote,
                      int conv,
                      UdpTransportConfig config,
                      MonotonicClock clock,
                      Consumer<UdpSessionChannel> onSessionEnd)
    {
        this.datagramChannel = Objects.requireNonNull(datagramChannel, "datagramChannel");
        this.remote = Objects.requireNonNull(remote, "remote");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.mtu = config.mtu();
        this.onSessionEnd = Objects.requireNonNull(onSessionEnd, "onSessionEnd");
        this.session = new ArqSession(conv, config, clock.nowNanos(), this);
    }

    int conv()
    {
        return session.conv();
    }

    @Override
    public SocketAddress remoteAddress()
    {
        return remote;
    }

    @Override
    public boolean isLocal()
    {
        return false;
    }

    @Override
    public int maxMessageSize(ChannelKind kind)
    {
        return kind == ChannelKind.RELIABLE
            ? mtu - ArqPacket.RELIABLE_HEADER_SIZE
            : mtu - ArqPacket.BASE_HEADER_SIZE;
    }

    @Override
    public CompletableFuture<Void> send(byte[] frame, ChannelKind kind)
    {
        Objects.requireNonNull(frame, "frame");
        if (!isOpen()) {
            return CompletableFuture.failedFuture(new ChannelClosedException(this + " is closed"));
        }
        int max = maxMessageSize(kind);
        if (frame.length > max) {
            return CompletableFuture.failedFuture(new MessageTooLargeException(frame.length, max));
        }

        try {
            if (kind == ChannelKind.RELIABLE) {
                session.sendReliable(frame, clock.nowNanos());
            } else {
                session.sendUnreliable(frame, clock.nowNanos());
            }
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        // Reliable completion means "queued for delivery", not "acknowledged".
        return CompletableFuture.completedFuture(null);
    }

    void onPacket(ArqPacket packet)
    {
        session.onPacket(packet, clock.nowNanos());
    }

    void sendHelloAck()
    {
        session.sendHelloAck(clock.nowNanos());
    }

    void tick()
    {
        session.tick(clock.nowNanos());
    }

    // ---- ArqSession.Output ----

    @Override
    public void transmit(byte[] datagram)
    {
        datagramChannel.writeAndFlush(new DatagramPacket(Unpooled.wrappedBuffer(datagram), remote));
    }

    @Override
    public void onMessage(byte[] message)
    {
        deliver(message);
    }

    @Override
    public void onClosed(Throwable cause)
    {
        if (cause != null) {
            log.warn("Session with {} failed: {}", remote, cause.getMessage());
        }
        endOfStream();
        onSessionEnd.accept(this);
    }

    @Override
    protected void doClose()
    {
        session.close(clock.nowNanos());
    }
}
