package com.questrail.peerlink.transport.tcp.netty;

import com.questrail.peerlink.api.ChannelClosedException;
import com.questrail.peerlink.api.ChannelKind;
import com.questrail.peerlink.api.MessageTooLargeException;
import com.questrail.peerlink.transport.AbstractTransportChannel;

import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;

import java.net.SocketAddress;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * One TCP stream as a {@link com.questrail.peerlink.transport.TransportChannel}.
 * Both channel kinds are delivered reliable and ordered.
 */
final class NettyTcpChannel extends AbstractTransportChannel
{
    private final Channel channel;
    private final int maxMessageSize;

    NettyTcpChannel(Channel channel, int maxMessageSize)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.maxMessageSize = maxMessageSize;
    }

    @Override
    public SocketAddress remoteAddress()
    {
        return channel.remoteAddress();
    }

    @Override
    public boolean isLocal()
    {
        return false;
    }

    @Override
    public int maxMessageSize(ChannelKind kind)
    {
        return maxMessageSize;
    }

    @Override
    public CompletableFuture<Void> send(byte[] frame, ChannelKind kind)
    {
        Objects.requireNonNull(frame, "frame");
        if (!isOpen() || !channel.isActive()) {
            return CompletableFuture.failedFuture(new ChannelClosedException(this + " is closed"));
        }
        if (frame.length > maxMessageSize) {
            return CompletableFuture.failedFuture(new MessageTooLargeException(frame.length, maxMessageSize));
        }

        CompletableFuture<Void> result = new CompletableFuture<>();
        channel.writeAndFlush(Unpooled.wrappedBuffer(frame)).addListener((ChannelFutureListener) f -> {
            if (f.isSuccess()) {
                result.complete(null);
            } else {
                result.completeExceptionally(f.cause());
            }
        });
        return result;
    }

    void onFrame(byte[] frame)
    {
        deliver(frame);
    }

    void onInactive()
    {
        endOfStream();
    }

    @Override
    protected void doClose()
    {
        channel.close();
    }
}
