package com.questrail.peerlink.transport.pipe;

import com.questrail.peerlink.api.ChannelClosedException;
import com.questrail.peerlink.api.ChannelKind;
import com.questrail.peerlink.api.MessageTooLargeException;
import com.questrail.peerlink.transport.AbstractTransportChannel;

import java.net.SocketAddress;
import java.util.concurrent.CompletableFuture;

/**
 * PipeTransportChannel
 * =============================================================================
 * One end of a linked pair of in-memory channels.
 *
 * <p>A frame sent on one end is placed, by reference, in the other end's
 * inbound queue. There is no copying, no serialization bound and no network
 * I/O; ordering is the queue's FIFO order. Closing one end closes the other
 * end's inbound stream after the frames already queued.</p>
 *
 * <p>Used for host mode, where a client and a server in the same process talk
 * through the same connection code as remote peers.</p>
 */
public final class PipeTransportChannel extends AbstractTransportChannel {

    /**
     * The two linked ends.
     */
    public record Pipe(PipeTransportChannel first, PipeTransportChannel second) {}

    private final int maxMessageSize;
    private volatile PipeTransportChannel peer;

    private PipeTransportChannel(int maxMessageSize) {
        this.maxMessageSize = maxMessageSize;
    }

    /**
     * Create an unbounded pipe.
     */
    public static Pipe createPipe() {
        return createPipe(Integer.MAX_VALUE);
    }

    /**
     * Create a pipe whose ends reject frames larger than {@code maxMessageSize}.
     */
    public static Pipe createPipe(int maxMessageSize) {
        if (maxMessageSize <= 0) {
            throw new IllegalArgumentException("maxMessageSize must be > 0");
        }
        PipeTransportChannel a = new PipeTransportChannel(maxMessageSize);
        PipeTransportChannel b = new PipeTransportChannel(maxMessageSize);
        a.peer = b;
        b.peer = a;
        return new Pipe(a, b);
    }

    @Override
    public SocketAddress remoteAddress() {
        return null;
    }

    @Override
    public boolean isLocal() {
        return true;
    }

    @Override
    public int maxMessageSize(ChannelKind kind) {
        return maxMessageSize;
    }

    @Override
    public CompletableFuture<Void> send(byte[] frame, ChannelKind kind) {
        if (!isOpen()) {
            return CompletableFuture.failedFuture(new ChannelClosedException(this + " is closed"));
        }
        if (frame.length > maxMessageSize) {
            return CompletableFuture.failedFuture(new MessageTooLargeException(frame.length, maxMessageSize));
        }
        peer.deliver(frame);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    protected void doClose() {
        peer.endOfStream();
    }
}
