package com.questrail.peerlink.transport;

import com.questrail.peerlink.api.ChannelKind;

import java.net.SocketAddress;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * TransportChannel
 * -----------------------------------------------------------------------------
 * One raw, bidirectional peer link produced by a {@link Transport}, either by
 * accepting a peer or by dialing one.
 *
 * <p>A channel carries whole frames. Stream transports add and strip their own
 * length prefix; datagram transports map one frame to one datagram.</p>
 */
public interface TransportChannel
{
    /**
     * Opaque identity, unique within the process.
     */
    long id();

    /**
     * Address of the peer, or {@code null} for in-memory channels.
     */
    SocketAddress remoteAddress();

    /**
     * {@code true} for in-process channels that never touch the network.
     */
    boolean isLocal();

    /**
     * Largest frame, in bytes, this channel accepts for the given kind.
     */
    int maxMessageSize(ChannelKind kind);

    /**
     * Submit one frame.
     *
     * <p>The returned future completes once the transport has accepted the
     * frame, or exceptionally with {@code ChannelClosedException} or
     * {@code MessageTooLargeException}. A failed send never closes the
     * channel.</p>
     */
    CompletableFuture<Void> send(byte[] frame, ChannelKind kind);

    /**
     * Block until the next inbound frame is available.
     *
     * @return the next frame, or empty once the channel is closed (locally or
     *         by the peer); every later call also returns empty
     * @throws InterruptedException if the calling thread is interrupted
     */
    Optional<byte[]> receive() throws InterruptedException;

    /**
     * Close the channel. Idempotent. Wakes any thread blocked in
     * {@link #receive()}.
     */
    void close();

    boolean isOpen();
}
