package com.questrail.peerlink.transport;

import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * AbstractTransportChannel
 * -----------------------------------------------------------------------------
 * Inbound buffering shared by every {@link TransportChannel}.
 *
 * <p>Transport threads push frames with {@link #deliver(byte[])}; the owning
 * read loop pulls them with {@link #receive()}. Two ways to end the stream:</p>
 * <ul>
 *   <li>{@link #endOfStream()}: the peer went away. Frames already buffered
 *       are still returned, then {@code receive()} reports the end.</li>
 *   <li>{@link #close()}: local close. {@code receive()} reports the end at
 *       once and buffered frames are discarded.</li>
 * </ul>
 */
public abstract class AbstractTransportChannel implements TransportChannel
{
    private static final AtomicLong NEXT_ID = new AtomicLong(1);

    // Compared by identity; never handed out.
    private static final byte[] END_OF_STREAM = new byte[0];

    private final long id = NEXT_ID.getAndIncrement();
    private final BlockingQueue<byte[]> inbound = new LinkedBlockingQueue<>();
    private final AtomicBoolean ended = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    @Override
    public final long id() {
        return id;
    }

    @Override
    public final Optional<byte[]> receive() throws InterruptedException {
        if (closed.get()) {
            return Optional.empty();
        }

        byte[] frame = inbound.take();
        if (frame == END_OF_STREAM || closed.get()) {
            // Leave the marker for any later caller.
            inbound.offer(END_OF_STREAM);
            return Optional.empty();
        }
        return Optional.of(frame);
    }

    @Override
    public final void close() {
        if (closed.compareAndSet(false, true)) {
            endOfStream();
            doClose();
        }
    }

    @Override
    public boolean isOpen() {
        return !closed.get() && !ended.get();
    }

    /**
     * Buffer an inbound frame. Ignored once the stream has ended.
     */
    protected final void deliver(byte[] frame) {
        if (!ended.get()) {
            inbound.offer(frame);
        }
    }

    /**
     * Mark the inbound stream finished. Idempotent.
     */
    protected final void endOfStream() {
        if (ended.compareAndSet(false, true)) {
            inbound.offer(END_OF_STREAM);
        }
    }

    /**
     * Release the underlying medium. Called once, from {@link #close()}.
     */
    protected abstract void doClose();

    @Override
    public String toString() {
        return getClass().getSimpleName() + "#" + id;
    }
}
