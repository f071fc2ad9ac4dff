package com.questrail.peerlink.transport.udp;

import com.questrail.peerlink.api.ChannelClosedException;
import com.questrail.peerlink.config.UdpTransportConfig;

import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * ArqSession
 * =============================================================================
 * Reliability layer for one datagram peer: sequencing, acknowledgement,
 * retransmission, in-order delivery, keep-alive and idle detection.
 *
 * <h2>Architectural Role</h2>
 * This class does no I/O and reads no clock. Datagrams come in through
 * {@link #onPacket(ArqPacket, long)}, time advances through
 * {@link #tick(long)}, and everything outbound or upward goes through
 * {@link Output}. That keeps it fully deterministic under test.
 *
 * <h2>Reliable delivery</h2>
 * <ul>
 *   <li>Each reliable payload gets the next sequence number and stays pending
 *       until acknowledged.</li>
 *   <li>A pending packet not acknowledged within {@code retransmitInterval} is
 *       sent again; after {@code maxRetransmits} resends the session fails.</li>
 *   <li>The receiver acknowledges every packet it accepts, delivers in sequence
 *       order and buffers up to {@code receiveWindow} packets ahead of a gap.
 *       Duplicates are acknowledged again and otherwise ignored.</li>
 *   <li>Sequence numbers compare with wrap-around arithmetic.</li>
 * </ul>
 *
 * <h2>Unreliable delivery</h2>
 * Unreliable payloads are sent once and delivered as they arrive.
 *
 * <h2>Liveness</h2>
 * A heartbeat goes out whenever nothing was sent for
 * {@code heartbeatInterval}. Silence from the peer for {@code idleTimeout}
 * fails the session.
 *
 * <p>All methods are synchronized; {@link Output} callbacks run while the
 * session lock is held and must not block.</p>
 */
public final class ArqSession {

    /**
     * Session side effects.
     */
    public interface Output {
        void transmit(byte[] datagram);

        void onMessage(byte[] message);

        /**
         * Called once when the session ends.
         *
         * @param cause {@code null} for an orderly close by either side
         */
        void onClosed(Throwable cause);
    }

    private static final class Pending {
        final byte[] datagram;
        long lastSentNanos;
        int retransmits;

        Pending(byte[] datagram, long sentNanos) {
            this.datagram = datagram;
            this.lastSentNanos = sentNanos;
        }
    }

    private final int conv;
    private final UdpTransportConfig config;
    private final Output output;

    private final Map<Integer, Pending> pending = new LinkedHashMap<>();
    private final Map<Integer, byte[]> outOfOrder = new HashMap<>();

    private int nextSendSeq;
    private int nextExpectedSeq;
    private long lastSentNanos;
    private long lastReceivedNanos;
    private long retransmissions;
    private boolean closed;

    public ArqSession(int conv, UdpTransportConfig config, long nowNanos, Output output) {
        this.conv = conv;
        this.config = Objects.requireNonNull(config, "config");
        this.output = Objects.requireNonNull(output, "output");
        this.lastSentNanos = nowNanos;
        this.lastReceivedNanos = nowNanos;
    }

    public int conv() {
        return conv;
    }

    public synchronized void sendReliable(byte[] payload, long nowNanos) {
        requireOpen();
        int seq = nextSendSeq++;
        byte[] datagram = ArqPacket.reliable(conv, seq, payload).encode();
        pending.put(seq, new Pending(datagram, nowNanos));
        transmit(datagram, nowNanos);
    }

    public synchronized void sendUnreliable(byte[] payload, long nowNanos) {
        requireOpen();
        transmit(ArqPacket.unreliable(conv, payload).encode(), nowNanos);
    }

    /**
     * Answer a repeated handshake from the peer (our earlier reply was lost).
     */
    public synchronized void sendHelloAck(long nowNanos) {
        if (!closed) {
            transmit(ArqPacket.control(ArqPacket.Type.HELLO_ACK, conv).encode(), nowNanos);
        }
    }

    public synchronized void onPacket(ArqPacket packet, long nowNanos) {
        if (closed || packet.conv() != conv) {
            return;
        }
        lastReceivedNanos = nowNanos;

        switch (packet.type()) {
            case RELIABLE -> onReliable(packet, nowNanos);
            case ACK -> pending.remove(packet.seq());
            case UNRELIABLE -> output.onMessage(packet.payload());
            case HELLO -> sendHelloAck(nowNanos);
            case BYE -> finish(null);
            case HELLO_ACK, HEARTBEAT -> {
                // liveness only
            }
        }
    }

    private void onReliable(ArqPacket packet, long nowNanos) {
        int distance = packet.seq() - nextExpectedSeq;
        if (distance < 0) {
            transmit(ArqPacket.ack(conv, packet.seq()).encode(), nowNanos);
            return;
        }
        if (distance >= config.receiveWindow()) {
            return;
        }

        transmit(ArqPacket.ack(conv, packet.seq()).encode(), nowNanos);
        if (distance > 0) {
            outOfOrder.putIfAbsent(packet.seq(), packet.payload());
            return;
        }

        output.onMessage(packet.payload());
        nextExpectedSeq++;
        byte[] next;
        while ((next = outOfOrder.remove(nextExpectedSeq)) != null) {
            output.onMessage(next);
            nextExpectedSeq++;
        }
    }

    /**
     * Advance time: retransmit, heartbeat, and detect a dead peer.
     */
    public synchronized void tick(long nowNanos) {
        if (closed) {
            return;
        }

        if (nowNanos - lastReceivedNanos >= config.idleTimeout().toNanos()) {
            finish(new ChannelClosedException("No traffic from peer for " + config.idleTimeout()));
            return;
        }

        long retransmitNanos = config.retransmitInterval().toNanos();
        for (Iterator<Pending> it = pending.values().iterator(); it.hasNext(); ) {
            Pending p = it.next();
            if (nowNanos - p.lastSentNanos < retransmitNanos) {
                continue;
            }
            if (p.retransmits >= config.maxRetransmits()) {
                finish(new ChannelClosedException(
                    "Packet unacknowledged after " + config.maxRetransmits() + " retransmissions"));
                return;
            }
            p.retransmits++;
            p.lastSentNanos = nowNanos;
            retransmissions++;
            transmit(p.datagram, nowNanos);
        }

        if (nowNanos - lastSentNanos >= config.heartbeatInterval().toNanos()) {
            transmit(ArqPacket.control(ArqPacket.Type.HEARTBEAT, conv).encode(), nowNanos);
        }
    }

    /**
     * Orderly close: tell the peer and end the session. Idempotent.
     */
    public synchronized void close(long nowNanos) {
        if (closed) {
            return;
        }
        transmit(ArqPacket.control(ArqPacket.Type.BYE, conv).encode(), nowNanos);
        finish(null);
    }

    private void finish(Throwable cause) {
        closed = true;
        pending.clear();
        outOfOrder.clear();
        output.onClosed(cause);
    }

    private void transmit(byte[] datagram, long nowNanos) {
        lastSentNanos = nowNanos;
        output.transmit(datagram);
    }

    private void requireOpen() {
        if (closed) {
            throw new ChannelClosedException("Session " + conv + " is closed");
        }
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    public synchronized long retransmissions() {
        return retransmissions;
    }
}
