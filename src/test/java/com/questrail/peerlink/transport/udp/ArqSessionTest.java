package com.questrail.peerlink.transport.udp;

import com.questrail.peerlink.api.ChannelClosedException;
import com.questrail.peerlink.config.UdpTransportConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ArqSessionTest {

    private static final int CONV = 0x1234;
    private static final long MS = 1_000_000L;

    private final UdpTransportConfig config = UdpTransportConfig.builder()
        .withRetransmitInterval(Duration.ofMillis(100))
        .withMaxRetransmits(3)
        .withHeartbeatInterval(Duration.ofSeconds(1))
        .withIdleTimeout(Duration.ofSeconds(10))
        .withReceiveWindow(4)
        .build();

    /**
     * Records everything the session emits.
     */
    private static final class RecordingOutput implements ArqSession.Output {
        final List<ArqPacket> transmitted = new ArrayList<>();
        final List<String> messages = new ArrayList<>();
        final List<Throwable> closes = new ArrayList<>();
        int closeCount;

        @Override
        public void transmit(byte[] datagram) {
            transmitted.add(ArqPacket.decode(datagram));
        }

        @Override
        public void onMessage(byte[] message) {
            messages.add(new String(message, StandardCharsets.UTF_8));
        }

        @Override
        public void onClosed(Throwable cause) {
            closeCount++;
            closes.add(cause);
        }

        List<ArqPacket> ofType(ArqPacket.Type type) {
            return transmitted.stream().filter(p -> p.type() == type).collect(Collectors.toList());
        }
    }

    private RecordingOutput out;
    private ArqSession session;

    @BeforeEach
    void setUp() {
        out = new RecordingOutput();
        session = new ArqSession(CONV, config, 0, out);
    }

    private static byte[] text(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static ArqPacket reliable(int seq, String s) {
        return ArqPacket.reliable(CONV, seq, text(s));
    }

    // -------------------------------------------------------------------------
    // Receiving
    // -------------------------------------------------------------------------

    @Test
    void inOrderPacketsAreDeliveredAndAcked() {
        session.onPacket(reliable(0, "a"), 0);
        session.onPacket(reliable(1, "b"), 0);

        assertEquals(List.of("a", "b"), out.messages);
        assertEquals(List.of(ArqPacket.ack(CONV, 0), ArqPacket.ack(CONV, 1)), out.ofType(ArqPacket.Type.ACK));
    }

    @Test
    void reorderedPacketsAreBufferedUntilGapFills() {
        session.onPacket(reliable(2, "c"), 0);
        session.onPacket(reliable(1, "b"), 0);
        assertTrue(out.messages.isEmpty());

        session.onPacket(reliable(0, "a"), 0);

        assertEquals(List.of("a", "b", "c"), out.messages);
        assertEquals(3, out.ofType(ArqPacket.Type.ACK).size());
    }

    @Test
    void duplicatesAreReackedButDeliveredOnce() {
        session.onPacket(reliable(0, "a"), 0);
        session.onPacket(reliable(0, "a"), 0);
        session.onPacket(reliable(2, "c"), 0);
        session.onPacket(reliable(2, "c"), 0);
        session.onPacket(reliable(1, "b"), 0);

        assertEquals(List.of("a", "b", "c"), out.messages);
        assertEquals(5, out.ofType(ArqPacket.Type.ACK).size());
    }

    @Test
    void packetsBeyondReceiveWindowAreDroppedUnacked() {
        session.onPacket(reliable(4, "too far"), 0);

        assertTrue(out.messages.isEmpty());
        assertTrue(out.ofType(ArqPacket.Type.ACK).isEmpty());
    }

    @Test
    void unreliablePayloadIsDeliveredImmediately() {
        session.onPacket(ArqPacket.unreliable(CONV, text("u")), 0);
        assertEquals(List.of("u"), out.messages);
        assertTrue(out.transmitted.isEmpty());
    }

    @Test
    void packetsForAnotherSessionAreIgnored() {
        session.onPacket(ArqPacket.reliable(CONV + 1, 0, text("x")), 0);
        assertTrue(out.messages.isEmpty());
        assertTrue(out.transmitted.isEmpty());
    }

    @Test
    void repeatedHelloIsAnsweredWithHelloAck() {
        session.onPacket(ArqPacket.control(ArqPacket.Type.HELLO, CONV), 0);
        assertEquals(List.of(ArqPacket.control(ArqPacket.Type.HELLO_ACK, CONV)), out.transmitted);
    }

    // -------------------------------------------------------------------------
    // Sending and retransmission
    // -------------------------------------------------------------------------

    @Test
    void reliableSendsUseConsecutiveSequenceNumbers() {
        session.sendReliable(text("a"), 0);
        session.sendReliable(text("b"), 0);

        assertEquals(List.of(reliable(0, "a"), reliable(1, "b")), out.transmitted);
        assertEquals(2, session.pendingCount());
    }

    @Test
    void ackClearsPendingPacket() {
        session.sendReliable(text("a"), 0);
        session.onPacket(ArqPacket.ack(CONV, 0), 10 * MS);

        assertEquals(0, session.pendingCount());
        session.tick(500 * MS);
        assertEquals(0, session.retransmissions());
    }

    @Test
    void unackedPacketIsRetransmittedAfterInterval() {
        session.sendReliable(text("a"), 0);

        session.tick(99 * MS);
        assertEquals(1, out.ofType(ArqPacket.Type.RELIABLE).size());

        session.tick(100 * MS);
        assertEquals(2, out.ofType(ArqPacket.Type.RELIABLE).size());
        assertEquals(1, session.retransmissions());
    }

    @Test
    void sessionFailsAfterMaxRetransmits() {
        session.sendReliable(text("a"), 0);

        for (int i = 1; i <= 3; i++) {
            session.tick(i * 100 * MS);
        }
        assertFalse(session.isClosed());

        session.tick(400 * MS);

        assertTrue(session.isClosed());
        assertInstanceOf(ChannelClosedException.class, out.closes.get(0));
        assertEquals(3, session.retransmissions());
        assertThrows(ChannelClosedException.class, () -> session.sendReliable(text("late"), 500 * MS));
    }

    @Test
    void unreliableSendIsNotTracked() {
        session.sendUnreliable(text("u"), 0);

        assertEquals(List.of(ArqPacket.unreliable(CONV, text("u"))), out.transmitted);
        assertEquals(0, session.pendingCount());
    }

    // -------------------------------------------------------------------------
    // Liveness
    // -------------------------------------------------------------------------

    @Test
    void heartbeatGoesOutWhenSendSideIsQuiet() {
        session.tick(999 * MS);
        assertTrue(out.ofType(ArqPacket.Type.HEARTBEAT).isEmpty());

        session.tick(1_000 * MS);
        assertEquals(1, out.ofType(ArqPacket.Type.HEARTBEAT).size());
    }

    @Test
    void recentSendSuppressesHeartbeat() {
        session.sendUnreliable(text("u"), 900 * MS);
        session.tick(1_000 * MS);
        assertTrue(out.ofType(ArqPacket.Type.HEARTBEAT).isEmpty());
    }

    @Test
    void silentPeerTimesOut() {
        session.onPacket(ArqPacket.control(ArqPacket.Type.HEARTBEAT, CONV), 5_000 * MS);
        session.tick(14_999 * MS);
        assertFalse(session.isClosed());

        session.tick(15_000 * MS);

        assertTrue(session.isClosed());
        assertInstanceOf(ChannelClosedException.class, out.closes.get(0));
    }

    // -------------------------------------------------------------------------
    // Close
    // -------------------------------------------------------------------------

    @Test
    void byeFromPeerClosesWithoutCause() {
        session.onPacket(ArqPacket.control(ArqPacket.Type.BYE, CONV), 0);

        assertTrue(session.isClosed());
        assertEquals(1, out.closeCount);
        assertNull(out.closes.get(0));
    }

    @Test
    void localCloseSendsByeOnce() {
        session.close(0);
        session.close(0);

        assertEquals(List.of(ArqPacket.control(ArqPacket.Type.BYE, CONV)), out.transmitted);
        assertEquals(1, out.closeCount);
    }

    @Test
    void closedSessionIgnoresTraffic() {
        session.close(0);
        session.onPacket(reliable(0, "a"), 0);
        session.tick(60_000 * MS);

        assertTrue(out.messages.isEmpty());
        assertEquals(1, out.transmitted.size());
    }
}
