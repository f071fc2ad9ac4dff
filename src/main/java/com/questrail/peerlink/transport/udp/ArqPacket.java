package com.questrail.peerlink.transport.udp;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Objects;

/**
 * One datagram of the reliability session protocol.
 *
 * <pre>
 *   [type:1][conv:4]                    HELLO, HELLO_ACK, HEARTBEAT, BYE
 *   [type:1][conv:4][seq:4]             ACK
 *   [type:1][conv:4][seq:4][payload]    RELIABLE
 *   [type:1][conv:4][payload]           UNRELIABLE
 * </pre>
 * All integers are big-endian. {@code conv} identifies the session and is
 * chosen by the dialing side.
 */
public record ArqPacket(Type type, int conv, int seq, byte[] payload) {

    public static final int BASE_HEADER_SIZE = 5;
    public static final int RELIABLE_HEADER_SIZE = BASE_HEADER_SIZE + 4;

    private static final byte[] EMPTY = new byte[0];

    public enum Type {
        HELLO(1),
        HELLO_ACK(2),
        RELIABLE(3),
        ACK(4),
        UNRELIABLE(5),
        HEARTBEAT(6),
        BYE(7);

        private final int code;

        Type(int code) {
            this.code = code;
        }

        public int code() {
            return code;
        }

        static Type fromCode(int code) {
            for (Type t : values()) {
                if (t.code == code) {
                    return t;
                }
            }
            throw new IllegalArgumentException("Unknown packet type " + code);
        }

        boolean hasSeq() {
            return this == RELIABLE || this == ACK;
        }

        boolean hasPayload() {
            return this == RELIABLE || this == UNRELIABLE;
        }
    }

    public ArqPacket {
        Objects.requireNonNull(type, "type");
        payload = payload != null ? payload : EMPTY;
    }

    public static ArqPacket control(Type type, int conv) {
        return new ArqPacket(type, conv, 0, EMPTY);
    }

    public static ArqPacket reliable(int conv, int seq, byte[] payload) {
        return new ArqPacket(Type.RELIABLE, conv, seq, payload);
    }

    public static ArqPacket ack(int conv, int seq) {
        return new ArqPacket(Type.ACK, conv, seq, EMPTY);
    }

    public static ArqPacket unreliable(int conv, byte[] payload) {
        return new ArqPacket(Type.UNRELIABLE, conv, 0, payload);
    }

    public byte[] encode() {
        int size = (type.hasSeq() ? RELIABLE_HEADER_SIZE : BASE_HEADER_SIZE)
            + (type.hasPayload() ? payload.length : 0);
        ByteBuffer buf = ByteBuffer.allocate(size);
        buf.put((byte) type.code());
        buf.putInt(conv);
        if (type.hasSeq()) {
            buf.putInt(seq);
        }
        if (type.hasPayload()) {
            buf.put(payload);
        }
        return buf.array();
    }

    /**
     * @throws IllegalArgumentException for a truncated datagram or unknown type
     */
    public static ArqPacket decode(byte[] datagram) {
        Objects.requireNonNull(datagram, "datagram");
        if (datagram.length < BASE_HEADER_SIZE) {
            throw new IllegalArgumentException("Datagram of " + datagram.length + " bytes is too short");
        }
        ByteBuffer buf = ByteBuffer.wrap(datagram);
        Type type = Type.fromCode(buf.get() & 0xFF);
        int conv = buf.getInt();
        int seq = 0;
        if (type.hasSeq()) {
            if (buf.remaining() < 4) {
                throw new IllegalArgumentException(type + " datagram has no sequence number");
            }
            seq = buf.getInt();
        }
        byte[] payload = EMPTY;
        if (type.hasPayload()) {
            payload = Arrays.copyOfRange(datagram, buf.position(), datagram.length);
        }
        return new ArqPacket(type, conv, seq, payload);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ArqPacket other
            && type == other.type
            && conv == other.conv
            && seq == other.seq
            && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, conv, seq, Arrays.hashCode(payload));
    }

    @Override
    public String toString() {
        return "ArqPacket[" + type + ", conv=" + conv + ", seq=" + seq + ", payload=" + payload.length + "B]";
    }
}
