package com.questrail.peerlink.config;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;

/**
 * UdpTransportConfig
 * -----------------------------------------------------------------------------
 * Datagram transport and reliability-session tuning.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>bindAddress</b>: listen address; its port is the default port for
 *       client URIs that name none</li>
 *   <li><b>mtu</b>: largest datagram written. The largest message is the MTU
 *       minus the session header.</li>
 *   <li><b>retransmitInterval</b>: delay before an unacknowledged reliable
 *       packet is sent again</li>
 *   <li><b>maxRetransmits</b>: retransmissions of one packet before the
 *       session is declared dead</li>
 *   <li><b>heartbeatInterval</b>: keep-alive cadence on an otherwise quiet
 *       session</li>
 *   <li><b>idleTimeout</b>: silence from the peer after which the session is
 *       closed</li>
 *   <li><b>connectTimeout</b>: how long a dial waits for the handshake reply</li>
 *   <li><b>receiveWindow</b>: out-of-order reliable packets buffered ahead of
 *       the next expected sequence number</li>
 * </ul>
 */
public record UdpTransportConfig(
    InetSocketAddress bindAddress,
    int mtu,
    Duration retransmitInterval,
    int maxRetransmits,
    Duration heartbeatInterval,
    Duration idleTimeout,
    Duration connectTimeout,
    int receiveWindow
) {
    public static final int DEFAULT_PORT = 7777;

    /** Smallest MTU that still leaves room for a useful payload. */
    public static final int MIN_MTU = 64;

    public UdpTransportConfig {
        Objects.requireNonNull(bindAddress, "bindAddress");
        Objects.requireNonNull(retransmitInterval, "retransmitInterval");
        Objects.requireNonNull(heartbeatInterval, "heartbeatInterval");
        Objects.requireNonNull(idleTimeout, "idleTimeout");
        Objects.requireNonNull(connectTimeout, "connectTimeout");

        if (mtu < MIN_MTU || mtu > 65507) {
            throw new IllegalArgumentException("mtu must be in [" + MIN_MTU + ", 65507]");
        }
        requirePositive(retransmitInterval, "retransmitInterval");
        requirePositive(heartbeatInterval, "heartbeatInterval");
        requirePositive(idleTimeout, "idleTimeout");
        requirePositive(connectTimeout, "connectTimeout");
        if (maxRetransmits < 1) {
            throw new IllegalArgumentException("maxRetransmits must be >= 1");
        }
        if (receiveWindow < 1) {
            throw new IllegalArgumentException("receiveWindow must be >= 1");
        }
        if (idleTimeout.compareTo(heartbeatInterval) <= 0) {
            throw new IllegalArgumentException("idleTimeout must exceed heartbeatInterval");
        }
    }

    private static void requirePositive(Duration d, String name) {
        if (d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException(name + " must be > 0");
        }
    }

    public static UdpTransportConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private InetSocketAddress bindAddress = new InetSocketAddress(DEFAULT_PORT);
        private int mtu = 1200;
        private Duration retransmitInterval = Duration.ofMillis(100);
        private int maxRetransmits = 20;
        private Duration heartbeatInterval = Duration.ofSeconds(1);
        private Duration idleTimeout = Duration.ofSeconds(10);
        private Duration connectTimeout = Duration.ofSeconds(5);
        private int receiveWindow = 256;

        public Builder withBindAddress(InetSocketAddress bindAddress) {
            this.bindAddress = bindAddress;
            return this;
        }

        public Builder withMtu(int mtu) {
            this.mtu = mtu;
            return this;
        }

        public Builder withRetransmitInterval(Duration retransmitInterval) {
            this.retransmitInterval = retransmitInterval;
            return this;
        }

        public Builder withMaxRetransmits(int maxRetransmits) {
            this.maxRetransmits = maxRetransmits;
            return this;
        }

        public Builder withHeartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
            return this;
        }

        public Builder withIdleTimeout(Duration idleTimeout) {
            this.idleTimeout = idleTimeout;
            return this;
        }

        public Builder withConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder withReceiveWindow(int receiveWindow) {
            this.receiveWindow = receiveWindow;
            return this;
        }

        public UdpTransportConfig build() {
            return new UdpTransportConfig(bindAddress, mtu, retransmitInterval, maxRetransmits,
                heartbeatInterval, idleTimeout, connectTimeout, receiveWindow);
        }
    }
}
