package com.questrail.peerlink.config;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;

/**
 * Stream transport configuration.
 *
 * <p>Frames carry a two-byte length prefix, so {@code maxMessageSize} can not
 * exceed {@value #MAX_FRAME_SIZE}. {@code bindAddress} is the listen address;
 * its port is also the default port when a client URI names none.</p>
 */
public record TcpTransportConfig(
    InetSocketAddress bindAddress,
    Duration connectTimeout,
    int maxMessageSize
) {
    public static final int MAX_FRAME_SIZE = 0xFFFF;
    public static final int DEFAULT_PORT = 7777;

    public TcpTransportConfig {
        Objects.requireNonNull(bindAddress, "bindAddress");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be > 0");
        }
        if (maxMessageSize < 1 || maxMessageSize > MAX_FRAME_SIZE) {
            throw new IllegalArgumentException("maxMessageSize must be in [1, " + MAX_FRAME_SIZE + "]");
        }
    }

    public static TcpTransportConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private InetSocketAddress bindAddress = new InetSocketAddress(DEFAULT_PORT);
        private Duration connectTimeout = Duration.ofSeconds(5);
        private int maxMessageSize = MAX_FRAME_SIZE;

        public Builder withBindAddress(InetSocketAddress bindAddress) {
            this.bindAddress = bindAddress;
            return this;
        }

        public Builder withConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder withMaxMessageSize(int maxMessageSize) {
            this.maxMessageSize = maxMessageSize;
            return this;
        }

        public TcpTransportConfig build() {
            return new TcpTransportConfig(bindAddress, connectTimeout, maxMessageSize);
        }
    }
}
