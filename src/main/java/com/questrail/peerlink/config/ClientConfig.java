package com.questrail.peerlink.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Client role configuration.
 *
 * <ul>
 *   <li><b>pingInterval</b>: cadence of time-sync pings to a remote server</li>
 *   <li><b>pingWindowSize</b>: number of samples the round-trip and offset
 *       averages are smoothed over</li>
 * </ul>
 */
public record ClientConfig(Duration pingInterval, int pingWindowSize) {

    public ClientConfig {
        Objects.requireNonNull(pingInterval, "pingInterval");
        if (pingInterval.isNegative() || pingInterval.isZero()) {
            throw new IllegalArgumentException("pingInterval must be > 0");
        }
        if (pingWindowSize < 1) {
            throw new IllegalArgumentException("pingWindowSize must be >= 1");
        }
    }

    public static ClientConfig defaults() {
        return new ClientConfig(Duration.ofSeconds(2), 10);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Duration pingInterval = Duration.ofSeconds(2);
        private int pingWindowSize = 10;

        public Builder withPingInterval(Duration pingInterval) {
            this.pingInterval = pingInterval;
            return this;
        }

        public Builder withPingWindowSize(int pingWindowSize) {
            this.pingWindowSize = pingWindowSize;
            return this;
        }

        public ClientConfig build() {
            return new ClientConfig(pingInterval, pingWindowSize);
        }
    }
}
