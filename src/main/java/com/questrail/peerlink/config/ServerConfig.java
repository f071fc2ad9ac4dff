package com.questrail.peerlink.config;

/**
 * Server role configuration.
 *
 * <ul>
 *   <li><b>maxConnections</b>: admission limit, host-mode client included.
 *       A peer arriving at capacity is disconnected without being added.</li>
 *   <li><b>listening</b>: when {@code false} the server accepts only
 *       in-process (host-mode) connections and needs no transport.</li>
 * </ul>
 */
public record ServerConfig(int maxConnections, boolean listening) {

    public static final int DEFAULT_MAX_CONNECTIONS = 4;

    public ServerConfig {
        if (maxConnections < 1) {
            throw new IllegalArgumentException("maxConnections must be >= 1");
        }
    }

    public static ServerConfig defaults() {
        return new ServerConfig(DEFAULT_MAX_CONNECTIONS, true);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxConnections = DEFAULT_MAX_CONNECTIONS;
        private boolean listening = true;

        public Builder withMaxConnections(int maxConnections) {
            this.maxConnections = maxConnections;
            return this;
        }

        public Builder withListening(boolean listening) {
            this.listening = listening;
            return this;
        }

        public ServerConfig build() {
            return new ServerConfig(maxConnections, listening);
        }
    }
}
