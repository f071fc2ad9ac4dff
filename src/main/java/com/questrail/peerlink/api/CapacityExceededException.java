package com.questrail.peerlink.api;

/**
 * A server at its connection limit refused a new peer. The peer's channel is
 * closed immediately; the exception exists for reporting.
 */
public final class CapacityExceededException extends NetworkException
{
    private final int maxConnections;

    public CapacityExceededException(int maxConnections) {
        super("Server full: maxConnections=" + maxConnections);
        this.maxConnections = maxConnections;
    }

    public int maxConnections() {
        return maxConnections;
    }
}
