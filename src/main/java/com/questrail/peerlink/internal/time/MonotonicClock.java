package com.questrail.peerlink.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every elapsed-time computation in the runtime: round-trip
 * measurement, retransmission deadlines, heartbeat and idle detection.
 *
 * <p>Wall-clock time ({@code Instant.now()}) is used only to stamp
 * observability events. Anything that compares two points in time goes
 * through this interface so tests can drive it by hand.</p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing value in nanoseconds. Only differences
     * between two readings are meaningful.
     */
    long nowNanos();
}
