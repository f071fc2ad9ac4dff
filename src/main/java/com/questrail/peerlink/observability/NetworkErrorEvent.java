package com.questrail.peerlink.observability;

import java.time.Instant;

/**
 * An error or anomaly anywhere in the runtime.
 */
public record NetworkErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
