package com.questrail.peerlink.observability;

import java.time.Instant;

/**
 * An inbound message was discarded without reaching a handler.
 */
public record MessageDroppedEvent(
    Instant timestamp,
    long connectionId,
    int typeKey,
    Reason reason
) {
    public enum Reason {
        /** No handler is registered for the type key. */
        UNREGISTERED_TYPE,
        /** The handler requires an authenticated connection. */
        NOT_AUTHENTICATED
    }
}
