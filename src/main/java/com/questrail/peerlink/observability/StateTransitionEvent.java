package com.questrail.peerlink.observability;

import java.time.Instant;

/**
 * A client or server changed lifecycle state.
 *
 * @param from previous {@code ConnectState} or {@code ServerState}
 * @param to   new state
 */
public record StateTransitionEvent(
    Instant timestamp,
    Role role,
    Enum<?> from,
    Enum<?> to
) {
}
