package com.questrail.peerlink.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of NetworkObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jNetworkObservabilitySink implements NetworkObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jNetworkObservabilitySink.class);

    @Override
    public void onStateTransition(StateTransitionEvent event) {
        log.info("{} state: {} -> {}", event.role(), event.from(), event.to());
    }

    @Override
    public void onConnectionEvent(ConnectionEvent event) {
        if (event.kind() == ConnectionEvent.Kind.REJECTED
                || event.kind() == ConnectionEvent.Kind.AUTHENTICATION_FAILED) {
            log.warn("{} connection#{} ({}): {}",
                event.role(), event.connectionId(), describe(event), event.kind());
            return;
        }
        log.info("{} connection#{} ({}): {}",
            event.role(), event.connectionId(), describe(event), event.kind());
    }

    @Override
    public void onMessageDropped(MessageDroppedEvent event) {
        log.debug("Dropped message type={} on connection#{}: {}",
            Integer.toHexString(event.typeKey()), event.connectionId(), event.reason());
    }

    @Override
    public void onError(NetworkErrorEvent event) {
        log.error("Network error: {}", event.message(), event.cause());
    }

    private static String describe(ConnectionEvent event) {
        return event.remoteAddress() != null ? event.remoteAddress().toString() : "local";
    }
}
