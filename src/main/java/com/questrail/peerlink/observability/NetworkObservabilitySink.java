package com.questrail.peerlink.observability;

/**
 * Receives the runtime's observability events. Implementations provide
 * logging, metrics or test recording.
 *
 * <p>Callbacks arrive on read-loop and transport threads and must be
 * thread-safe.</p>
 */
public interface NetworkObservabilitySink {
    /**
     * A client or server changed lifecycle state.
     */
    void onStateTransition(StateTransitionEvent event);

    /**
     * A connection was accepted, rejected, authenticated or closed.
     */
    void onConnectionEvent(ConnectionEvent event);

    /**
     * An inbound message was discarded.
     */
    void onMessageDropped(MessageDroppedEvent event);

    /**
     * Something failed: a handler, a decode, a dial, a fire-and-forget send.
     */
    void onError(NetworkErrorEvent event);
}
