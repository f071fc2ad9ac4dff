package com.questrail.peerlink.observability;

/**
 * No-op implementation of NetworkObservabilitySink.
 */
public final class NullObservabilitySink implements NetworkObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(StateTransitionEvent event) {}

    @Override
    public void onConnectionEvent(ConnectionEvent event) {}

    @Override
    public void onMessageDropped(MessageDroppedEvent event) {}

    @Override
    public void onError(NetworkErrorEvent event) {}
}
