package com.questrail.peerlink.transport;

/**
 * Callback sink for a listening {@link Transport}.
 *
 * <p>Callbacks may arrive on transport threads. Implementations must not
 * block them for long.</p>
 */
public interface TransportListener
{
    /**
     * A peer connected. The channel is open and already buffering frames.
     */
    void onConnected(TransportChannel channel);

    /**
     * Listening ended.
     *
     * @param cause failure that stopped the transport, or {@code null} for an
     *              orderly {@link Transport#disconnect()}
     */
    void onStopped(Throwable cause);
}
