package com.questrail.peerlink.api;

/**
 * Delivery class requested per send.
 *
 * <p>Every transport honours {@link #RELIABLE}. Transports without a separate
 * unreliable path (stream sockets, in-memory pipes) deliver {@link #UNRELIABLE}
 * traffic reliably and in order as well.</p>
 */
public enum ChannelKind {
    /** Delivered exactly once, in send order. */
    RELIABLE,
    /** May be dropped; no ordering guarantee relative to other sends. */
    UNRELIABLE
}
