package com.questrail.peerlink.time;

/**
 * Server reply to {@link NetworkPingMessage}.
 */
public record NetworkPongMessage(long clientTimeNanos, long serverTimeNanos) {}
