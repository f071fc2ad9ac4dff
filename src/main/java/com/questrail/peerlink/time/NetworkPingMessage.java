package com.questrail.peerlink.time;

/**
 * Time-sync request sent by a remote client. {@code clientTimeNanos} is the
 * client's monotonic clock at send time and is echoed back unchanged.
 */
public record NetworkPingMessage(long clientTimeNanos) {}
