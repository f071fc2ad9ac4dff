package com.questrail.peerlink.api;

/**
 * Client connection state. Each connect attempt moves
 * {@code DISCONNECTED -> CONNECTING -> (CONNECTED | DISCONNECTED)}; a host-mode
 * connect goes straight to {@code CONNECTED}.
 */
public enum ConnectState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED
}
