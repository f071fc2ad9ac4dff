package com.questrail.peerlink.api;

/**
 * Server lifecycle. {@code IDLE -> LISTENING -> IDLE}, restartable.
 */
public enum ServerState {
    IDLE,
    LISTENING
}
