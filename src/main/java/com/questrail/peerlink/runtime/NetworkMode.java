package com.questrail.peerlink.runtime;

/**
 * Which roles of a {@link NetworkRuntime} are active.
 */
public enum NetworkMode {
    OFFLINE,
    SERVER_ONLY,
    CLIENT_ONLY,
    /** Server listening and a local client connected to it in-process. */
    HOST
}
