package com.questrail.peerlink.observability;

/**
 * Which side of a link produced an observability event.
 */
public enum Role {
    CLIENT,
    SERVER
}
