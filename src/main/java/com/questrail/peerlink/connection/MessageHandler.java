package com.questrail.peerlink.connection;

/**
 * Application callback for one message type.
 *
 * <p>Runs on the receiving connection's read-loop thread, one message at a
 * time, in arrival order. An exception is reported and the loop continues.</p>
 */
@FunctionalInterface
public interface MessageHandler<T> {
    void handle(NetworkConnection connection, T message);
}
