package com.questrail.peerlink.connection;

import java.util.Objects;

/**
 * Stable type keys.
 *
 * <p>A message type is identified on the wire by a 32-bit hash of its
 * fully-qualified class name. The hash depends only on the name, so two
 * independently built processes agree on it whatever order they register
 * handlers in.</p>
 */
public final class MessageTypes {

    private MessageTypes() {}

    public static int typeKey(Class<?> type) {
        return typeKey(Objects.requireNonNull(type, "type").getName());
    }

    /**
     * {@code h = 23; for each char c: h = h * 31 + c}, with 32-bit overflow.
     */
    public static int typeKey(String typeName) {
        Objects.requireNonNull(typeName, "typeName");
        int hash = 23;
        for (int i = 0; i < typeName.length(); i++) {
            hash = hash * 31 + typeName.charAt(i);
        }
        return hash;
    }
}
