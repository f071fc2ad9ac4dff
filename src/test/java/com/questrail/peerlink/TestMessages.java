package com.questrail.peerlink;

/**
 * Message types shared by tests.
 */
public final class TestMessages {

    private TestMessages() {}

    public record Chat(String text) {}

    public record Sequenced(int index) {}

    public record Boom(String reason) {}

    public record Blob(String data) {}

    public record Credentials(String token) {}

    public record Unregistered(int value) {}

    // "Aa" and "BB" produce the same type key.
    public record Aa(int value) {}

    public record BB(int value) {}
}
