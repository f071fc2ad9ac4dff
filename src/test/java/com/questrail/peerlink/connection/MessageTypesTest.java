package com.questrail.peerlink.connection;

import com.questrail.peerlink.TestMessages;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MessageTypesTest {

    @Test
    void keyFollowsSeededPolynomialHash() {
        assertEquals(23, MessageTypes.typeKey(""));
        assertEquals(23 * 31 + 'a', MessageTypes.typeKey("a"));
        assertEquals((23 * 31 + 'a') * 31 + 'b', MessageTypes.typeKey("ab"));
    }

    @Test
    void classKeyUsesFullyQualifiedName() {
        assertEquals(
            MessageTypes.typeKey("com.questrail.peerlink.TestMessages$Chat"),
            MessageTypes.typeKey(TestMessages.Chat.class));
    }

    @Test
    void keyIsStableAcrossCalls() {
        assertEquals(MessageTypes.typeKey(TestMessages.Chat.class), MessageTypes.typeKey(TestMessages.Chat.class));
        assertNotEquals(MessageTypes.typeKey(TestMessages.Chat.class), MessageTypes.typeKey(TestMessages.Blob.class));
    }

    @Test
    void knownCollisionProducesEqualKeys() {
        assertEquals(MessageTypes.typeKey(TestMessages.Aa.class), MessageTypes.typeKey(TestMessages.BB.class));
    }
}
