package org.arenasync.arena.chat;

/**
 * Delivery scope of a chat message. The ordinal is the wire code.
 */
public enum ChatScope {
    BROADCAST,
    TEAM,
    WHISPER;

    public static ChatScope fromCode(int code) {
        ChatScope[] values = values();
        if (code < 0 || code >= values.length) {
            throw new IllegalArgumentException("Unknown chat scope code " + code);
        }
        return values[code];
    }
}
