package org.arenasync.arena.persistence;

import java.util.Locale;

/**
 * Whose scores a periodic board ranks. A team's entry is the best score any of its
 * members finished a session with.
 */
public enum BoardScope {
    PLAYER,
    TEAM;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @throws IllegalArgumentException unless {@code raw} is "player" or "team".
     */
    public static BoardScope parse(String raw) {
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown board scope '" + raw + "', expected player or team", e);
        }
    }
}
