package org.arenasync.arena.api;

import java.util.Objects;
import java.util.UUID;

/**
 * Durable player identity key. Anonymous and degraded-mode sessions receive an
 * ephemeral id that is never written to the player store.
 *
 * @param value The identity string.
 */
public record PlayerId(String value) {

    private static final String EPHEMERAL_PREFIX = "anon-";

    public PlayerId {
        Objects.requireNonNull(value, "PlayerId value cannot be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException("PlayerId value cannot be blank");
        }
    }

    /**
     * Creates a fresh ephemeral identity.
     *
     * @return A new random ephemeral player id.
     */
    public static PlayerId ephemeral() {
        return new PlayerId(EPHEMERAL_PREFIX + UUID.randomUUID());
    }

    public boolean isEphemeral() {
        return value.startsWith(EPHEMERAL_PREFIX);
    }

    @Override
    public String toString() {
        return value;
    }
}
