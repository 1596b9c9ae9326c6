package org.arenasync.arena.api;

/**
 * Stable identifier of one client connection. Every component other than the
 * connection manager refers to sessions through this id only.
 *
 * @param value The numeric id, unique for the lifetime of the process.
 */
public record SessionId(long value) {

    public SessionId {
        if (value <= 0) {
            throw new IllegalArgumentException("SessionId must be positive, got " + value);
        }
    }

    @Override
    public String toString() {
        return "s-" + value;
    }
}
