package org.arenasync.arena.chat;

/**
 * What happened to a submitted chat message.
 */
public enum ChatOutcome {
    DELIVERED,
    /** Delivered with disallowed terms masked. */
    DELIVERED_FILTERED,
    REJECTED,
    RATE_LIMITED,
    TOO_LONG,
    EMPTY,
    UNKNOWN_TARGET
}
