package org.arenasync.arena.session;

/**
 * Lifecycle of a session: {@code CONNECTING -> AUTHENTICATED -> ACTIVE -> DRAINING -> CLOSED}.
 */
public enum SessionState {
    CONNECTING,
    AUTHENTICATED,
    /** Subscribed; receives world frames. */
    ACTIVE,
    /** No new world frames; waiting for the client to acknowledge the last one. */
    DRAINING,
    CLOSED
}
