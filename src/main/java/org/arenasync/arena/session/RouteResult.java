package org.arenasync.arena.session;

/**
 * Outcome of routing one inbound message.
 */
public enum RouteResult {
    ACCEPTED,
    /** Well-formed but refused (chat rate limit, moderation). */
    REJECTED,
    /** Not applicable in the session's current state, or unknown session. */
    IGNORED,
    /** Could not be decoded; counted towards a protocol violation. */
    MALFORMED
}
