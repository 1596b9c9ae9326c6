package org.arenasync.arena.session;

/**
 * Trust classification of a session, decided at handshake.
 */
public enum TrustLevel {
    /** Presented a valid identity token. */
    VERIFIED,
    /** Anonymous player with an ephemeral identity. */
    UNVERIFIED,
    /** Connection metadata looks automated. Never ranked on the leaderboard. */
    SUSPECTED_BOT
}
