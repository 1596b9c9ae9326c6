package org.arenasync.arena.session;

import org.arenasync.arena.api.PlayerId;
import org.arenasync.arena.api.SessionId;

import java.time.Instant;

/**
 * Read-only copy of a session for monitoring.
 */
public record SessionView(
    SessionId sessionId,
    PlayerId playerId,
    String displayName,
    String teamId,
    SessionState state,
    TrustLevel trust,
    String remoteAddress,
    String userAgent,
    Instant createdAt,
    Instant lastSeen,
    long lastAckedTick,
    long score,
    int pendingFrames,
    CloseReason closeReason
) {
}
