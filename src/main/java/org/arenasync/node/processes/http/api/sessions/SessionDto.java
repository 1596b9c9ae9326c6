package org.arenasync.node.processes.http.api.sessions;

import org.arenasync.arena.session.SessionView;

/**
 * Monitoring view of one session.
 */
public record SessionDto(
    String sessionId,
    String playerId,
    String displayName,
    String teamId,
    String state,
    String trust,
    String remoteAddress,
    String userAgent,
    String createdAt,
    String lastSeen,
    long lastAckedTick,
    long score,
    int pendingFrames,
    String closeReason
) {
    public static SessionDto from(final SessionView view) {
        return new SessionDto(
            view.sessionId().toString(),
            view.playerId().value(),
            view.displayName(),
            view.teamId(),
            view.state().name(),
            view.trust().name(),
            view.remoteAddress(),
            view.userAgent(),
            view.createdAt().toString(),
            view.lastSeen().toString(),
            view.lastAckedTick(),
            view.score(),
            view.pendingFrames(),
            view.closeReason() == null ? null : view.closeReason().name()
        );
    }
}
