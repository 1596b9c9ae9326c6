package org.arenasync.arena.session;

import org.arenasync.arena.api.PlayerId;
import org.arenasync.arena.api.SessionId;
import org.arenasync.arena.broadcast.IFrameSink;
import org.arenasync.arena.persistence.PlayerRecord;
import org.arenasync.arena.persistence.ScoreSubmission;
import org.arenasync.arena.world.Region;

import java.time.Instant;
import java.util.Set;
import java.util.TreeSet;

/**
 * Mutable session state. Instances never leave {@link ConnectionManager}, which
 * guards every access by synchronizing on the instance.
 */
final class Session {

    final SessionId id;
    final PlayerId playerId;
    final String displayName;
    final String teamId;
    final TrustLevel trust;
    final String remoteAddress;
    final String userAgent;
    final Instant createdAt;
    final IFrameSink sink;
    /** Stored record at authentication, null for ephemeral identities. */
    final PlayerRecord storedRecord;

    SessionState state = SessionState.AUTHENTICATED;
    Instant lastSeen;
    long lastAckedTick = -1L;
    Region region = Region.ALL;
    long score;
    int consecutiveMalformed;
    boolean inWorld;
    CloseReason closeReason;
    Instant drainDeadline;
    final Set<String> moderationFlags = new TreeSet<>();

    Session(SessionId id, PlayerId playerId, String displayName, String teamId, TrustLevel trust,
            Handshake handshake, Instant now, PlayerRecord storedRecord) {
        this.id = id;
        this.playerId = playerId;
        this.displayName = displayName;
        this.teamId = teamId;
        this.trust = trust;
        this.remoteAddress = handshake.remoteAddress();
        this.userAgent = handshake.userAgent();
        this.createdAt = now;
        this.lastSeen = now;
        this.sink = handshake.sink();
        this.storedRecord = storedRecord;
    }

    boolean isEphemeral() {
        return storedRecord == null;
    }

    boolean isOpen() {
        return state == SessionState.AUTHENTICATED || state == SessionState.ACTIVE;
    }

    /**
     * The record written when the session ends.
     */
    PlayerRecord finalRecord(Instant now) {
        return new PlayerRecord(
            playerId,
            displayName,
            Math.max(storedRecord.bestScore(), score),
            moderationFlags,
            now,
            storedRecord.plays(),
            storedRecord.createdAt()
        ).merge(storedRecord);
    }

    /**
     * The session's contribution to the periodic boards.
     */
    ScoreSubmission finalScore(Instant now) {
        return new ScoreSubmission(playerId, displayName, teamId, score, now);
    }

    SessionView view(int pendingFrames) {
        return new SessionView(id, playerId, displayName, teamId, state, trust, remoteAddress, userAgent,
            createdAt, lastSeen, lastAckedTick, score, pendingFrames, closeReason);
    }
}
