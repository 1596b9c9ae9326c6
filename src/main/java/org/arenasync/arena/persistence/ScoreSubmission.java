package org.arenasync.arena.persistence;

import org.arenasync.arena.api.PlayerId;

import java.time.Instant;
import java.util.Objects;

/**
 * The score a player finished a session with, fed into every periodic board.
 *
 * @param playerId    Stable identity.
 * @param displayName Name shown on the player boards.
 * @param teamId      Team of the session, null when the player had none.
 * @param score       Final session score.
 * @param achievedAt  When the session ended.
 */
public record ScoreSubmission(PlayerId playerId, String displayName, String teamId, long score, Instant achievedAt) {

    public ScoreSubmission {
        Objects.requireNonNull(playerId, "playerId");
        Objects.requireNonNull(displayName, "displayName");
        Objects.requireNonNull(achievedAt, "achievedAt");
    }
}
