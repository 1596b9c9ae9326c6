package org.arenasync.arena.leaderboard;

import org.arenasync.arena.api.PlayerId;

/**
 * One ranked row of a published leaderboard.
 *
 * @param playerId    The player.
 * @param displayName Name shown to clients.
 * @param score       Current score.
 * @param rank        1-based rank, derived at publication.
 */
public record LeaderboardEntry(PlayerId playerId, String displayName, long score, int rank) {
}
