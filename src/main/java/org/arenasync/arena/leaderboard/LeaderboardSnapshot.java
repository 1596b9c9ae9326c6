package org.arenasync.arena.leaderboard;

import java.time.Instant;
import java.util.List;

/**
 * Immutable published ranking.
 *
 * @param version     Increases by one with every publication that changed the ranking.
 * @param publishedAt Publication time.
 * @param entries     Ranked entries, best first.
 */
public record LeaderboardSnapshot(long version, Instant publishedAt, List<LeaderboardEntry> entries) {

    public static final LeaderboardSnapshot EMPTY = new LeaderboardSnapshot(0L, Instant.EPOCH, List.of());

    public LeaderboardSnapshot {
        entries = List.copyOf(entries);
    }

    /**
     * Returns the first {@code limit} entries.
     */
    public List<LeaderboardEntry> top(int limit) {
        return entries.size() <= limit ? entries : entries.subList(0, limit);
    }
}
