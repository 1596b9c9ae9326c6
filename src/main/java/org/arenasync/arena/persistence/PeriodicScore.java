package org.arenasync.arena.persistence;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * One row of a periodic board.
 *
 * @param key         Player id or team id.
 * @param displayName Name shown on the board.
 * @param score       Best score within the window.
 * @param achievedAt  When that score was set.
 * @param expiresAt   When the row leaves the board, null for the all-time board.
 */
public record PeriodicScore(String key, String displayName, long score, Instant achievedAt, Instant expiresAt) {

    /**
     * Board order: score descending, earlier achievement first, then key.
     */
    public static final Comparator<PeriodicScore> BY_SCORE = Comparator
        .comparingLong(PeriodicScore::score).reversed()
        .thenComparing(PeriodicScore::achievedAt)
        .thenComparing(PeriodicScore::key);

    public PeriodicScore {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(displayName, "displayName");
        Objects.requireNonNull(achievedAt, "achievedAt");
    }

    public boolean isLiveAt(Instant now) {
        return expiresAt == null || now.isBefore(expiresAt);
    }

    /**
     * Keeps the better of this row and a new score. A strictly higher score, or any
     * score once this row has expired, starts a fresh window; anything else leaves the
     * row untouched, so replaying a score changes nothing.
     */
    public PeriodicScore offer(String displayName, long score, Instant at, ScorePeriod period) {
        if (score > this.score || !isLiveAt(at)) {
            return of(key, displayName, score, at, period);
        }
        return this;
    }

    public static PeriodicScore of(String key, String displayName, long score, Instant at, ScorePeriod period) {
        return new PeriodicScore(key, displayName, score, at, period.length().map(at::plus).orElse(null));
    }
}
