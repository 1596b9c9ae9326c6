package org.arenasync.arena.persistence;

import org.arenasync.arena.api.PlayerId;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Durable player record. Writes are merged into the stored record with
 * {@link #merge(PlayerRecord)}, which is commutative, associative and idempotent, so
 * repeated or reordered upserts converge to the same stored value.
 *
 * @param playerId        Stable identity.
 * @param displayName     Name from the most recent session.
 * @param bestScore       Lifetime best score.
 * @param moderationFlags Accumulated moderation flags.
 * @param lastSeen        End of the most recent session.
 * @param plays           Number of sessions played.
 * @param createdAt       First authenticated connection.
 */
public record PlayerRecord(
    PlayerId playerId,
    String displayName,
    long bestScore,
    Set<String> moderationFlags,
    Instant lastSeen,
    long plays,
    Instant createdAt
) {

    /**
     * All-time order: best score descending, then player id.
     */
    public static final Comparator<PlayerRecord> BY_BEST_SCORE = Comparator
        .comparingLong(PlayerRecord::bestScore).reversed()
        .thenComparing(record -> record.playerId().value());

    public PlayerRecord {
        Objects.requireNonNull(playerId, "playerId");
        Objects.requireNonNull(displayName, "displayName");
        Objects.requireNonNull(lastSeen, "lastSeen");
        Objects.requireNonNull(createdAt, "createdAt");
        moderationFlags = Set.copyOf(moderationFlags);
    }

    /**
     * Creates the record of a player seen for the first time.
     */
    public static PlayerRecord firstSeen(PlayerId playerId, String displayName, Instant now) {
        return new PlayerRecord(playerId, displayName, 0L, Set.of(), now, 1L, now);
    }

    /**
     * Merges two versions of the same player: best score is the maximum, flags are the
     * union, last-seen is the latest (and the display name follows it), plays is the
     * maximum and created-at the earliest.
     */
    public PlayerRecord merge(PlayerRecord other) {
        if (!playerId.equals(other.playerId)) {
            throw new IllegalArgumentException("Cannot merge records of " + playerId + " and " + other.playerId);
        }
        Set<String> flags = new TreeSet<>(moderationFlags);
        flags.addAll(other.moderationFlags);
        PlayerRecord newer = newerOf(other);
        return new PlayerRecord(
            playerId,
            newer.displayName,
            Math.max(bestScore, other.bestScore),
            flags,
            newer.lastSeen,
            Math.max(plays, other.plays),
            createdAt.isBefore(other.createdAt) ? createdAt : other.createdAt
        );
    }

    private PlayerRecord newerOf(PlayerRecord other) {
        int byTime = lastSeen.compareTo(other.lastSeen);
        if (byTime != 0) {
            return byTime > 0 ? this : other;
        }
        // Same instant: the lexically larger name wins so the merge stays commutative.
        return displayName.compareTo(other.displayName) >= 0 ? this : other;
    }

    public PlayerRecord withScore(long score, Instant seen) {
        return new PlayerRecord(playerId, displayName, Math.max(bestScore, score), moderationFlags, seen, plays, createdAt);
    }

    public PlayerRecord withFlag(String flag) {
        Set<String> flags = new TreeSet<>(moderationFlags);
        flags.add(flag);
        return new PlayerRecord(playerId, displayName, bestScore, flags, lastSeen, plays, createdAt);
    }
}
