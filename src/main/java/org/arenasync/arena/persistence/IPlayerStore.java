package org.arenasync.arena.persistence;

import org.arenasync.arena.api.IResource;
import org.arenasync.arena.api.PlayerId;
import org.arenasync.arena.api.StorageUnavailableException;
import org.arenasync.arena.leaderboard.LeaderboardSnapshot;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Backing key-value store of player records.
 * <p>
 * Implementations must be thread-safe. All methods throw
 * {@link StorageUnavailableException} when the storage cannot be reached; the caller
 * decides whether to retry.
 */
public interface IPlayerStore extends IResource {

    Optional<PlayerRecord> read(PlayerId playerId) throws StorageUnavailableException;

    /**
     * Merges {@code record} into the stored one (see {@link PlayerRecord#merge}), or
     * stores it if absent. Applying the same record twice has no further effect.
     */
    void upsert(PlayerRecord record) throws StorageUnavailableException;

    /**
     * Returns the players with the highest lifetime best scores, best first.
     */
    List<PlayerRecord> top(int limit) throws StorageUnavailableException;

    /**
     * Feeds a finished session's score into the periodic player and team boards.
     * Replaying a submission has no further effect.
     */
    void recordScore(ScoreSubmission submission) throws StorageUnavailableException;

    /**
     * Returns the live rows of one periodic board at {@code now}, best first.
     */
    List<PeriodicScore> topScores(BoardScope scope, ScorePeriod period, Instant now, int limit) throws StorageUnavailableException;

    void saveLeaderboard(LeaderboardSnapshot snapshot) throws StorageUnavailableException;

    Optional<LeaderboardSnapshot> loadLeaderboard() throws StorageUnavailableException;
}
