package org.arenasync.arena.persistence;

import com.typesafe.config.Config;
import org.arenasync.arena.api.PlayerId;
import org.arenasync.arena.api.StorageUnavailableException;
import org.arenasync.arena.leaderboard.LeaderboardSnapshot;
import org.arenasync.arena.resources.AbstractResource;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-local player store. Records are lost on restart.
 * <p>
 * The store can be switched offline with {@link #setAvailable(boolean)}, in which case
 * every call fails with {@link StorageUnavailableException}; this is how outages are
 * rehearsed without an external database.
 */
public class InMemoryPlayerStore extends AbstractResource implements IPlayerStore {

    private final Map<PlayerId, PlayerRecord> records = new ConcurrentHashMap<>();
    private final AtomicReference<LeaderboardSnapshot> leaderboard = new AtomicReference<>();
    private final ScoreBoards scores = new ScoreBoards();
    private volatile boolean available = true;

    public InMemoryPlayerStore(String name, Config options) {
        super(name, options);
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    private void checkAvailable() throws StorageUnavailableException {
        if (!available) {
            throw new StorageUnavailableException("Store '" + resourceName + "' is offline");
        }
    }

    @Override
    public Optional<PlayerRecord> read(PlayerId playerId) throws StorageUnavailableException {
        checkAvailable();
        return Optional.ofNullable(records.get(playerId));
    }

    @Override
    public void upsert(PlayerRecord record) throws StorageUnavailableException {
        checkAvailable();
        records.merge(record.playerId(), record, PlayerRecord::merge);
    }

    @Override
    public List<PlayerRecord> top(int limit) throws StorageUnavailableException {
        checkAvailable();
        return records.values().stream()
            .sorted(PlayerRecord.BY_BEST_SCORE)
            .limit(limit)
            .toList();
    }

    @Override
    public void recordScore(ScoreSubmission submission) throws StorageUnavailableException {
        checkAvailable();
        synchronized (scores) {
            scores.record(submission);
        }
    }

    @Override
    public List<PeriodicScore> topScores(BoardScope scope, ScorePeriod period, Instant now, int limit) throws StorageUnavailableException {
        checkAvailable();
        synchronized (scores) {
            return scores.top(scope, period, now, limit);
        }
    }

    @Override
    public void saveLeaderboard(LeaderboardSnapshot snapshot) throws StorageUnavailableException {
        checkAvailable();
        leaderboard.set(snapshot);
    }

    @Override
    public Optional<LeaderboardSnapshot> loadLeaderboard() throws StorageUnavailableException {
        checkAvailable();
        return Optional.ofNullable(leaderboard.get());
    }

    @Override
    public boolean isHealthy() {
        return available && super.isHealthy();
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("records", records.size());
        synchronized (scores) {
            metrics.put("score_rows", scores.size());
        }
    }
}
