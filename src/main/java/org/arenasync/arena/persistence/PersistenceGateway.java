package org.arenasync.arena.persistence;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.arenasync.arena.api.PlayerId;
import org.arenasync.arena.api.StorageUnavailableException;
import org.arenasync.arena.leaderboard.LeaderboardSnapshot;
import org.arenasync.arena.resources.AbstractResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Asynchronous, idempotent access to durable player records.
 * <p>
 * Upserts are keyed by player id and run on the gateway's own writer thread. Pending
 * writes for the same key coalesce into one merged record. A failed write is kept in a
 * bounded retry buffer and retried with exponential backoff
 * ({@code initialBackoff * 2^n}, capped at {@code maxBackoff}). When the buffer is full,
 * the oldest {@link WriteClass#NON_CRITICAL} write is dropped; {@link WriteClass#CRITICAL}
 * writes are never dropped and are retried until they succeed or the gateway shuts down.
 * <p>
 * <strong>Configuration Options:</strong>
 * <ul>
 *   <li><b>retryCapacity</b>: bound of the retry buffer (default: 256)</li>
 *   <li><b>initialBackoffMs</b>: first retry delay (default: 100)</li>
 *   <li><b>maxBackoffMs</b>: retry delay cap (default: 5000)</li>
 * </ul>
 */
public class PersistenceGateway extends AbstractResource {

    private static final Logger log = LoggerFactory.getLogger(PersistenceGateway.class);

    private final IPlayerStore store;
    private final int retryCapacity;
    private final long initialBackoffMs;
    private final long maxBackoffMs;
    private final ScheduledExecutorService writer;
    private final Clock clock;

    private final Object lock = new Object();
    private final LinkedHashMap<PlayerId, PendingWrite> pending = new LinkedHashMap<>();
    private boolean closed;

    private final AtomicLong writesSucceeded = new AtomicLong();
    private final AtomicLong writeAttemptsFailed = new AtomicLong();
    private final AtomicLong writesDropped = new AtomicLong();
    private final AtomicLong writesCoalesced = new AtomicLong();

    /**
     * A merged write waiting for its next attempt. Guarded by {@link #lock}.
     */
    private static final class PendingWrite {
        PlayerRecord record;
        WriteClass writeClass;
        final List<ScoreSubmission> scores = new ArrayList<>();
        final List<CompletableFuture<Void>> waiters = new ArrayList<>();
        int failures;

        PendingWrite(PlayerRecord record, WriteClass writeClass) {
            this.record = record;
            this.writeClass = writeClass;
        }

        void absorb(PendingWrite other) {
            record = record.merge(other.record);
            if (other.writeClass == WriteClass.CRITICAL) {
                writeClass = WriteClass.CRITICAL;
            }
            scores.addAll(other.scores);
            waiters.addAll(other.waiters);
            failures = Math.max(failures, other.failures);
        }
    }

    public PersistenceGateway(String name, Config options, IPlayerStore store) {
        this(name, options, store, Clock.systemUTC());
    }

    public PersistenceGateway(String name, Config options, IPlayerStore store, Clock clock) {
        super(name, options);
        this.clock = clock;
        Config defaults = ConfigFactory.parseMap(Map.of(
            "retryCapacity", 256,
            "initialBackoffMs", 100,
            "maxBackoffMs", 5000
        ));
        Config config = options.withFallback(defaults);
        this.store = store;
        this.retryCapacity = config.getInt("retryCapacity");
        this.initialBackoffMs = config.getLong("initialBackoffMs");
        this.maxBackoffMs = config.getLong("maxBackoffMs");
        if (retryCapacity <= 0 || initialBackoffMs <= 0 || maxBackoffMs < initialBackoffMs) {
            throw new IllegalArgumentException("Invalid retry configuration for resource '" + name + "'.");
        }
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, name + "-writer");
            thread.setDaemon(true);
            return thread;
        });
        executor.setRemoveOnCancelPolicy(true);
        this.writer = executor;
    }

    /**
     * Queues an idempotent upsert.
     *
     * @param record     The record to merge into storage.
     * @param writeClass Whether the write may be dropped under pressure.
     * @return Completes when the record is durable; completes exceptionally with
     *         {@link StorageUnavailableException} if the write was dropped or the gateway shut down first.
     */
    public CompletableFuture<Void> upsertPlayer(PlayerRecord record, WriteClass writeClass) {
        return enqueue(new PendingWrite(record, writeClass));
    }

    /**
     * Queues an idempotent upsert together with the session score it ends with. The
     * score reaches the periodic boards on the same attempt as the record and is retried
     * with it.
     */
    public CompletableFuture<Void> upsertPlayer(PlayerRecord record, ScoreSubmission score, WriteClass writeClass) {
        if (!record.playerId().equals(score.playerId())) {
            throw new IllegalArgumentException("Score of " + score.playerId() + " cannot ride on the record of " + record.playerId());
        }
        PendingWrite write = new PendingWrite(record, writeClass);
        write.scores.add(score);
        return enqueue(write);
    }

    private CompletableFuture<Void> enqueue(PendingWrite write) {
        PlayerRecord record = write.record;
        CompletableFuture<Void> future = new CompletableFuture<>();
        write.waiters.add(future);
        boolean schedule;
        synchronized (lock) {
            if (closed) {
                future.completeExceptionally(new StorageUnavailableException("Gateway '" + resourceName + "' is shut down"));
                return future;
            }
            PendingWrite existing = pending.get(record.playerId());
            if (existing != null) {
                existing.absorb(write);
                writesCoalesced.incrementAndGet();
                schedule = false;
            } else {
                pending.put(record.playerId(), write);
                schedule = true;
            }
        }
        if (schedule) {
            submit(record.playerId(), 0L);
        }
        return future;
    }

    /**
     * Reads a player record. Pending writes for the player are merged into the result.
     */
    public LoadResult loadPlayer(PlayerId playerId) {
        Optional<PlayerRecord> stored;
        try {
            stored = store.read(playerId);
        } catch (StorageUnavailableException e) {
            log.warn("Player store unavailable while loading {}: {}", playerId, e.getMessage());
            recordError("LOAD_FAILED", "Player store unavailable", "player=" + playerId);
            return new LoadResult.Unavailable(e.getMessage());
        }
        PlayerRecord unwritten;
        synchronized (lock) {
            PendingWrite write = pending.get(playerId);
            unwritten = write == null ? null : write.record;
        }
        if (unwritten != null) {
            return new LoadResult.Found(stored.map(record -> record.merge(unwritten)).orElse(unwritten));
        }
        return stored.<LoadResult>map(LoadResult.Found::new).orElseGet(LoadResult.NotFound::new);
    }

    /**
     * All-time board from storage.
     */
    public List<PlayerRecord> topPlayers(int limit) throws StorageUnavailableException {
        return store.top(limit);
    }

    /**
     * One periodic board as of now.
     */
    public List<PeriodicScore> topScores(BoardScope scope, ScorePeriod period, int limit) throws StorageUnavailableException {
        return store.topScores(scope, period, clock.instant(), limit);
    }

    /**
     * Stores a leaderboard snapshot once, on the writer thread. Failures are recorded, not retried;
     * the next publication supersedes it.
     */
    public CompletableFuture<Void> saveLeaderboard(LeaderboardSnapshot snapshot) {
        CompletableFuture<Void> future = new CompletableFuture<>();
        try {
            writer.execute(() -> {
                try {
                    store.saveLeaderboard(snapshot);
                    future.complete(null);
                } catch (StorageUnavailableException e) {
                    log.warn("Failed to store leaderboard version {}: {}", snapshot.version(), e.getMessage());
                    recordError("LEADERBOARD_SAVE_FAILED", "Player store unavailable", "version=" + snapshot.version());
                    future.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(new StorageUnavailableException("Gateway '" + resourceName + "' is shut down"));
        }
        return future;
    }

    public Optional<LeaderboardSnapshot> loadLeaderboard() throws StorageUnavailableException {
        return store.loadLeaderboard();
    }

    private void submit(PlayerId playerId, long delayMs) {
        try {
            writer.schedule(() -> attempt(playerId), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Writer rejected attempt for {}, gateway is shutting down", playerId);
        }
    }

    private void attempt(PlayerId playerId) {
        PendingWrite write;
        synchronized (lock) {
            write = pending.remove(playerId);
        }
        if (write == null) {
            return;
        }
        try {
            write(write);
            writesSucceeded.incrementAndGet();
            if (write.failures > 0) {
                log.debug("Write of {} succeeded after {} failed attempts", playerId, write.failures);
            }
            write.waiters.forEach(waiter -> waiter.complete(null));
        } catch (Exception e) {
            writeAttemptsFailed.incrementAndGet();
            write.failures++;
            if (write.failures == 1) {
                log.warn("Write of {} failed, buffering for retry: {}", playerId, e.getMessage());
                recordError("WRITE_FAILED", "Player write failed", "player=" + playerId + ", class=" + write.writeClass);
            } else {
                log.debug("Retry {} of {} failed: {}", write.failures, playerId, e.getMessage());
            }
            requeue(playerId, write);
        }
    }

    private void write(PendingWrite write) throws StorageUnavailableException {
        store.upsert(write.record);
        for (ScoreSubmission score : write.scores) {
            store.recordScore(score);
        }
    }

    private void requeue(PlayerId playerId, PendingWrite write) {
        List<PendingWrite> droppedWrites = new ArrayList<>();
        boolean schedule;
        synchronized (lock) {
            PendingWrite newer = pending.get(playerId);
            if (closed) {
                droppedWrites.add(write);
                schedule = false;
            } else if (newer != null) {
                // A write for the same key arrived during the attempt and is already scheduled.
                newer.absorb(write);
                writesCoalesced.incrementAndGet();
                schedule = false;
            } else {
                if (retryBacklog() >= retryCapacity) {
                    PendingWrite victim = oldestNonCritical();
                    if (victim == null && write.writeClass == WriteClass.NON_CRITICAL) {
                        victim = write;
                    }
                    if (victim != null) {
                        pending.values().remove(victim);
                        droppedWrites.add(victim);
                    }
                }
                if (!droppedWrites.contains(write)) {
                    pending.put(playerId, write);
                }
                schedule = !droppedWrites.contains(write);
            }
        }
        for (PendingWrite dropped : droppedWrites) {
            writesDropped.incrementAndGet();
            log.warn("Dropped {} write of {} after {} failed attempts", dropped.writeClass, dropped.record.playerId(), dropped.failures);
            StorageUnavailableException cause = new StorageUnavailableException("Write dropped from retry buffer");
            dropped.waiters.forEach(waiter -> waiter.completeExceptionally(cause));
        }
        if (schedule) {
            submit(playerId, backoffMs(write.failures));
        }
    }

    /**
     * Delay before the retry following the given number of failures.
     */
    long backoffMs(int failures) {
        int exponent = Math.min(Math.max(failures - 1, 0), 30);
        return Math.min(initialBackoffMs << exponent, maxBackoffMs);
    }

    private int retryBacklog() {
        int count = 0;
        for (PendingWrite write : pending.values()) {
            if (write.failures > 0) {
                count++;
            }
        }
        return count;
    }

    private PendingWrite oldestNonCritical() {
        Iterator<PendingWrite> it = pending.values().iterator();
        while (it.hasNext()) {
            PendingWrite write = it.next();
            if (write.failures > 0 && write.writeClass == WriteClass.NON_CRITICAL) {
                return write;
            }
        }
        return null;
    }

    /**
     * Stops accepting writes, makes one final attempt for every pending write and fails the rest.
     *
     * @param grace How long to wait for in-flight attempts.
     */
    public void shutdown(Duration grace) {
        List<PendingWrite> remaining;
        synchronized (lock) {
            closed = true;
            remaining = new ArrayList<>(pending.values());
            pending.clear();
        }
        writer.shutdownNow();
        try {
            writer.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        int lost = 0;
        for (PendingWrite write : remaining) {
            try {
                write(write);
                writesSucceeded.incrementAndGet();
                write.waiters.forEach(waiter -> waiter.complete(null));
            } catch (Exception e) {
                lost++;
                StorageUnavailableException cause = new StorageUnavailableException("Gateway shut down before write succeeded", e);
                write.waiters.forEach(waiter -> waiter.completeExceptionally(cause));
            }
        }
        if (lost > 0) {
            log.error("Gateway '{}' shut down with {} unwritten player records", resourceName, lost);
        }
    }

    public int pendingWrites() {
        synchronized (lock) {
            return pending.size();
        }
    }

    public int retryBacklogSize() {
        synchronized (lock) {
            return retryBacklog();
        }
    }

    public IPlayerStore store() {
        return store;
    }

    @Override
    public boolean isHealthy() {
        return retryBacklogSize() < retryCapacity && super.isHealthy();
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("pending_writes", pendingWrites());
        metrics.put("retry_backlog", retryBacklogSize());
        metrics.put("writes_succeeded", writesSucceeded.get());
        metrics.put("write_attempts_failed", writeAttemptsFailed.get());
        metrics.put("writes_dropped", writesDropped.get());
        metrics.put("writes_coalesced", writesCoalesced.get());
    }
}
