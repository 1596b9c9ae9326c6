package org.arenasync.arena.leaderboard;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.arenasync.arena.api.PlayerId;
import org.arenasync.arena.broadcast.Broadcaster;
import org.arenasync.arena.persistence.PersistenceGateway;
import org.arenasync.arena.persistence.PlayerRecord;
import org.arenasync.arena.persistence.WriteClass;
import org.arenasync.arena.protocol.FrameCodec;
import org.arenasync.arena.services.AbstractService;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Publishes the leaderboard on its own cadence, off the tick thread.
 * <p>
 * Each cycle ranks the committed scores. When the top entries changed, a critical
 * leaderboard frame goes to every session, new personal bests are checkpointed to the
 * persistence gateway as non-critical writes, and the snapshot is stored.
 * <p>
 * <strong>Configuration Options:</strong>
 * <ul>
 *   <li><b>intervalMs</b>: publication cadence (default: 1000)</li>
 *   <li><b>size</b>: number of entries sent to clients (default: 10)</li>
 *   <li><b>checkpointScores</b>: write new bests to persistence (default: true)</li>
 * </ul>
 */
public class LeaderboardPublisher extends AbstractService {

    private final LeaderboardService leaderboard;
    private final Broadcaster broadcaster;
    private final PersistenceGateway gateway;
    private final LongSupplier currentTick;
    private final Clock clock;
    private final long intervalMs;
    private final int size;
    private final boolean checkpointScores;

    private long lastVersion;
    private List<LeaderboardEntry> lastTop = List.of();
    private final Map<PlayerId, Long> checkpointed = new HashMap<>();

    private final AtomicLong publications = new AtomicLong();
    private final AtomicLong framesBroadcast = new AtomicLong();
    private final AtomicLong checkpoints = new AtomicLong();

    public LeaderboardPublisher(String name, Config options, LeaderboardService leaderboard, Broadcaster broadcaster,
                                PersistenceGateway gateway, LongSupplier currentTick, Clock clock) {
        super(name, options);
        Config defaults = ConfigFactory.parseMap(Map.of(
            "intervalMs", 1000,
            "size", 10,
            "checkpointScores", true
        ));
        Config config = options.withFallback(defaults);
        this.leaderboard = leaderboard;
        this.broadcaster = broadcaster;
        this.gateway = gateway;
        this.currentTick = currentTick;
        this.clock = clock;
        this.intervalMs = config.getLong("intervalMs");
        this.size = config.getInt("size");
        this.checkpointScores = config.getBoolean("checkpointScores");
        if (intervalMs <= 0 || size <= 0) {
            throw new IllegalArgumentException("intervalMs and size must be positive for service '" + name + "'.");
        }
    }

    @Override
    protected void loop() throws InterruptedException {
        while (isRunning()) {
            Thread.sleep(intervalMs);
            try {
                publishOnce();
            } catch (RuntimeException e) {
                log.warn("Leaderboard publication failed: {}", e.getMessage());
                log.debug("Publication failure details:", e);
                recordError("PUBLISH_FAILED", "Leaderboard publication failed", e.getClass().getSimpleName());
            }
        }
    }

    /**
     * Runs one publication cycle.
     *
     * @return true if a leaderboard frame was broadcast.
     */
    public boolean publishOnce() {
        LeaderboardSnapshot snapshot = leaderboard.publish();
        if (snapshot.version() == lastVersion) {
            return false;
        }
        lastVersion = snapshot.version();
        publications.incrementAndGet();

        if (checkpointScores) {
            checkpoint(snapshot);
        }
        gateway.saveLeaderboard(snapshot);

        List<LeaderboardEntry> top = snapshot.top(size);
        if (top.equals(lastTop)) {
            return false;
        }
        lastTop = List.copyOf(top);
        broadcaster.broadcastCritical(FrameCodec.encodeLeaderboard(currentTick.getAsLong(), snapshot, size));
        framesBroadcast.incrementAndGet();
        log.debug("Published leaderboard version {} with {} entries", snapshot.version(), snapshot.entries().size());
        return true;
    }

    private void checkpoint(LeaderboardSnapshot snapshot) {
        Instant now = clock.instant();
        for (LeaderboardEntry entry : snapshot.entries()) {
            if (entry.playerId().isEphemeral()) {
                continue;
            }
            Long best = checkpointed.get(entry.playerId());
            if (best != null && best >= entry.score()) {
                continue;
            }
            checkpointed.put(entry.playerId(), entry.score());
            PlayerRecord record = new PlayerRecord(entry.playerId(), entry.displayName(), entry.score(), Set.of(), now, 0L, now);
            gateway.upsertPlayer(record, WriteClass.NON_CRITICAL);
            checkpoints.incrementAndGet();
        }
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("publications", publications.get());
        metrics.put("frames_broadcast", framesBroadcast.get());
        metrics.put("checkpoints", checkpoints.get());
    }
}
