package org.arenasync.arena.encoding;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.arenasync.arena.api.SessionId;
import org.arenasync.arena.resources.AbstractResource;
import org.arenasync.arena.world.EntitySnapshot;
import org.arenasync.arena.world.Region;
import org.arenasync.arena.world.WorldState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Computes per-session world frames: a {@link DeltaFrame} against the last tick the
 * session acknowledged when that baseline is recent and still retained, otherwise a
 * {@link FullSnapshot}. Acknowledgments may lag any number of ticks behind: every frame
 * sent after the last resynchronization can become the next baseline.
 * <p>
 * <strong>Threading:</strong> {@link #recordTick} and {@link #encode} run on the tick
 * thread only. {@link #acknowledge} and {@link #forget} may be called from any thread;
 * they post messages that the tick thread applies at the start of the next
 * {@link #recordTick}, so per-session baseline state has a single writer.
 * <p>
 * <strong>Configuration Options:</strong>
 * <ul>
 *   <li><b>historyTicks</b>: number of canonical states retained (default: 64)</li>
 *   <li><b>maxBaselineAge</b>: oldest acknowledged tick, relative to the current one,
 *       still used as a baseline (default: 48, capped at historyTicks - 1)</li>
 *   <li><b>epsilon</b>: jitter threshold for continuous fields (default: 0.001)</li>
 * </ul>
 */
public class SnapshotEncoder extends AbstractResource {

    private static final Logger log = LoggerFactory.getLogger(SnapshotEncoder.class);
    private static final long NONE = -1L;

    private final WorldHistory history;
    private final int maxBaselineAge;
    private final Map<SessionId, Baseline> baselines = new HashMap<>();
    private final ConcurrentLinkedQueue<Ack> inbox = new ConcurrentLinkedQueue<>();

    private final AtomicLong fullFrames = new AtomicLong();
    private final AtomicLong deltaFrames = new AtomicLong();
    private final AtomicLong fallbacks = new AtomicLong();
    private final AtomicLong ignoredAcks = new AtomicLong();

    private record Ack(SessionId sessionId, long tick, boolean forget) {
    }

    /**
     * What was sent to a session at one tick: the region it was filtered by and the
     * baseline of the delta, or {@code NONE} for a full snapshot.
     */
    private record SentFrame(Region region, long baselineTick) {
    }

    /**
     * Per-session baseline bookkeeping, owned by the tick thread. {@code resetTick} only
     * moves when an acknowledged baseline had to be abandoned; frames sent before it are
     * never used as a baseline again.
     */
    private static final class Baseline {
        long ackedTick = NONE;
        long resetTick = NONE;
        final TreeMap<Long, SentFrame> sent = new TreeMap<>();
    }

    public SnapshotEncoder(String name, Config options) {
        super(name, options);
        Config defaults = ConfigFactory.parseMap(Map.of(
            "historyTicks", 64,
            "maxBaselineAge", 48,
            "epsilon", 0.001
        ));
        Config config = options.withFallback(defaults);
        int historyTicks = config.getInt("historyTicks");
        this.history = new WorldHistory(historyTicks, config.getDouble("epsilon"));
        this.maxBaselineAge = Math.min(config.getInt("maxBaselineAge"), historyTicks - 1);
        if (maxBaselineAge < 1) {
            throw new IllegalArgumentException("maxBaselineAge must be at least 1 for resource '" + name + "'.");
        }
    }

    /**
     * Records an acknowledgment. Safe to call from network threads.
     *
     * @param sessionId The acknowledging session.
     * @param tick      The tick the client has fully reconstructed.
     */
    public void acknowledge(SessionId sessionId, long tick) {
        inbox.add(new Ack(sessionId, tick, false));
    }

    /**
     * Drops all baseline state of a closed session. Safe to call from any thread.
     */
    public void forget(SessionId sessionId) {
        inbox.add(new Ack(sessionId, NONE, true));
    }

    /**
     * Applies pending acknowledgments and records the canonical state of a new tick.
     *
     * @param tick     The new tick.
     * @param entities The raw entity set produced by the simulation.
     * @return The canonical state every frame of this tick is computed from.
     */
    public WorldState recordTick(long tick, Collection<EntitySnapshot> entities) {
        drainInbox();
        return history.record(tick, entities);
    }

    /**
     * Encodes the frame for one session.
     *
     * @param sessionId The session.
     * @param region    The region the session currently subscribes to.
     * @param current   The canonical state returned by {@link #recordTick} for this tick.
     * @return A delta against the session's acknowledged baseline, or a full snapshot.
     */
    public WorldFrame encode(SessionId sessionId, Region region, WorldState current) {
        Baseline baseline = baselines.computeIfAbsent(sessionId, id -> new Baseline());
        WorldState view = current.filter(region);

        WorldFrame frame;
        long baselineTick;
        try {
            DeltaFrame delta = buildDelta(baseline, view);
            baselineTick = delta.baselineTick();
            frame = delta;
            deltaFrames.incrementAndGet();
        } catch (EncodingFault fault) {
            if (fault.kind() != EncodingFault.Kind.NO_BASELINE) {
                fallbacks.incrementAndGet();
                log.debug("Session {} resynchronizes with full snapshot at tick {}: {}", sessionId, view.tick(), fault.getMessage());
                baseline.ackedTick = NONE;
                baseline.resetTick = view.tick();
            }
            baselineTick = NONE;
            frame = new FullSnapshot(view.tick(), new ArrayList<>(view.entities().values()));
            fullFrames.incrementAndGet();
        }

        baseline.sent.put(view.tick(), new SentFrame(region, baselineTick));
        baseline.sent.headMap(view.tick() - history.horizon(), true).clear();
        return frame;
    }

    private DeltaFrame buildDelta(Baseline baseline, WorldState view) throws EncodingFault {
        long acked = baseline.ackedTick;
        if (acked == NONE) {
            throw new EncodingFault(EncodingFault.Kind.NO_BASELINE, "no acknowledged baseline");
        }
        if (view.tick() - acked > maxBaselineAge) {
            throw new EncodingFault(EncodingFault.Kind.BASELINE_TOO_OLD,
                "baseline " + acked + " is " + (view.tick() - acked) + " ticks old");
        }
        Optional<WorldState> retained = history.get(acked);
        SentFrame sentFrame = baseline.sent.get(acked);
        if (retained.isEmpty() || sentFrame == null) {
            throw new EncodingFault(EncodingFault.Kind.BASELINE_EVICTED, "baseline " + acked + " no longer retained");
        }
        return diff(retained.get().filter(sentFrame.region()), view);
    }

    /**
     * Computes the exact difference between two canonical views.
     */
    static DeltaFrame diff(WorldState base, WorldState target) {
        List<EntitySnapshot> added = new ArrayList<>();
        List<EntityUpdate> updated = new ArrayList<>();
        List<Long> removed = new ArrayList<>();

        for (EntitySnapshot entity : target.entities().values()) {
            EntitySnapshot before = base.get(entity.entityId());
            if (before == null) {
                added.add(entity);
            } else {
                int mask = entity.diffMask(before);
                if (mask != 0) {
                    updated.add(new EntityUpdate(entity.entityId(), mask, entity));
                }
            }
        }
        for (Long id : base.entities().keySet()) {
            if (target.get(id) == null) {
                removed.add(id);
            }
        }
        return new DeltaFrame(base.tick(), target.tick(), added, updated, removed);
    }

    private void drainInbox() {
        Ack ack;
        while ((ack = inbox.poll()) != null) {
            if (ack.forget()) {
                baselines.remove(ack.sessionId());
                continue;
            }
            Baseline baseline = baselines.get(ack.sessionId());
            if (baseline == null || !usable(baseline, ack.tick())) {
                ignoredAcks.incrementAndGet();
                continue;
            }
            baseline.ackedTick = ack.tick();
        }
    }

    /**
     * An acknowledged tick becomes the baseline when it is newer than the current one, was
     * actually sent, and was sent no earlier than the last reset: as a full snapshot, or as
     * a delta against a baseline that was itself valid after the reset. Acks may arrive any
     * number of ticks late.
     */
    private static boolean usable(Baseline baseline, long tick) {
        if (tick <= baseline.ackedTick || tick < baseline.resetTick) {
            return false;
        }
        SentFrame frame = baseline.sent.get(tick);
        return frame != null && (frame.baselineTick() == NONE || frame.baselineTick() >= baseline.resetTick);
    }

    public WorldHistory history() {
        return history;
    }

    public int maxBaselineAge() {
        return maxBaselineAge;
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("full_frames", fullFrames.get());
        metrics.put("delta_frames", deltaFrames.get());
        metrics.put("resync_fallbacks", fallbacks.get());
        metrics.put("ignored_acks", ignoredAcks.get());
    }
}
