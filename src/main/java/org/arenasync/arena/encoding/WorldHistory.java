package org.arenasync.arena.encoding;

import org.arenasync.arena.world.EntitySnapshot;
import org.arenasync.arena.world.WorldState;

import java.util.Collection;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Ring buffer of the most recent canonical world states, bounded by a fixed tick
 * horizon. Only the tick thread touches it.
 * <p>
 * States are recorded in canonical form: a continuous field that moved less than
 * {@code epsilon} since the previous recorded tick keeps its previous value. Every
 * frame is computed from canonical states only, which is what keeps delta
 * reconstruction exact while still suppressing simulation jitter.
 */
public class WorldHistory {

    private final WorldState[] ring;
    private final double epsilon;
    private WorldState latest;

    /**
     * @param horizon Number of ticks retained, at least 1.
     * @param epsilon Jitter threshold for continuous fields, 0 to disable.
     */
    public WorldHistory(int horizon, double epsilon) {
        if (horizon < 1) {
            throw new IllegalArgumentException("History horizon must be at least 1, got " + horizon);
        }
        if (epsilon < 0.0 || Double.isNaN(epsilon)) {
            throw new IllegalArgumentException("Epsilon must be non-negative, got " + epsilon);
        }
        this.ring = new WorldState[horizon];
        this.epsilon = epsilon;
    }

    /**
     * Canonicalizes and stores the state of a new tick, evicting the oldest retained
     * tick once the horizon is full.
     *
     * @param tick     The tick number, strictly greater than the last recorded one.
     * @param entities Raw entity set from the simulation.
     * @return The canonical state that was recorded.
     */
    public WorldState record(long tick, Collection<EntitySnapshot> entities) {
        if (latest != null && tick <= latest.tick()) {
            throw new IllegalArgumentException("Tick " + tick + " is not after last recorded tick " + latest.tick());
        }
        TreeMap<Long, EntitySnapshot> canonical = new TreeMap<>();
        for (EntitySnapshot raw : entities) {
            EntitySnapshot previous = latest != null ? latest.get(raw.entityId()) : null;
            canonical.put(raw.entityId(), previous != null ? raw.absorbJitter(previous, epsilon) : raw);
        }
        WorldState state = WorldState.of(tick, canonical);
        ring[slot(tick)] = state;
        latest = state;
        return state;
    }

    /**
     * Returns the recorded state of {@code tick} if it is still retained.
     */
    public Optional<WorldState> get(long tick) {
        if (tick < 0) {
            return Optional.empty();
        }
        WorldState state = ring[slot(tick)];
        if (state == null || state.tick() != tick) {
            return Optional.empty();
        }
        return Optional.of(state);
    }

    public Optional<WorldState> latest() {
        return Optional.ofNullable(latest);
    }

    public int horizon() {
        return ring.length;
    }

    public double epsilon() {
        return epsilon;
    }

    private int slot(long tick) {
        return (int) Math.floorMod(tick, (long) ring.length);
    }
}
