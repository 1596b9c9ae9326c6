package org.arenasync.arena.encoding;

import org.arenasync.arena.world.WorldState;

import java.util.Optional;
import java.util.TreeMap;

/**
 * Receiver-side reconstruction of a session's world view. It keeps the states it
 * reconstructed for the last {@code retainedTicks} ticks so that any delta whose
 * baseline the receiver acknowledged can be applied.
 */
public class WorldReplica {

    private final int retainedTicks;
    private final TreeMap<Long, WorldState> states = new TreeMap<>();

    public WorldReplica(int retainedTicks) {
        if (retainedTicks < 1) {
            throw new IllegalArgumentException("retainedTicks must be at least 1, got " + retainedTicks);
        }
        this.retainedTicks = retainedTicks;
    }

    /**
     * Applies a received frame.
     *
     * @param frame A full snapshot or a delta.
     * @return The reconstructed state at {@code frame.tick()}.
     * @throws IllegalStateException if a delta references a baseline this replica does not hold.
     */
    public WorldState apply(WorldFrame frame) {
        WorldState state;
        if (frame instanceof FullSnapshot full) {
            state = WorldState.of(full.tick(), full.entities());
        } else {
            DeltaFrame delta = (DeltaFrame) frame;
            WorldState baseline = states.get(delta.baselineTick());
            if (baseline == null) {
                throw new IllegalStateException("Missing baseline " + delta.baselineTick() + " for delta to tick " + delta.tick());
            }
            state = delta.applyTo(baseline);
        }
        states.put(state.tick(), state);
        while (states.size() > retainedTicks) {
            states.pollFirstEntry();
        }
        return state;
    }

    public Optional<WorldState> state(long tick) {
        return Optional.ofNullable(states.get(tick));
    }

    public Optional<WorldState> latest() {
        return states.isEmpty() ? Optional.empty() : Optional.of(states.lastEntry().getValue());
    }
}
