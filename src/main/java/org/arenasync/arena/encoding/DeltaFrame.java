package org.arenasync.arena.encoding;

import org.arenasync.arena.world.EntitySnapshot;
import org.arenasync.arena.world.WorldState;

import java.util.List;
import java.util.TreeMap;

/**
 * Difference between the state a client acknowledged and the current state.
 * Applying it to the exact baseline state reproduces the exact target state.
 *
 * @param baselineTick The acknowledged tick the delta is relative to.
 * @param tick         Target tick.
 * @param added        Entities absent at the baseline, with all fields.
 * @param updated      Entities present in both with at least one changed field.
 * @param removed      Ids present at the baseline but no longer visible.
 */
public record DeltaFrame(
    long baselineTick,
    long tick,
    List<EntitySnapshot> added,
    List<EntityUpdate> updated,
    List<Long> removed
) implements WorldFrame {

    public DeltaFrame {
        if (baselineTick >= tick) {
            throw new IllegalArgumentException("Delta baseline " + baselineTick + " must precede target tick " + tick);
        }
        added = List.copyOf(added);
        updated = List.copyOf(updated);
        removed = List.copyOf(removed);
    }

    /**
     * Reconstructs the target state from the baseline state.
     *
     * @param baseline The state at {@link #baselineTick()}.
     * @return The state at {@link #tick()}.
     * @throws IllegalArgumentException if the baseline is for a different tick.
     * @throws IllegalStateException    if the baseline does not match the delta's view of it.
     */
    public WorldState applyTo(WorldState baseline) {
        if (baseline.tick() != baselineTick) {
            throw new IllegalArgumentException("Delta expects baseline tick " + baselineTick + " but got " + baseline.tick());
        }
        TreeMap<Long, EntitySnapshot> result = new TreeMap<>(baseline.entities());
        for (Long id : removed) {
            if (result.remove(id) == null) {
                throw new IllegalStateException("Removed entity " + id + " not present at baseline " + baselineTick);
            }
        }
        for (EntityUpdate update : updated) {
            EntitySnapshot base = result.get(update.entityId());
            if (base == null) {
                throw new IllegalStateException("Updated entity " + update.entityId() + " not present at baseline " + baselineTick);
            }
            result.put(update.entityId(), update.applyTo(base));
        }
        for (EntitySnapshot entity : added) {
            if (result.putIfAbsent(entity.entityId(), entity) != null) {
                throw new IllegalStateException("Added entity " + entity.entityId() + " already present at baseline " + baselineTick);
            }
        }
        return WorldState.of(tick, result);
    }

    public boolean isEmpty() {
        return added.isEmpty() && updated.isEmpty() && removed.isEmpty();
    }
}
