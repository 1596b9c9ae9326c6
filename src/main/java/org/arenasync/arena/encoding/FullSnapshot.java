package org.arenasync.arena.encoding;

import org.arenasync.arena.world.EntitySnapshot;

import java.util.List;

/**
 * Complete visible world state of one tick. Needs no baseline.
 *
 * @param tick     Target tick.
 * @param entities All visible entities, ordered by id.
 */
public record FullSnapshot(long tick, List<EntitySnapshot> entities) implements WorldFrame {

    public FullSnapshot {
        entities = List.copyOf(entities);
    }
}
