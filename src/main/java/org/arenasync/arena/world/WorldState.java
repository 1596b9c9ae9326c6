package org.arenasync.arena.world;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable set of entities at one tick, keyed and iterated by entity id.
 */
public final class WorldState {

    private final long tick;
    private final Map<Long, EntitySnapshot> entities;

    private WorldState(long tick, TreeMap<Long, EntitySnapshot> entities) {
        this.tick = tick;
        this.entities = Collections.unmodifiableMap(entities);
    }

    /**
     * Builds a state from a collection of snapshots. A later snapshot with an id
     * already present replaces the earlier one.
     */
    public static WorldState of(long tick, Collection<EntitySnapshot> snapshots) {
        TreeMap<Long, EntitySnapshot> map = new TreeMap<>();
        for (EntitySnapshot snapshot : snapshots) {
            map.put(snapshot.entityId(), snapshot);
        }
        return new WorldState(tick, map);
    }

    public static WorldState of(long tick, Map<Long, EntitySnapshot> entities) {
        return new WorldState(tick, new TreeMap<>(entities));
    }

    public long tick() {
        return tick;
    }

    public Map<Long, EntitySnapshot> entities() {
        return entities;
    }

    public int size() {
        return entities.size();
    }

    public EntitySnapshot get(long entityId) {
        return entities.get(entityId);
    }

    /**
     * Returns the subset of entities inside the region.
     */
    public WorldState filter(Region region) {
        if (region == null || region.equals(Region.ALL)) {
            return this;
        }
        TreeMap<Long, EntitySnapshot> filtered = new TreeMap<>();
        for (EntitySnapshot snapshot : entities.values()) {
            if (region.contains(snapshot)) {
                filtered.put(snapshot.entityId(), snapshot);
            }
        }
        return new WorldState(tick, filtered);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WorldState other)) {
            return false;
        }
        return tick == other.tick && entities.equals(other.entities);
    }

    @Override
    public int hashCode() {
        return Long.hashCode(tick) * 31 + entities.hashCode();
    }

    @Override
    public String toString() {
        return "WorldState{tick=" + tick + ", entities=" + entities.size() + "}";
    }
}
