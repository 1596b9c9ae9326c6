package org.arenasync.arena.world;

import org.arenasync.arena.api.SessionId;

import java.util.List;
import java.util.Map;

/**
 * Output of one simulation step.
 *
 * @param entities The complete entity set of the tick.
 * @param scores   Current score per session for sessions whose score changed this tick.
 */
public record TickResult(List<EntitySnapshot> entities, Map<SessionId, Long> scores) {

    public TickResult {
        entities = List.copyOf(entities);
        scores = Map.copyOf(scores);
    }
}
