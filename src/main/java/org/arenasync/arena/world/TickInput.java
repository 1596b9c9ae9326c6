package org.arenasync.arena.world;

import java.util.List;

/**
 * Everything the simulation consumes for one step.
 *
 * @param tick   The tick being produced.
 * @param events Player join/leave events since the previous tick, in arrival order.
 * @param inputs Input commands since the previous tick, in arrival order.
 */
public record TickInput(long tick, List<PlayerEvent> events, List<InputCommand> inputs) {

    public TickInput {
        events = List.copyOf(events);
        inputs = List.copyOf(inputs);
    }
}
