package org.arenasync.arena.world;

/**
 * The gameplay simulation. It is an external collaborator: the arena only feeds it
 * inputs and consumes the entity list it produces, once per tick, on the tick thread.
 */
public interface IWorldSimulation {

    /**
     * Advances the world by one tick.
     *
     * @param input Events and commands collected since the previous step.
     * @return The authoritative entity set and score changes for {@code input.tick()}.
     */
    TickResult step(TickInput input);
}
