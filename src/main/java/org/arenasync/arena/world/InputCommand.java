package org.arenasync.arena.world;

import org.arenasync.arena.api.SessionId;

/**
 * One client input command, forwarded to the simulation on the next tick.
 *
 * @param sessionId  The issuing session.
 * @param clientTick The last tick the client had rendered when issuing the command.
 * @param moveX      Desired movement direction x, in [-1, 1].
 * @param moveY      Desired movement direction y, in [-1, 1].
 * @param aim        Desired heading in radians.
 * @param action     Whether the primary action is held.
 */
public record InputCommand(
    SessionId sessionId,
    long clientTick,
    double moveX,
    double moveY,
    double aim,
    boolean action
) {
}
