package org.arenasync.arena.world;

import org.arenasync.arena.api.PlayerId;
import org.arenasync.arena.api.SessionId;

/**
 * Notifies the simulation that a player entered or left the world.
 *
 * @param kind        JOINED or LEFT.
 * @param sessionId   The session of the player.
 * @param playerId    The player identity.
 * @param displayName The player's display name.
 */
public record PlayerEvent(Kind kind, SessionId sessionId, PlayerId playerId, String displayName) {

    public enum Kind {
        JOINED,
        LEFT
    }

    public static PlayerEvent joined(SessionId sessionId, PlayerId playerId, String displayName) {
        return new PlayerEvent(Kind.JOINED, sessionId, playerId, displayName);
    }

    public static PlayerEvent left(SessionId sessionId, PlayerId playerId) {
        return new PlayerEvent(Kind.LEFT, sessionId, playerId, null);
    }
}
