package org.arenasync.arena.chat;

import org.arenasync.arena.api.SessionId;

/**
 * A session able to send or receive chat.
 *
 * @param sessionId   The session.
 * @param displayName Name shown to other players.
 * @param teamId      Team, null if the player is not on a team.
 */
public record ChatParticipant(SessionId sessionId, String displayName, String teamId) {
}
