package org.arenasync.arena.chat;

import org.arenasync.arena.api.SessionId;

/**
 * A chat message after moderation. Only {@code filteredText} is ever delivered.
 *
 * @param sender       Sending session.
 * @param senderName   Display name of the sender.
 * @param rawText      Text as typed.
 * @param filteredText Text after the moderation filter.
 * @param scope        Delivery scope.
 * @param target       Whisper target display name, null for other scopes.
 */
public record ChatMessage(
    SessionId sender,
    String senderName,
    String rawText,
    String filteredText,
    ChatScope scope,
    String target
) {
}
