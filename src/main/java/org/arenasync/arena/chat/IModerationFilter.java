package org.arenasync.arena.chat;

/**
 * Text moderation applied to every chat message before delivery. Implementations
 * must be pure and thread-safe.
 */
public interface IModerationFilter {

    ModerationVerdict moderate(String text);
}
