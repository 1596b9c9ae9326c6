package org.arenasync.arena.chat;

/**
 * Result of moderating one chat text.
 *
 * @param text     Text safe for delivery.
 * @param altered  Whether disallowed terms were masked.
 * @param rejected Whether the message must not be delivered at all.
 */
public record ModerationVerdict(String text, boolean altered, boolean rejected) {

    public static ModerationVerdict clean(String text) {
        return new ModerationVerdict(text, false, false);
    }
}
