package org.arenasync.node.processes.http.api.chat;

/**
 * Request body of an operator announcement.
 *
 * @param alias Sender name shown to players, defaults to the configured alias
 * @param text  Message text
 */
public record AnnouncementDto(
    String alias,
    String text
) {}
