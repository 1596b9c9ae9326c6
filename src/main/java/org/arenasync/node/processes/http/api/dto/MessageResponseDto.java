package org.arenasync.node.processes.http.api.dto;

/**
 * Response DTO for simple acknowledgments (node stop, chat announcement).
 *
 * @param message The response message
 */
public record MessageResponseDto(
    String message
) {}
