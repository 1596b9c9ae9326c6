package org.arenasync.node.processes.http.api.dto;

import java.time.Instant;

/**
 * Response DTO for error responses.
 * <p>
 * Provides a consistent error response format across all API endpoints.
 *
 * @param timestamp ISO-8601 timestamp when the error occurred
 * @param status    HTTP status code
 * @param error     HTTP status message (e.g., "Not Found", "Service Unavailable")
 * @param message   Human-readable error message
 */
public record ErrorResponseDto(
    String timestamp,
    int status,
    String error,
    String message
) {
    /**
     * Creates an ErrorResponseDto with the current timestamp.
     */
    public static ErrorResponseDto of(final int status, final String error, final String message) {
        return new ErrorResponseDto(Instant.now().toString(), status, error, message);
    }
}
