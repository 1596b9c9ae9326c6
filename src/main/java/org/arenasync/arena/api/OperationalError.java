package org.arenasync.arena.api;

import java.time.Instant;

/**
 * Represents an operational error that occurred within an arena component.
 * <p>
 * This record is used to provide detailed, structured information about errors
 * for monitoring and debugging purposes.
 *
 * @param timestamp The timestamp of when the error occurred.
 * @param errorType A category for the error (e.g., "STORE_WRITE_FAILED", "ENCODE_FAILED").
 * @param message   A human-readable description of the error.
 * @param details   Optional additional context, such as a session id or tick number.
 */
public record OperationalError(
    Instant timestamp,
    String errorType,
    String message,
    String details
) {
}
