package org.arenasync.arena.api;

/**
 * Thrown by player stores when the backing storage cannot be reached.
 * The persistence gateway converts it into queued retries or an
 * {@code Unavailable} load result; it never reaches the tick loop.
 */
public class StorageUnavailableException extends Exception {

    public StorageUnavailableException(String message) {
        super(message);
    }

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
