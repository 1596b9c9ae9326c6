package org.arenasync.arena.persistence;

/**
 * Durability class of a player write.
 */
public enum WriteClass {
    /** Final scores and first-time records: retried until success or shutdown. */
    CRITICAL,
    /** Checkpoints: may be dropped when the retry buffer is full. */
    NON_CRITICAL
}
