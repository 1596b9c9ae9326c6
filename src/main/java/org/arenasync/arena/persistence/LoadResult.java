package org.arenasync.arena.persistence;

/**
 * Outcome of a player lookup. Storage outages are a value, not an exception, so that
 * authentication can continue with an ephemeral identity.
 */
public sealed interface LoadResult permits LoadResult.Found, LoadResult.NotFound, LoadResult.Unavailable {

    record Found(PlayerRecord record) implements LoadResult {
    }

    record NotFound() implements LoadResult {
    }

    record Unavailable(String reason) implements LoadResult {
    }
}
