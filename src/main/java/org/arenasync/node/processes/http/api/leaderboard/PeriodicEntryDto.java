package org.arenasync.node.processes.http.api.leaderboard;

/**
 * One ranked row of a periodic board. {@code key} is the player id or the team id;
 * {@code expiresAt} is null on all-time boards.
 */
public record PeriodicEntryDto(
    int rank,
    String key,
    String displayName,
    long score,
    String achievedAt,
    String expiresAt
) {}
