package org.arenasync.node.processes.http.api.leaderboard;

/**
 * One ranked row of a leaderboard response.
 */
public record LeaderboardEntryDto(
    int rank,
    String playerId,
    String displayName,
    long score
) {}
