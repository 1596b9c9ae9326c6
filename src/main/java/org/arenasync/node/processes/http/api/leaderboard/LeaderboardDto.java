package org.arenasync.node.processes.http.api.leaderboard;

import java.util.List;

/**
 * Leaderboard response.
 *
 * @param kind        "live" for the in-memory board, "all-time" for stored best scores
 * @param version     Publication version of the live board, 0 for the all-time board
 * @param publishedAt ISO-8601 publication time, null if never published
 * @param entries     Ranked rows, best first
 */
public record LeaderboardDto(
    String kind,
    long version,
    String publishedAt,
    List<LeaderboardEntryDto> entries
) {}
