package org.arenasync.node.processes.http.api.leaderboard;

import java.util.List;

/**
 * Periodic board response.
 *
 * @param kind    "{scope}/{period}", e.g. "player/week" or "team/all"
 * @param entries Ranked rows, best first
 */
public record PeriodicBoardDto(
    String kind,
    List<PeriodicEntryDto> entries
) {}
