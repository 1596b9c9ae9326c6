package org.arenasync.node.processes.http.api.players;

import org.arenasync.arena.persistence.PlayerRecord;

import java.util.List;

/**
 * Stored player record as returned by the players endpoint.
 */
public record PlayerDto(
    String playerId,
    String displayName,
    long bestScore,
    List<String> moderationFlags,
    String lastSeen,
    long plays,
    String createdAt
) {
    public static PlayerDto from(final PlayerRecord record) {
        return new PlayerDto(
            record.playerId().value(),
            record.displayName(),
            record.bestScore(),
            record.moderationFlags().stream().sorted().toList(),
            record.lastSeen().toString(),
            record.plays(),
            record.createdAt().toString()
        );
    }
}
