package org.arenasync.node.processes.http.api.leaderboard;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import org.arenasync.arena.api.StorageUnavailableException;
import org.arenasync.arena.leaderboard.LeaderboardEntry;
import org.arenasync.arena.leaderboard.LeaderboardService;
import org.arenasync.arena.leaderboard.LeaderboardSnapshot;
import org.arenasync.arena.persistence.BoardScope;
import org.arenasync.arena.persistence.PeriodicScore;
import org.arenasync.arena.persistence.PersistenceGateway;
import org.arenasync.arena.persistence.PlayerRecord;
import org.arenasync.arena.persistence.ScorePeriod;
import org.arenasync.node.processes.http.AbstractController;
import org.arenasync.node.spi.ServiceRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Read access to the live leaderboard, the all-time board of stored best scores and
 * the periodic boards ({@code /{scope}/{period}}, scope player or team, period all,
 * week or day).
 * <p>
 * <strong>Configuration Options:</strong>
 * <ul>
 *   <li><b>defaultLimit</b>: rows returned without a {@code limit} query parameter (default: 10)</li>
 *   <li><b>maxLimit</b>: largest accepted {@code limit} (default: 100)</li>
 * </ul>
 */
public class LeaderboardController extends AbstractController {

    private final LeaderboardService leaderboard;
    private final PersistenceGateway persistence;
    private final int defaultLimit;
    private final int maxLimit;

    public LeaderboardController(final ServiceRegistry registry, final Config options) {
        super(registry, options);
        final Config config = options.withFallback(ConfigFactory.parseMap(Map.of(
            "defaultLimit", 10,
            "maxLimit", 100
        )));
        this.leaderboard = registry.get(LeaderboardService.class);
        this.persistence = registry.get(PersistenceGateway.class);
        this.defaultLimit = config.getInt("defaultLimit");
        this.maxLimit = config.getInt("maxLimit");
    }

    @Override
    public void registerRoutes(final Javalin app, final String basePath) {
        app.get(path(basePath, ""), this::getLive);
        app.get(path(basePath, "all-time"), this::getAllTime);
        app.get(path(basePath, "{scope}/{period}"), this::getPeriodic);
    }

    void getLive(final Context ctx) {
        final int limit = limit(ctx);
        final LeaderboardSnapshot snapshot = leaderboard.snapshot();
        final List<LeaderboardEntryDto> entries = new ArrayList<>();
        for (final LeaderboardEntry entry : snapshot.top(limit)) {
            entries.add(new LeaderboardEntryDto(entry.rank(), entry.playerId().value(), entry.displayName(), entry.score()));
        }
        final String publishedAt = snapshot.version() == 0 ? null : snapshot.publishedAt().toString();
        ctx.status(HttpStatus.OK).json(new LeaderboardDto("live", snapshot.version(), publishedAt, entries));
    }

    void getAllTime(final Context ctx) throws StorageUnavailableException {
        final int limit = limit(ctx);
        final List<PlayerRecord> players = persistence.topPlayers(limit);
        final List<LeaderboardEntryDto> entries = new ArrayList<>(players.size());
        for (int i = 0; i < players.size(); i++) {
            final PlayerRecord record = players.get(i);
            entries.add(new LeaderboardEntryDto(i + 1, record.playerId().value(), record.displayName(), record.bestScore()));
        }
        ctx.status(HttpStatus.OK).json(new LeaderboardDto("all-time", 0L, null, entries));
    }

    void getPeriodic(final Context ctx) throws StorageUnavailableException {
        final BoardScope scope = BoardScope.parse(ctx.pathParam("scope"));
        final ScorePeriod period = ScorePeriod.parse(ctx.pathParam("period"));
        final int limit = limit(ctx);
        final List<PeriodicScore> rows = persistence.topScores(scope, period, limit);
        final List<PeriodicEntryDto> entries = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            final PeriodicScore row = rows.get(i);
            entries.add(new PeriodicEntryDto(i + 1, row.key(), row.displayName(), row.score(),
                row.achievedAt().toString(), row.expiresAt() == null ? null : row.expiresAt().toString()));
        }
        ctx.status(HttpStatus.OK).json(new PeriodicBoardDto(scope.key() + "/" + period.key(), entries));
    }

    private int limit(final Context ctx) {
        final int limit = ctx.queryParamAsClass("limit", Integer.class).getOrDefault(defaultLimit);
        if (limit < 1 || limit > maxLimit) {
            throw new IllegalArgumentException("limit must be between 1 and " + maxLimit + ", got " + limit);
        }
        return limit;
    }
}
