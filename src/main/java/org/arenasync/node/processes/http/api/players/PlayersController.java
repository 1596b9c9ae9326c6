package org.arenasync.node.processes.http.api.players;

import com.typesafe.config.Config;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import org.arenasync.arena.api.PlayerId;
import org.arenasync.arena.persistence.LoadResult;
import org.arenasync.arena.persistence.PersistenceGateway;
import org.arenasync.node.processes.http.AbstractController;
import org.arenasync.node.processes.http.api.dto.ErrorResponseDto;
import org.arenasync.node.spi.ServiceRegistry;

/**
 * Looks up stored player records.
 */
public class PlayersController extends AbstractController {

    private final PersistenceGateway persistence;

    public PlayersController(final ServiceRegistry registry, final Config options) {
        super(registry, options);
        this.persistence = registry.get(PersistenceGateway.class);
    }

    @Override
    public void registerRoutes(final Javalin app, final String basePath) {
        app.get(path(basePath, "{playerId}"), this::getPlayer);
    }

    void getPlayer(final Context ctx) {
        final PlayerId playerId = new PlayerId(ctx.pathParam("playerId"));
        final LoadResult result = persistence.loadPlayer(playerId);
        if (result instanceof LoadResult.Found found) {
            ctx.status(HttpStatus.OK).json(PlayerDto.from(found.record()));
        } else if (result instanceof LoadResult.Unavailable unavailable) {
            ctx.status(HttpStatus.SERVICE_UNAVAILABLE).json(ErrorResponseDto.of(
                HttpStatus.SERVICE_UNAVAILABLE.getCode(),
                HttpStatus.SERVICE_UNAVAILABLE.getMessage(),
                unavailable.reason()));
        } else {
            ctx.status(HttpStatus.NOT_FOUND).json(ErrorResponseDto.of(
                HttpStatus.NOT_FOUND.getCode(),
                HttpStatus.NOT_FOUND.getMessage(),
                "No record for player " + playerId));
        }
    }
}
