package org.arenasync.node.processes.http.api.health;

import com.typesafe.config.Config;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import org.arenasync.arena.Arena;
import org.arenasync.arena.api.IMonitorable;
import org.arenasync.node.processes.http.AbstractController;
import org.arenasync.node.processes.http.api.dto.MessageResponseDto;
import org.arenasync.node.spi.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reports component health and metrics. A degraded node still answers 200; the
 * status field carries the difference, not the HTTP code.
 * <p>
 * <strong>Configuration Options:</strong>
 * <ul>
 *   <li><b>errorLimit</b>: recent errors listed per component (default: 10)</li>
 * </ul>
 */
public class HealthController extends AbstractController {

    private static final Logger LOGGER = LoggerFactory.getLogger(HealthController.class);

    private final Arena arena;
    private final int errorLimit;

    public HealthController(final ServiceRegistry registry, final Config options) {
        super(registry, options);
        this.arena = registry.get(Arena.class);
        this.errorLimit = options.hasPath("errorLimit") ? options.getInt("errorLimit") : 10;
    }

    @Override
    public void registerRoutes(final Javalin app, final String basePath) {
        app.get(path(basePath, ""), this::getHealth);
        app.delete(path(basePath, "errors"), this::clearErrors);
    }

    void getHealth(final Context ctx) {
        final Map<String, ComponentHealthDto> components = new LinkedHashMap<>();
        boolean healthy = true;
        for (final Map.Entry<String, IMonitorable> entry : arena.components().entrySet()) {
            final ComponentHealthDto dto = ComponentHealthDto.from(entry.getValue(), errorLimit);
            healthy &= dto.healthy();
            components.put(entry.getKey(), dto);
        }
        ctx.status(HttpStatus.OK).json(new HealthDto(
            healthy ? "UP" : "DEGRADED",
            arena.region(),
            arena.currentTick(),
            arena.connections().sessionCount(),
            components));
    }

    void clearErrors(final Context ctx) {
        requireOperator(ctx);
        arena.components().values().forEach(IMonitorable::clearErrors);
        LOGGER.info("Recorded errors cleared on operator request");
        ctx.status(HttpStatus.OK).json(new MessageResponseDto("Errors cleared."));
    }
}
