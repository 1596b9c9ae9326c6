package org.arenasync.node.processes.http.api.sessions;

import com.typesafe.config.Config;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import org.arenasync.arena.api.SessionId;
import org.arenasync.arena.session.ConnectionManager;
import org.arenasync.arena.session.SessionState;
import org.arenasync.arena.session.SessionView;
import org.arenasync.arena.session.TrustLevel;
import org.arenasync.node.processes.http.AbstractController;
import org.arenasync.node.processes.http.api.dto.ErrorResponseDto;
import org.arenasync.node.spi.ServiceRegistry;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Lists open sessions, optionally filtered by {@code trust} and {@code state}. Session
 * details include remote addresses, so both routes are operator only.
 */
public class SessionsController extends AbstractController {

    private final ConnectionManager connections;

    public SessionsController(final ServiceRegistry registry, final Config options) {
        super(registry, options);
        this.connections = registry.get(ConnectionManager.class);
    }

    @Override
    public void registerRoutes(final Javalin app, final String basePath) {
        app.get(path(basePath, ""), this::listSessions);
        app.get(path(basePath, "{sessionId}"), this::getSession);
    }

    void listSessions(final Context ctx) {
        requireOperator(ctx);
        final TrustLevel trust = enumParam(ctx, "trust", TrustLevel.class);
        final SessionState state = enumParam(ctx, "state", SessionState.class);
        final List<SessionDto> sessions = connections.sessions().stream()
            .filter(view -> trust == null || view.trust() == trust)
            .filter(view -> state == null || view.state() == state)
            .map(SessionDto::from)
            .toList();
        ctx.status(HttpStatus.OK).json(sessions);
    }

    void getSession(final Context ctx) {
        requireOperator(ctx);
        final SessionId sessionId = parseSessionId(ctx.pathParam("sessionId"));
        final Optional<SessionView> view = connections.session(sessionId);
        if (view.isPresent()) {
            ctx.status(HttpStatus.OK).json(SessionDto.from(view.get()));
        } else {
            ctx.status(HttpStatus.NOT_FOUND).json(ErrorResponseDto.of(
                HttpStatus.NOT_FOUND.getCode(),
                HttpStatus.NOT_FOUND.getMessage(),
                "No open session " + sessionId));
        }
    }

    /**
     * Accepts both the display form ("s-12") and the bare number.
     */
    static SessionId parseSessionId(final String raw) {
        final String digits = raw.startsWith("s-") ? raw.substring(2) : raw;
        try {
            return new SessionId(Long.parseLong(digits));
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("Invalid session id '" + raw + "'", e);
        }
    }

    private static <E extends Enum<E>> E enumParam(final Context ctx, final String name, final Class<E> type) {
        final String raw = ctx.queryParam(name);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Enum.valueOf(type, raw.trim().toUpperCase(Locale.ROOT));
        } catch (final IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown " + name + " '" + raw + "'", e);
        }
    }
}
