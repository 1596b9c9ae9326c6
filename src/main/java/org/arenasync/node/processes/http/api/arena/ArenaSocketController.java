package org.arenasync.node.processes.http.api.arena;

import com.typesafe.config.Config;
import io.javalin.Javalin;
import io.javalin.websocket.WsBinaryMessageContext;
import io.javalin.websocket.WsCloseContext;
import io.javalin.websocket.WsConnectContext;
import io.javalin.websocket.WsContext;
import io.javalin.websocket.WsErrorContext;
import io.javalin.websocket.WsMessageContext;
import org.arenasync.arena.api.SessionId;
import org.arenasync.arena.session.AuthException;
import org.arenasync.arena.session.CloseReason;
import org.arenasync.arena.session.ConnectionManager;
import org.arenasync.arena.session.Handshake;
import org.arenasync.node.processes.http.AbstractController;
import org.arenasync.node.spi.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The game transport: one WebSocket per session.
 * <p>
 * The upgrade request is the handshake ({@code token}, {@code name} and {@code team} query
 * parameters plus the User-Agent header). A refused handshake closes the socket with the
 * {@link org.arenasync.arena.session.AuthError} code. Inbound binary messages are handed to
 * the connection manager; closing the socket closes the session.
 * <p>
 * <strong>Configuration Options:</strong>
 * <ul>
 *   <li><b>trustForwardedFor</b>: take the client address from {@code X-Forwarded-For}
 *       when present (default: false)</li>
 * </ul>
 */
public class ArenaSocketController extends AbstractController {

    private static final Logger LOGGER = LoggerFactory.getLogger(ArenaSocketController.class);
    private static final int NORMAL_CLOSURE = 1000;
    private static final int GOING_AWAY = 1001;

    private final ConnectionManager connections;
    private final boolean trustForwardedFor;
    private final Map<String, SessionId> socketSessions = new ConcurrentHashMap<>();

    public ArenaSocketController(final ServiceRegistry registry, final Config options) {
        super(registry, options);
        this.connections = registry.get(ConnectionManager.class);
        this.trustForwardedFor = options.hasPath("trustForwardedFor") && options.getBoolean("trustForwardedFor");
    }

    @Override
    public void registerRoutes(final Javalin app, final String basePath) {
        app.ws(path(basePath, ""), ws -> {
            ws.onConnect(this::onConnect);
            ws.onBinaryMessage(this::onBinaryMessage);
            ws.onMessage(this::onTextMessage);
            ws.onClose(this::onClose);
            ws.onError(this::onError);
        });
    }

    void onConnect(final WsConnectContext ctx) {
        final Handshake handshake = new Handshake(
            remoteAddress(ctx),
            ctx.header("User-Agent"),
            ctx.queryParam("token"),
            ctx.queryParam("name"),
            ctx.queryParam("team"),
            new WebSocketFrameSink(ctx));
        try {
            final SessionId sessionId = connections.open(handshake);
            socketSessions.put(ctx.sessionId(), sessionId);
        } catch (final AuthException e) {
            ctx.closeSession(e.getError().code(), e.getError().name());
        }
    }

    void onBinaryMessage(final WsBinaryMessageContext ctx) {
        final SessionId sessionId = socketSessions.get(ctx.sessionId());
        if (sessionId == null) {
            return;
        }
        final byte[] payload = Arrays.copyOfRange(ctx.data(), ctx.offset(), ctx.offset() + ctx.length());
        connections.routeRaw(sessionId, payload);
    }

    /**
     * Text frames are not part of the protocol; their bytes go through the same decoder
     * and count as malformed when they do not parse.
     */
    void onTextMessage(final WsMessageContext ctx) {
        final SessionId sessionId = socketSessions.get(ctx.sessionId());
        if (sessionId != null) {
            connections.routeRaw(sessionId, ctx.message().getBytes(StandardCharsets.UTF_8));
        }
    }

    void onClose(final WsCloseContext ctx) {
        final SessionId sessionId = socketSessions.remove(ctx.sessionId());
        if (sessionId == null) {
            return;
        }
        final int status = ctx.status();
        final CloseReason reason = status == NORMAL_CLOSURE || status == GOING_AWAY
            ? CloseReason.CLIENT_LEAVE
            : CloseReason.TRANSPORT_ERROR;
        connections.close(sessionId, reason);
    }

    void onError(final WsErrorContext ctx) {
        final Throwable error = ctx.error();
        LOGGER.debug("WebSocket error on {}: {}", socketSessions.get(ctx.sessionId()),
            error == null ? "unknown" : error.getMessage());
    }

    int openSockets() {
        return socketSessions.size();
    }

    private String remoteAddress(final WsContext ctx) {
        if (trustForwardedFor) {
            final String forwarded = ctx.header("X-Forwarded-For");
            if (forwarded != null && !forwarded.isBlank()) {
                return forwarded.split(",")[0].trim();
            }
        }
        final SocketAddress address = ctx.session.getRemoteAddress();
        if (address instanceof InetSocketAddress inet) {
            return inet.getAddress() != null ? inet.getAddress().getHostAddress() : inet.getHostString();
        }
        return String.valueOf(address);
    }
}
