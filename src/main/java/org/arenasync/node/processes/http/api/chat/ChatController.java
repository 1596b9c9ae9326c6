package org.arenasync.node.processes.http.api.chat;

import com.typesafe.config.Config;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import org.arenasync.arena.chat.ChatOutcome;
import org.arenasync.arena.chat.ChatService;
import org.arenasync.node.processes.http.AbstractController;
import org.arenasync.node.processes.http.api.dto.MessageResponseDto;
import org.arenasync.node.spi.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Operator chat: broadcasts a moderated announcement to every connected session.
 * Requires the operator token.
 * <p>
 * <strong>Configuration Options:</strong>
 * <ul>
 *   <li><b>defaultAlias</b>: sender name when the request has none (default: "Server")</li>
 *   <li><b>maxLength</b>: longest accepted announcement (default: 500)</li>
 * </ul>
 */
public class ChatController extends AbstractController {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatController.class);

    private final ChatService chat;
    private final String defaultAlias;
    private final int maxLength;

    public ChatController(final ServiceRegistry registry, final Config options) {
        super(registry, options);
        this.chat = registry.get(ChatService.class);
        this.defaultAlias = options.hasPath("defaultAlias") ? options.getString("defaultAlias") : "Server";
        this.maxLength = options.hasPath("maxLength") ? options.getInt("maxLength") : 500;
    }

    @Override
    public void registerRoutes(final Javalin app, final String basePath) {
        app.post(path(basePath, "announce"), this::announce);
    }

    void announce(final Context ctx) {
        requireOperator(ctx);
        final AnnouncementDto request = ctx.bodyAsClass(AnnouncementDto.class);
        if (request.text() == null || request.text().isBlank()) {
            throw new IllegalArgumentException("Announcement text must not be empty");
        }
        if (request.text().length() > maxLength) {
            throw new IllegalArgumentException("Announcement exceeds " + maxLength + " characters");
        }
        final String alias = request.alias() == null || request.alias().isBlank() ? defaultAlias : request.alias();
        final ChatOutcome outcome = chat.announce(alias, request.text());
        if (outcome == ChatOutcome.REJECTED) {
            throw new IllegalArgumentException("Announcement rejected by moderation");
        }
        LOGGER.info("Announcement sent as '{}'", alias);
        ctx.status(HttpStatus.ACCEPTED).json(new MessageResponseDto(
            outcome == ChatOutcome.DELIVERED_FILTERED ? "Announcement sent with masked terms." : "Announcement sent."));
    }
}
