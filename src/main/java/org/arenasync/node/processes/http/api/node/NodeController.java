package org.arenasync.node.processes.http.api.node;

import com.typesafe.config.Config;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import org.arenasync.node.Node;
import org.arenasync.node.processes.http.AbstractController;
import org.arenasync.node.processes.http.api.dto.MessageResponseDto;
import org.arenasync.node.spi.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Stops the whole node. The shutdown runs shortly after the response is sent.
 */
public class NodeController extends AbstractController {

    private static final Logger LOGGER = LoggerFactory.getLogger(NodeController.class);

    private final long stopDelayMs;

    public NodeController(final ServiceRegistry registry, final Config options) {
        super(registry, options);
        this.stopDelayMs = options.hasPath("stopDelayMs") ? options.getLong("stopDelayMs") : 200L;
    }

    @Override
    public void registerRoutes(final Javalin app, final String basePath) {
        app.post(path(basePath, "stop"), this::handleStop);
    }

    void handleStop(final Context ctx) {
        requireOperator(ctx);
        final Node node = registry.get(Node.class);
        LOGGER.info("Received stop request. Shutting down node...");
        ctx.status(HttpStatus.ACCEPTED).json(new MessageResponseDto("Shutdown initiated."));

        final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            final Thread thread = new Thread(runnable, "node-stop");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.schedule(() -> {
            try {
                node.stop();
            } finally {
                scheduler.shutdown();
            }
        }, stopDelayMs, TimeUnit.MILLISECONDS);
    }
}
