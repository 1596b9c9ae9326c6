package org.arenasync.node.processes.http;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigObject;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;
import io.javalin.Javalin;
import io.javalin.http.HttpStatus;
import org.arenasync.arena.Arena;
import org.arenasync.arena.api.StorageUnavailableException;
import org.arenasync.arena.chat.ChatService;
import org.arenasync.arena.leaderboard.LeaderboardService;
import org.arenasync.arena.persistence.PersistenceGateway;
import org.arenasync.arena.session.ConnectionManager;
import org.arenasync.node.Node;
import org.arenasync.node.processes.AbstractProcess;
import org.arenasync.node.processes.http.api.dto.ErrorResponseDto;
import org.arenasync.node.spi.IController;
import org.arenasync.node.spi.ServiceRegistry;
import org.eclipse.jetty.util.thread.QueuedThreadPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A manageable process that runs a Javalin HTTP server. It configures its routes by parsing
 * a 'routes' block in its configuration and instantiating the controllers named there,
 * the arena WebSocket endpoint included.
 *
 * <p>Dependencies: {@code arena} (required) and {@code node} (optional, needed by the
 * node controller). Both, and the arena's components, are placed in the {@link ServiceRegistry}
 * handed to controllers.</p>
 */
public class HttpServerProcess extends AbstractProcess {
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpServerProcess.class);

    private static final String ROUTES_CONFIG_KEY = "routes";
    private static final String CONTROLLER_ACTION_KEY = "$controller";

    private final List<RouteDefinition> routeDefinitions = new ArrayList<>();
    private final ServiceRegistry controllerRegistry;
    private Javalin app;

    /**
     * @param processName  The name of this process instance from the configuration.
     * @param dependencies Dependencies injected by the Node ("arena", optionally "node").
     * @param options      Network settings, WebSocket limits and routes.
     */
    public HttpServerProcess(final String processName, final Map<String, Object> dependencies, final Config options) {
        super(processName, dependencies, options);

        final Arena arena = getDependency("arena", Arena.class);
        this.controllerRegistry = new ServiceRegistry();
        controllerRegistry.register(Arena.class, arena);
        controllerRegistry.register(ConnectionManager.class, arena.connections());
        controllerRegistry.register(LeaderboardService.class, arena.leaderboard());
        controllerRegistry.register(PersistenceGateway.class, arena.persistence());
        controllerRegistry.register(ChatService.class, arena.chat());
        final OperatorAccess operatorAccess = OperatorAccess.fromConfig(options);
        controllerRegistry.register(OperatorAccess.class, operatorAccess);
        if (!operatorAccess.isEnabled()) {
            LOGGER.info("No operator token configured; operator endpoints will refuse every request.");
        }

        final Node node = getOptionalDependency("node", Node.class);
        if (node != null) {
            controllerRegistry.register(Node.class, node);
        }

        parseRoutes();
        LOGGER.debug("HttpServerProcess '{}' initialized with {} route(s).", processName, routeDefinitions.size());
    }

    @Override
    public void start() {
        if (app != null) {
            LOGGER.warn("HTTP server is already running.");
            return;
        }

        final String host = options.getString("network.host");
        final int port = options.getInt("network.port");

        app = createApp();
        app.start(host, port);
        LOGGER.info("HTTP server started on {}:{}", host, app.port());
    }

    /**
     * Builds the Javalin instance with all routes registered, without starting it.
     */
    Javalin createApp() {
        final Javalin created = Javalin.create(config -> {
            config.showJavalinBanner = false;
            config.requestLogger.http((ctx, ms) -> {
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug("Request: {} {} (completed in {} ms)", ctx.method(), ctx.path(), ms);
                }
            });

            final int minThreads = options.hasPath("network.threadPool.minThreads")
                ? options.getInt("network.threadPool.minThreads")
                : 8;
            final int maxThreads = options.hasPath("network.threadPool.maxThreads")
                ? options.getInt("network.threadPool.maxThreads")
                : 200;
            final int idleTimeout = options.hasPath("network.threadPool.idleTimeoutMs")
                ? options.getInt("network.threadPool.idleTimeoutMs")
                : 60000;

            final QueuedThreadPool threadPool = new QueuedThreadPool(maxThreads, minThreads, idleTimeout);
            threadPool.setName(processName);
            config.jetty.threadPool = threadPool;

            final long wsIdleTimeoutMs = options.hasPath("websocket.idleTimeoutMs")
                ? options.getLong("websocket.idleTimeoutMs")
                : 60000L;
            final long wsMaxMessageBytes = options.hasPath("websocket.maxMessageBytes")
                ? options.getLong("websocket.maxMessageBytes")
                : 4096L;
            config.jetty.modifyWebSocketServletFactory(factory -> {
                factory.setIdleTimeout(Duration.ofMillis(wsIdleTimeoutMs));
                factory.setMaxBinaryMessageSize(wsMaxMessageBytes);
                factory.setMaxTextMessageSize(wsMaxMessageBytes);
            });

            LOGGER.debug("Configured thread pool '{}' with {} min threads, {} max threads; WebSocket idle timeout {} ms",
                threadPool.getName(), minThreads, maxThreads, wsIdleTimeoutMs);
        });

        registerExceptionHandlers(created);
        registerControllers(created);
        return created;
    }

    @Override
    public void stop() {
        if (app != null) {
            app.stop();
            app = null;
            LOGGER.info("HTTP server stopped.");
        }
    }

    ServiceRegistry getControllerRegistry() {
        return controllerRegistry;
    }

    private void registerExceptionHandlers(final Javalin app) {
        app.exception(IllegalArgumentException.class, (e, ctx) -> {
            LOGGER.debug("Bad request {}: {}", ctx.path(), e.getMessage());
            ctx.status(HttpStatus.BAD_REQUEST).json(ErrorResponseDto.of(
                HttpStatus.BAD_REQUEST.getCode(), HttpStatus.BAD_REQUEST.getMessage(), e.getMessage()));
        });
        app.exception(UnauthorizedException.class, (e, ctx) -> {
            LOGGER.info("Unauthorized operator request {} {}: {}", ctx.method(), ctx.path(), e.getMessage());
            ctx.header("WWW-Authenticate", "Bearer");
            ctx.status(HttpStatus.UNAUTHORIZED).json(ErrorResponseDto.of(
                HttpStatus.UNAUTHORIZED.getCode(), HttpStatus.UNAUTHORIZED.getMessage(), e.getMessage()));
        });
        app.exception(StorageUnavailableException.class, (e, ctx) -> {
            LOGGER.warn("Storage unavailable for request {}: {}", ctx.path(), e.getMessage());
            ctx.status(HttpStatus.SERVICE_UNAVAILABLE).json(ErrorResponseDto.of(
                HttpStatus.SERVICE_UNAVAILABLE.getCode(), HttpStatus.SERVICE_UNAVAILABLE.getMessage(), e.getMessage()));
        });
        app.exception(Exception.class, (e, ctx) -> {
            LOGGER.error("Unhandled exception for request {}", ctx.path(), e);
            ctx.status(HttpStatus.INTERNAL_SERVER_ERROR).json(ErrorResponseDto.of(
                HttpStatus.INTERNAL_SERVER_ERROR.getCode(), HttpStatus.INTERNAL_SERVER_ERROR.getMessage(),
                "An internal server error occurred."));
        });
    }

    private void parseRoutes() {
        if (!options.hasPath(ROUTES_CONFIG_KEY)) {
            LOGGER.warn("No '{}' block found in http-server configuration. No routes will be served.", ROUTES_CONFIG_KEY);
            return;
        }
        parseConfigLevel(options.getConfig(ROUTES_CONFIG_KEY).root(), "/");
    }

    private void parseConfigLevel(final ConfigObject configObject, final String currentPath) {
        for (final Map.Entry<String, ConfigValue> entry : configObject.entrySet()) {
            final String key = entry.getKey();
            final ConfigValue value = entry.getValue();

            if (key.equals(CONTROLLER_ACTION_KEY)) {
                if (value.valueType() == ConfigValueType.OBJECT) {
                    routeDefinitions.add(new RouteDefinition(currentPath, ((ConfigObject) value).toConfig()));
                } else {
                    LOGGER.error("Invalid config for '$controller' at path '{}'. Expected an object.", currentPath);
                }
            } else if (value.valueType() == ConfigValueType.OBJECT) {
                parseConfigLevel((ConfigObject) value, (currentPath + key + "/").replaceAll("//", "/"));
            }
        }
    }

    private void registerControllers(final Javalin app) {
        for (final RouteDefinition def : routeDefinitions) {
            try {
                registerController(def, app);
            } catch (final Exception e) {
                LOGGER.error("Failed to register controller at path '{}'", def.basePath(), e);
            }
        }
    }

    private void registerController(final RouteDefinition def, final Javalin app) throws ReflectiveOperationException {
        final String className = def.config().getString("className");
        final Config controllerOptions = def.config().hasPath("options")
            ? def.config().getConfig("options")
            : ConfigFactory.empty();

        LOGGER.debug("Registering controller '{}' at base path '{}'", className, def.basePath());

        final Class<?> controllerClass = Class.forName(className);
        if (!IController.class.isAssignableFrom(controllerClass)) {
            throw new IllegalArgumentException("Class " + className + " does not implement IController.");
        }

        final Constructor<?> constructor = controllerClass.getConstructor(ServiceRegistry.class, Config.class);
        final IController controller = (IController) constructor.newInstance(controllerRegistry, controllerOptions);
        controller.registerRoutes(app, def.basePath());
    }

    private record RouteDefinition(String basePath, Config config) {
        RouteDefinition {
            Objects.requireNonNull(basePath);
            Objects.requireNonNull(config);
        }
    }
}
