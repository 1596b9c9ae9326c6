package org.arenasync.node.processes.http;

import com.typesafe.config.Config;
import io.javalin.http.Context;
import org.arenasync.node.spi.IController;
import org.arenasync.node.spi.ServiceRegistry;

/**
 * Base class for {@link IController} implementations: every controller gets the
 * {@link ServiceRegistry} and its own configuration block.
 */
public abstract class AbstractController implements IController {

    protected final ServiceRegistry registry;
    protected final Config options;

    /**
     * @param registry The service registry for accessing shared services.
     * @param options  The configuration specific to this controller instance.
     */
    protected AbstractController(final ServiceRegistry registry, final Config options) {
        this.registry = registry;
        this.options = options;
    }

    /**
     * Rejects the request unless it carries the operator token. Without a registered
     * {@link OperatorAccess} operator routes are closed.
     *
     * @throws UnauthorizedException if the caller is not an operator.
     */
    protected void requireOperator(final Context ctx) {
        registry.find(OperatorAccess.class)
            .orElseGet(() -> new OperatorAccess(null))
            .require(ctx);
    }

    /**
     * Joins a configured base path (which may end with '/') and a route suffix.
     *
     * @param basePath The base path from the routes configuration.
     * @param suffix   The route below the base path, or empty for the base itself.
     * @return The joined path without duplicate or trailing slashes.
     */
    protected static String path(final String basePath, final String suffix) {
        String joined = (basePath + "/" + suffix).replaceAll("/{2,}", "/");
        if (joined.length() > 1 && joined.endsWith("/")) {
            joined = joined.substring(0, joined.length() - 1);
        }
        return joined;
    }
}
