package org.arenasync.node.spi;

import io.javalin.Javalin;

/**
 * Implemented by every HTTP or WebSocket controller mounted by the HTTP server process.
 * Controllers are instantiated reflectively with a {@code (ServiceRegistry, Config)} constructor.
 */
public interface IController {

    /**
     * Registers all routes of this controller with the given Javalin instance.
     *
     * @param app      The Javalin application instance to register routes with.
     * @param basePath The base path under which the controller's routes are nested.
     */
    void registerRoutes(Javalin app, String basePath);
}
