package org.arenasync.node.spi;

/**
 * Implemented by processes that expose a service to other processes. The node injects the
 * exposed instance into every process that names the provider in its {@code require} block.
 *
 * <p>Example: {@code ArenaProcess} exposes the {@code Arena} to {@code HttpServerProcess}.</p>
 */
public interface IServiceProvider {

    /**
     * Returns the service instance that this process exposes to other processes.
     *
     * @return The service instance, or null if this process doesn't expose a service
     */
    Object getExposedService();
}
