package org.arenasync.node.spi;

/**
 * A long-running, manageable process within the {@link org.arenasync.node.Node}
 * (the arena itself, the HTTP server).
 */
public interface IProcess {

    /**
     * Starts the process. Must not block; continuous work runs on the process's own threads.
     */
    void start();

    /**
     * Stops the process and releases its resources.
     */
    void stop();
}
