package org.arenasync.arena.api;

/**
 * Marker for named, configurable arena resources (stores, gateways, queues).
 */
public interface IResource {

    /**
     * Returns the name of this resource instance as given in the configuration.
     *
     * @return The resource name.
     */
    String getResourceName();
}
