package org.arenasync.arena.api;

import java.util.List;
import java.util.Map;

/**
 * Implemented by components that expose health, metrics and transient errors
 * to the administrative endpoints.
 */
public interface IMonitorable {

    /**
     * Returns a snapshot of this component's metrics.
     *
     * @return Map of metric names to their current values.
     */
    Map<String, Number> getMetrics();

    /**
     * Returns the transient errors recorded since the last {@link #clearErrors()}.
     *
     * @return A copy of the recorded errors, oldest first.
     */
    List<OperationalError> getErrors();

    /**
     * Clears all recorded errors.
     */
    void clearErrors();

    /**
     * Returns whether the component currently considers itself healthy.
     *
     * @return {@code true} if healthy.
     */
    boolean isHealthy();
}
