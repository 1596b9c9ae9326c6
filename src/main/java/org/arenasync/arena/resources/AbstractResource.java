package org.arenasync.arena.resources;

import com.typesafe.config.Config;
import org.arenasync.arena.api.IMonitorable;
import org.arenasync.arena.api.IResource;
import org.arenasync.arena.api.OperationalError;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Abstract base class for arena resources, providing common name and configuration
 * handling plus the monitoring infrastructure shared with {@link org.arenasync.arena.services.AbstractService}.
 */
public abstract class AbstractResource implements IResource, IMonitorable {
    protected final String resourceName;
    protected final Config options;

    /**
     * Operational errors recorded by the resource. Private to enforce use of
     * {@link #recordError(String, String, String)}.
     */
    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();

    /**
     * Maximum number of errors to keep in memory. When exceeded, oldest errors are removed.
     */
    protected int getMaxErrors() {
        return 1000;
    }

    /**
     * @param name    The unique name of the resource instance from the configuration.
     * @param options The configuration object for this resource instance.
     */
    protected AbstractResource(String name, Config options) {
        this.resourceName = Objects.requireNonNull(name, "Resource name cannot be null");
        this.options = Objects.requireNonNull(options, "Resource options cannot be null");
    }

    @Override
    public String getResourceName() {
        return resourceName;
    }

    public Config getOptions() {
        return options;
    }

    /**
     * Records an operational error for tracking and monitoring.
     * <p>
     * Use this ONLY for transient errors where the resource keeps working. Transient
     * errors are logged with {@code log.warn(...)} without the exception; stack traces go
     * to DEBUG. Fatal errors are logged with {@code log.error(...)} and thrown instead.
     *
     * @param code    Error code for categorization (e.g., "STORE_WRITE_FAILED")
     * @param message Human-readable error message
     * @param details Additional context about the error
     */
    protected void recordError(String code, String message, String details) {
        errors.add(new OperationalError(Instant.now(), code, message, details));

        int maxErrors = getMaxErrors();
        while (errors.size() > maxErrors) {
            errors.pollFirst();
        }
    }

    @Override
    public List<OperationalError> getErrors() {
        return new ArrayList<>(errors);
    }

    @Override
    public void clearErrors() {
        errors.clear();
    }

    /**
     * Any recorded error makes the resource unhealthy until the errors are cleared.
     * Subclasses can override this for more specific health checks.
     */
    @Override
    public boolean isHealthy() {
        return errors.isEmpty();
    }

    @Override
    public final Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("error_count", errors.size());
        addCustomMetrics(metrics);
        return metrics;
    }

    /**
     * Hook method for subclasses to add resource-specific metrics. Always call
     * {@code super.addCustomMetrics(metrics)} first.
     *
     * @param metrics Mutable map to add custom metrics to (already contains base metrics)
     */
    protected void addCustomMetrics(Map<String, Number> metrics) {
        // Default: no custom metrics
    }
}
