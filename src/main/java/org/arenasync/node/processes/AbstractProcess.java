package org.arenasync.node.processes;

import com.typesafe.config.Config;
import org.arenasync.node.spi.IProcess;

import java.util.Collections;
import java.util.Map;

/**
 * Base class for {@link IProcess} implementations. Every process receives its name, the
 * dependencies declared in its {@code require} block and its own {@code options}.
 */
public abstract class AbstractProcess implements IProcess {

    protected final String processName;
    protected final Map<String, Object> dependencies;
    protected final Config options;

    /**
     * @param processName  The name of this process instance from the configuration.
     * @param dependencies Dependency name to instance, as declared in the configuration.
     * @param options      The configuration specific to this process instance.
     */
    protected AbstractProcess(final String processName, final Map<String, Object> dependencies, final Config options) {
        this.processName = processName;
        this.dependencies = dependencies != null ? dependencies : Collections.emptyMap();
        this.options = options;
    }

    public String getProcessName() {
        return processName;
    }

    /**
     * Retrieves a required dependency.
     *
     * @throws IllegalArgumentException if the dependency is missing or has the wrong type
     */
    protected <T> T getDependency(final String name, final Class<T> expectedType) {
        final T dependency = getOptionalDependency(name, expectedType);
        if (dependency == null) {
            throw new IllegalArgumentException(
                "Required dependency '" + name + "' not found for process '" + processName + "'");
        }
        return dependency;
    }

    /**
     * Retrieves an optional dependency.
     *
     * @return The dependency, or null if not declared
     * @throws IllegalArgumentException if the dependency has the wrong type
     */
    protected <T> T getOptionalDependency(final String name, final Class<T> expectedType) {
        final Object dep = dependencies.get(name);
        if (dep == null) {
            return null;
        }
        if (!expectedType.isInstance(dep)) {
            throw new IllegalArgumentException(
                "Dependency '" + name + "' for process '" + processName + "' is " +
                dep.getClass().getName() + " but expected " + expectedType.getName());
        }
        return expectedType.cast(dep);
    }
}
