package org.arenasync.node;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigObject;
import org.arenasync.node.spi.IProcess;
import org.arenasync.node.spi.IServiceProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Hosts the processes listed under {@code node.processes}: in practice the arena
 * itself and the HTTP/WebSocket server that fronts it.
 * <p>
 * A process names what it needs in its {@code require} block ({@code localName = processName});
 * providers are created first and their exposed service is handed to the consumer's
 * {@code (String, Map, Config)} constructor. The name {@value #NODE_SERVICE} always
 * resolves to the node, which lets the HTTP server offer a stop endpoint.
 */
public final class Node {
    private static final Logger LOGGER = LoggerFactory.getLogger(Node.class);
    private static final String PROCESSES_PATH = "node.processes";
    public static final String NODE_SERVICE = "node";

    private final Map<String, IProcess> processes = new LinkedHashMap<>();
    private Thread shutdownHook;
    private volatile boolean stopped;

    public Node(final Config config) {
        try {
            createProcesses(config);
        } catch (final RuntimeException e) {
            LOGGER.error("Failed to initialize the node.", e);
            throw new IllegalStateException("Node initialization failed", e);
        }
    }

    /**
     * Starts every process in dependency order. A process that fails to start is
     * logged and the remaining ones still start.
     */
    public void start() {
        if (processes.isEmpty()) {
            LOGGER.warn("No processes configured to start. The node will be idle.");
        }
        processes.forEach((name, process) -> {
            try {
                process.start();
                LOGGER.debug("Process '{}' started", name);
            } catch (final RuntimeException e) {
                LOGGER.error("Failed to start process '{}'. The node may be unstable.", name, e);
            }
        });
        shutdownHook = new Thread(this::stop, "arena-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        LOGGER.info("Node running {} process(es): {}", processes.size(), processes.keySet());
    }

    /**
     * Stops the processes in reverse start order. Only the first call has an effect.
     */
    public synchronized void stop() {
        if (stopped) {
            return;
        }
        stopped = true;
        LOGGER.info("Stopping node...");
        if (shutdownHook != null) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (final IllegalStateException e) {
                LOGGER.debug("Shutdown already in progress: {}", e.getMessage());
            }
        }
        final List<String> names = new ArrayList<>(processes.keySet());
        Collections.reverse(names);
        for (final String name : names) {
            try {
                processes.get(name).stop();
            } catch (final RuntimeException e) {
                LOGGER.error("Error while stopping process '{}'.", name, e);
            }
        }
        LOGGER.info("Node stopped.");
    }

    public List<String> getProcessNames() {
        return List.copyOf(processes.keySet());
    }

    public Optional<IProcess> getProcess(final String name) {
        return Optional.ofNullable(processes.get(name));
    }

    public boolean isStopped() {
        return stopped;
    }

    private void createProcesses(final Config config) {
        if (!config.hasPath(PROCESSES_PATH)) {
            LOGGER.warn("Configuration path '{}' not found. No processes will be loaded.", PROCESSES_PATH);
            return;
        }
        final ConfigObject declared = config.getObject(PROCESSES_PATH);
        final Map<String, ProcessSpec> specs = new LinkedHashMap<>();
        for (final String name : declared.keySet()) {
            specs.put(name, ProcessSpec.parse(name, declared.toConfig().getConfig(name)));
        }

        final Map<String, Object> services = new HashMap<>();
        services.put(NODE_SERVICE, this);
        for (final String name : creationOrder(specs)) {
            final ProcessSpec spec = specs.get(name);
            try {
                final IProcess process = spec.instantiate(services);
                processes.put(name, process);
                if (process instanceof IServiceProvider provider && provider.getExposedService() != null) {
                    services.put(name, provider.getExposedService());
                }
            } catch (final ReflectiveOperationException | RuntimeException e) {
                LOGGER.error("Failed to initialize process '{}'. Skipping this process.", name, e);
            }
        }
        LOGGER.info("Initialized process(es) {}", processes.keySet());
    }

    /**
     * Orders the processes so that every provider precedes its consumers, keeping
     * declaration order otherwise.
     *
     * @throws IllegalStateException on an undeclared or circular requirement.
     */
    private static List<String> creationOrder(final Map<String, ProcessSpec> specs) {
        final List<String> order = new ArrayList<>();
        final Set<String> visiting = new HashSet<>();
        for (final String name : specs.keySet()) {
            visit(name, specs, visiting, order);
        }
        return order;
    }

    private static void visit(final String name, final Map<String, ProcessSpec> specs,
                              final Set<String> visiting, final List<String> order) {
        if (order.contains(name)) {
            return;
        }
        if (!visiting.add(name)) {
            throw new IllegalStateException("Circular 'require' chain through process '" + name + "'");
        }
        for (final String provider : specs.get(name).requires().values()) {
            if (NODE_SERVICE.equals(provider)) {
                continue;
            }
            if (!specs.containsKey(provider)) {
                throw new IllegalStateException("Process '" + name + "' requires undeclared process '" + provider + "'");
            }
            visit(provider, specs, visiting, order);
        }
        visiting.remove(name);
        order.add(name);
    }

    private record ProcessSpec(String name, String className, Config options, Map<String, String> requires) {

        static ProcessSpec parse(final String name, final Config config) {
            final Map<String, String> requires = new LinkedHashMap<>();
            if (config.hasPath("require")) {
                config.getObject("require").unwrapped()
                    .forEach((local, provider) -> requires.put(local, String.valueOf(provider)));
            }
            final Config options = config.hasPath("options") ? config.getConfig("options") : ConfigFactory.empty();
            return new ProcessSpec(name, config.getString("className"), options, requires);
        }

        IProcess instantiate(final Map<String, Object> services) throws ReflectiveOperationException {
            final Map<String, Object> dependencies = new HashMap<>();
            requires.forEach((local, provider) -> {
                final Object service = services.get(provider);
                if (service == null) {
                    throw new IllegalStateException("Process '" + name + "' requires '" + provider + "', which is not available");
                }
                dependencies.put(local, service);
            });
            final Class<?> type = Class.forName(className);
            if (!IProcess.class.isAssignableFrom(type)) {
                throw new IllegalArgumentException(className + " does not implement IProcess");
            }
            return (IProcess) type.getConstructor(String.class, Map.class, Config.class)
                .newInstance(name, dependencies, options);
        }
    }
}
