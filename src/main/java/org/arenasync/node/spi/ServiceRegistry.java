package org.arenasync.node.spi;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Type-keyed holder of the shared instances handed to controllers
 * (the arena, its components, the node).
 */
public final class ServiceRegistry {

    private final Map<Class<?>, Object> services = new ConcurrentHashMap<>();

    /**
     * Registers a service instance with the registry.
     *
     * @param type     The class type under which to register the service.
     * @param instance The instance.
     * @throws IllegalArgumentException if a service for the given type is already registered.
     */
    public <T> void register(final Class<T> type, final T instance) {
        if (services.putIfAbsent(type, instance) != null) {
            throw new IllegalArgumentException("Service of type " + type.getName() + " is already registered.");
        }
    }

    /**
     * Retrieves a service instance from the registry.
     *
     * @throws IllegalArgumentException if no service for the given type is found.
     */
    public <T> T get(final Class<T> type) {
        final Object instance = services.get(type);
        if (instance == null) {
            throw new IllegalArgumentException("No service registered for type " + type.getName());
        }
        return type.cast(instance);
    }

    public <T> Optional<T> find(final Class<T> type) {
        return Optional.ofNullable(services.get(type)).map(type::cast);
    }

    public boolean hasService(final Class<?> type) {
        return services.containsKey(type);
    }
}
