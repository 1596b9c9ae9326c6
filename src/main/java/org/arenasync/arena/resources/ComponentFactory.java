package org.arenasync.arena.resources;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.lang.reflect.Constructor;

/**
 * Creates pluggable arena components (player stores, simulations) from a configuration
 * block containing {@code className} and optional {@code options}.
 * <p>
 * The class must offer either a {@code (String name, Config options)} or a
 * {@code (Config options)} public constructor; the named form is preferred.
 */
public final class ComponentFactory {

    private ComponentFactory() {
    }

    /**
     * Creates a component instance from its configuration.
     *
     * @param name          A logical name for the instance (for logging).
     * @param expectedType  The type the component is expected to implement.
     * @param config        The configuration block, containing 'className' and 'options'.
     * @param <T>           The expected type.
     * @return An instantiated and configured component.
     * @throws IllegalArgumentException if 'className' is missing.
     * @throws IllegalStateException    if the component cannot be created.
     */
    public static <T> T create(String name, Class<T> expectedType, Config config) {
        if (!config.hasPath("className")) {
            throw new IllegalArgumentException("Component '" + name + "' is missing 'className' property.");
        }
        String className = config.getString("className");
        Config options = config.hasPath("options") ? config.getConfig("options") : ConfigFactory.empty();

        try {
            Class<?> componentClass = Class.forName(className);
            if (!expectedType.isAssignableFrom(componentClass)) {
                throw new ClassCastException(String.format("Class %s does not implement the required type %s", className, expectedType.getName()));
            }
            Object instance;
            try {
                Constructor<?> constructor = componentClass.getConstructor(String.class, Config.class);
                instance = constructor.newInstance(name, options);
            } catch (NoSuchMethodException e) {
                Constructor<?> constructor = componentClass.getConstructor(Config.class);
                instance = constructor.newInstance(options);
            }
            return expectedType.cast(instance);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to create component '" + name + "' with class " + className, e);
        }
    }
}
