package org.arenasync.node.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Builds the node configuration. Later layers only fill what earlier ones leave
 * unset: environment variables, then system properties, then the arena file, then
 * the {@code reference.conf} defaults. Substitutions such as {@code ${?ARENA_REGION}}
 * resolve against the merged result.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    public static final String DEFAULT_CONFIG_FILE = "arena.conf";

    private ConfigLoader() {
    }

    /**
     * @param configFile the arena file; a missing file or a directory contributes nothing.
     */
    public static Config load(final File configFile) {
        return ConfigFactory.systemEnvironment()
            .withFallback(ConfigFactory.systemProperties())
            .withFallback(arenaFile(configFile))
            .withFallback(ConfigFactory.parseResources("reference.conf"))
            .resolve();
    }

    private static Config arenaFile(final File configFile) {
        if (!configFile.isFile()) {
            LOG.info("No arena configuration at '{}', using defaults", configFile.getPath());
            return ConfigFactory.empty();
        }
        LOG.info("Loading arena configuration from {}", configFile.getAbsolutePath());
        return ConfigFactory.parseFile(configFile);
    }
}
