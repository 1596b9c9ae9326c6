package org.arenasync.node.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.arenasync.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Verifies the configuration precedence: system properties, then the file, then reference.conf.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ConfigLoaderTest {

    private static final String ARENA = "node.processes.arena.options.";

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("arenasync.test.value");
        System.clearProperty(ARENA + "tick.tickRateHz");
        ConfigFactory.invalidateCaches();
    }

    private File writeConfig(String content) throws IOException {
        Path file = tempDir.resolve("arena.conf");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file.toFile();
    }

    @Test
    @DisplayName("Without a file the reference defaults apply")
    void load_missingFileUsesDefaults() {
        Config config = ConfigLoader.load(tempDir.resolve("missing.conf").toFile());

        assertEquals(20, config.getInt(ARENA + "tick.tickRateHz"));
        assertEquals(64, config.getInt(ARENA + "encoder.historyTicks"));
        assertTrue(config.hasPath("node.processes.httpServer.options.routes"));
    }

    @Test
    @DisplayName("File values override defaults and feed substitutions in reference.conf")
    void load_fileOverridesDefaults() throws IOException {
        File file = writeConfig("""
            node.processes.arena.options {
              region = "eu-west"
              tick.tickRateHz = 30
            }
            arenasync.test.value = "from-file"
            """);

        Config config = ConfigLoader.load(file);

        assertEquals(30, config.getInt(ARENA + "tick.tickRateHz"));
        assertEquals("eu-west", config.getString(ARENA + "persistence.store.options.namespace"));
        assertEquals(48, config.getInt(ARENA + "encoder.maxBaselineAge"));
        assertEquals("from-file", config.getString("arenasync.test.value"));
    }

    @Test
    @DisplayName("System properties override the file")
    void load_systemPropertiesOverrideFile() throws IOException {
        File file = writeConfig("""
            node.processes.arena.options.tick.tickRateHz = 30
            arenasync.test.value = "from-file"
            """);
        System.setProperty(ARENA + "tick.tickRateHz", "60");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.load(file);

        assertEquals(60, config.getInt(ARENA + "tick.tickRateHz"));
        assertEquals("from-file", config.getString("arenasync.test.value"));
    }

    @Test
    @DisplayName("A directory is not read as a configuration file")
    void load_directoryIsSkipped() {
        Config config = ConfigLoader.load(tempDir.toFile());

        assertFalse(config.hasPath("arenasync.test.value"));
        assertEquals(20, config.getInt(ARENA + "tick.tickRateHz"));
    }
}
