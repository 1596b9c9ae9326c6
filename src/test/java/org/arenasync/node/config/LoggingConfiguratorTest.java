package org.arenasync.node.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.arenasync.junit.extensions.logging.ExpectLog;
import org.arenasync.junit.extensions.logging.LogLevel;
import org.arenasync.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Tests for the LoggingConfigurator class. The JSON format maps to the "STDOUT" appender the
 * test logback configuration already attaches, so no test triggers a reload.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class LoggingConfiguratorTest {

    private static final String TUNED_LOGGER = "org.arenasync.arena.session";

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    private Level rootLevel;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        rootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
        context.getLogger(LoggingConfigurator.CHAT_LOGGER).setLevel(Level.WARN);
        context.getLogger(TUNED_LOGGER).setLevel(null);
        System.clearProperty(LoggingConfigurator.FORMAT_PROPERTY);
    }

    @Test
    void appenderFor_mapsFormats() {
        assertEquals("STDOUT_PLAIN", LoggingConfigurator.appenderFor("PLAIN"));
        assertEquals("STDOUT_PLAIN", LoggingConfigurator.appenderFor("plain"));
        assertEquals("STDOUT", LoggingConfigurator.appenderFor("JSON"));
        assertEquals("STDOUT", LoggingConfigurator.appenderFor("anything-else"));
    }

    @Test
    void configure_appliesFormatAndLevels() {
        final Config config = ConfigFactory.parseString("""
            logging {
              format = "JSON"
              default-level = "INFO"
              chat-log = false
              levels {
                "org.arenasync.arena.session" = "DEBUG"
              }
            }
            """);

        LoggingConfigurator.configure(config);

        assertEquals("STDOUT", context.getProperty(LoggingConfigurator.FORMAT_PROPERTY));
        assertEquals("STDOUT", System.getProperty(LoggingConfigurator.FORMAT_PROPERTY));
        assertNotNull(context.getLogger(Logger.ROOT_LOGGER_NAME).getAppender("STDOUT"));
        assertEquals(Level.INFO, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
        assertEquals(Level.OFF, context.getLogger(LoggingConfigurator.CHAT_LOGGER).getLevel());
        assertEquals(Level.DEBUG, context.getLogger(TUNED_LOGGER).getLevel());
    }

    @Test
    void configure_enablesChatLog() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging { format = JSON, chat-log = true }"));

        assertEquals(Level.INFO, context.getLogger(LoggingConfigurator.CHAT_LOGGER).getLevel());
    }

    @Test
    void configure_onlyOnceUntilReset() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging { format = JSON, levels { \"" + TUNED_LOGGER + "\" = ERROR } }"));
        LoggingConfigurator.configure(ConfigFactory.parseString("logging { format = JSON, levels { \"" + TUNED_LOGGER + "\" = TRACE } }"));

        assertEquals(Level.ERROR, context.getLogger(TUNED_LOGGER).getLevel());
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*LoggingConfigurator",
        messagePattern = "Ignoring unknown level 'LOUD' for logger 'org.arenasync.arena.session'")
    void configure_ignoresUnknownLevels() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging { format = JSON, levels { \"" + TUNED_LOGGER + "\" = LOUD } }"));

        assertNull(context.getLogger(TUNED_LOGGER).getLevel());
    }
}
