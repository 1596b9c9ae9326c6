package org.arenasync.cli.commands;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.arenasync.arena.api.PlayerId;
import org.arenasync.arena.session.HmacTokenVerifier;
import org.arenasync.cli.CommandLineInterface;
import org.arenasync.junit.extensions.logging.LogWatchExtension;
import org.arenasync.node.config.LoggingConfigurator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class TokenCommandTest {

    private static final String SECRET = "cli-test-secret-0123456";

    @TempDir
    Path tempDir;

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    private Level rootLevel;
    private CommandLine cli;
    private StringWriter out;
    private Path configFile;

    @BeforeEach
    void setUp() throws IOException {
        LoggingConfigurator.reset();
        rootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();

        configFile = tempDir.resolve("arena.conf");
        // JSON selects the console appender already attached in tests, so logback is not reloaded
        Files.writeString(configFile, """
            logging { format = JSON, chat-log = false }
            node.processes.arena.options.auth.secret = "%s"
            """.formatted(SECRET), StandardCharsets.UTF_8);

        cli = new CommandLine(new CommandLineInterface());
        cli.setErr(new PrintWriter(new StringWriter(), true));
        out = new StringWriter();
        TokenCommand token = cli.getSubcommands().get("token").getCommand();
        token.setOut(new PrintWriter(out, true));
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
        context.getLogger(LoggingConfigurator.CHAT_LOGGER).setLevel(Level.WARN);
        System.clearProperty(LoggingConfigurator.FORMAT_PROPERTY);
    }

    @Test
    void issuesTokenVerifiableWithConfiguredSecret() throws Exception {
        int exitCode = cli.execute("-c", configFile.toString(), "token", "ana", "--ttl", "PT1H");

        assertThat(exitCode).isZero();
        String token = out.toString().trim();
        assertThat(new HmacTokenVerifier(SECRET, Clock.systemUTC()).verify(token)).isEqualTo(new PlayerId("ana"));
    }

    @Test
    void missingConfigFileIsAUsageError() {
        int exitCode = cli.execute("-c", tempDir.resolve("nope.conf").toString(), "token", "ana");

        assertThat(exitCode).isEqualTo(2);
        assertThat(out.toString()).isEmpty();
    }
}
