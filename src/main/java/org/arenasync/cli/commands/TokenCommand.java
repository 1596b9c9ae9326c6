package org.arenasync.cli.commands;

import com.typesafe.config.Config;
import org.arenasync.arena.api.PlayerId;
import org.arenasync.arena.session.HmacTokenVerifier;
import org.arenasync.cli.CommandLineInterface;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;

/**
 * Issues a signed identity token with the secret configured for the arena node.
 */
@Command(
    name = "token",
    description = "Issues a signed player identity token."
)
public class TokenCommand implements Callable<Integer> {

    static final String AUTH_PATH = "node.processes.arena.options.auth";

    @ParentCommand
    private CommandLineInterface parent;

    @Parameters(index = "0", description = "Player id (letters, digits, '-' and '_').")
    private String playerId;

    @Option(names = {"-t", "--ttl"}, defaultValue = "PT24H",
        description = "Token lifetime as ISO-8601 duration (default: ${DEFAULT-VALUE}).")
    private Duration ttl;

    private PrintWriter out = new PrintWriter(System.out, true);

    @Override
    public Integer call() {
        final Config config = parent.getConfig();
        final Clock clock = Clock.systemUTC();
        final HmacTokenVerifier verifier = new HmacTokenVerifier(config.getConfig(AUTH_PATH), clock);
        final Instant expiry = clock.instant().plus(ttl);
        out.println(verifier.issue(new PlayerId(playerId), expiry));
        return 0;
    }

    void setOut(final PrintWriter out) {
        this.out = out;
    }
}
