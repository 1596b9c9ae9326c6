package org.arenasync.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.arenasync.cli.commands.TokenCommand;
import org.arenasync.cli.commands.node.NodeCommand;
import org.arenasync.node.config.ConfigLoader;
import org.arenasync.node.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "arenasync",
    mixinStandardHelpOptions = true,
    version = "arenasync 0.1.0",
    description = "Session and world-state synchronization server for a multiplayer arena",
    subcommands = {
        NodeCommand.class,
        TokenCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Option(
        names = {"-c", "--config"},
        description = "Path to the configuration file (default: " + ConfigLoader.DEFAULT_CONFIG_FILE + ")"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // Without a subcommand, show the help message.
        spec.commandLine().usage(System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        System.exit(commandLine.execute(args));
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     *
     * @return The resolved configuration.
     * @throws CommandLine.ParameterException if an explicitly named file is missing or the configuration is invalid.
     */
    public Config getConfig() {
        if (config == null) {
            if (configFile != null && !configFile.isFile()) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                    "Configuration file not found: " + configFile.getAbsolutePath());
            }
            final File file = configFile != null ? configFile : new File(ConfigLoader.DEFAULT_CONFIG_FILE);
            try {
                config = ConfigLoader.load(file);
            } catch (final ConfigException e) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                    "Failed to load configuration: " + e.getMessage(), e, null, file.getPath());
            }
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}
