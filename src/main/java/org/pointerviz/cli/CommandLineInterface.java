package org.pointerviz.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.pointerviz.cli.commands.ExamplesCommand;
import org.pointerviz.cli.commands.LayoutCommand;
import org.pointerviz.cli.commands.ResolveCommand;
import org.pointerviz.cli.config.ConfigLoader;
import org.pointerviz.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(
    name = "pointerviz",
    mixinStandardHelpOptions = true,
    version = "pointerviz 1.0",
    description = "Resolves C++ pointer and reference declarations into a memory graph and lays it out",
    subcommands = {
        ResolveCommand.class,
        LayoutCommand.class,
        ExamplesCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/pointerviz.conf)"
    )
    private File configFile;

    @Spec
    private CommandSpec spec;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates a fully configured CommandLine instance.
     * <p>
     * Use this method in tests to get the same configuration as the CLI entry point.
     *
     * @return A configured CommandLine instance.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("pointerviz");
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        return commandLine;
    }

    /**
     * Loads the configuration on first use and applies its logging section.
     *
     * @throws CommandLine.ParameterException if the configuration file is missing or malformed.
     */
    public Config getConfig() {
        if (config != null) {
            return config;
        }
        try {
            config = ConfigLoader.resolve(configFile, (level, message) -> {
                switch (level) {
                    case INFO -> LOG.info(message);
                    case WARN -> LOG.warn(message);
                }
            });
        } catch (IllegalArgumentException | ConfigException e) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Failed to load configuration: " + e.getMessage(), e);
        }
        LoggingConfigurator.configure(config);
        return config;
    }
}
