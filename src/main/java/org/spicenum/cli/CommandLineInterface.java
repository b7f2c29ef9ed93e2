package org.spicenum.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.spicenum.cli.commands.CompareCommand;
import org.spicenum.cli.commands.ResolveCommand;
import org.spicenum.cli.commands.SuffixesCommand;
import org.spicenum.cli.config.ConfigLoader;
import org.spicenum.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;
import java.util.concurrent.Callable;

@Command(
    name = "spicenum",
    mixinStandardHelpOptions = true,
    version = "spicenum 1.0",
    description = "Resolves numeric literals of SPICE circuit descriptions.",
    subcommands = {
        ResolveCommand.class,
        CompareCommand.class,
        SuffixesCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    /**
     * Creates the command line with the handler that turns configuration and I/O errors into exit code 1.
     * Arguments that look like unknown options, such as {@code -453X}, are taken as literals.
     *
     * @return A ready to execute command line.
     */
    public static CommandLine newCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("spicenum");
        commandLine.setUnmatchedOptionsArePositionalParams(true);
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            if (ex instanceof ConfigException) {
                LOG.error("Failed to load or parse configuration: {}", ex.getMessage());
                cmd.getErr().println("Configuration error: " + ex.getMessage());
                return 1;
            }
            if (ex instanceof IOException) {
                LOG.error("I/O error: {}", ex.getMessage());
                cmd.getErr().println("Cannot read input: " + ex.getMessage());
                return 1;
            }
            throw ex;
        });
        return commandLine;
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     *
     * @return The merged configuration.
     * @throws ConfigException if the configuration cannot be loaded.
     */
    public Config getConfig() {
        if (config == null) {
            config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}
