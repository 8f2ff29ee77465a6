package org.tova.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.tova.cli.commands.CheckCommand;
import org.tova.cli.commands.CompileCommand;
import org.tova.config.ConfigLoader;
import org.tova.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "tova",
    mixinStandardHelpOptions = true,
    version = "Tova 0.9.0",
    description = "Tova - compiles .tova sources to JavaScript for shared, server, client, edge and CLI targets",
    subcommands = {
        CompileCommand.class,
        CheckCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to a custom configuration file (default: tova.conf)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("tova");
        System.exit(commandLine.execute(args));
    }

    /**
     * Loads the configuration on first use and applies its logging section.
     * @return The resolved configuration.
     * @throws CommandLine.ParameterException if the configuration cannot be loaded.
     */
    public Config getConfig() {
        if (config == null) {
            try {
                config = ConfigLoader.load(configFile);
            } catch (ConfigException | IllegalArgumentException e) {
                throw new CommandLine.ParameterException(new CommandLine(this),
                        "Failed to load configuration: " + e.getMessage(), e);
            }
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}
