package org.keel.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.keel.cli.commands.ImportCommand;
import org.keel.cli.commands.ResolveCommand;
import org.keel.cli.config.ConfigLoader;
import org.keel.cli.config.InvalidConfigurationException;
import org.keel.cli.config.KeelConfiguration;
import org.keel.cli.config.LoggingConfigurator;
import org.keel.compiler.api.ImportSession;
import org.keel.compiler.frontend.io.LocalSourceFileSystem;
import org.keel.compiler.frontend.module.ImportSettings;
import org.slf4j.LoggerFactory;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "keel",
    mixinStandardHelpOptions = true,
    version = "Keel 1.0",
    description = "Keel - module import resolution for the Keel compiler frontend",
    subcommands = {
        ResolveCommand.class,
        ImportCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/keel.conf)"
    )
    private File configFile;

    private KeelConfiguration configuration;

    @Override
    public Integer call() {
        // No subcommand: show usage.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = createCommandLine();
        final int exitCode = commandLine.execute(args);
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
        commandLine.setCommandName("keel");
        return commandLine;
    }

    private void initialize() {
        if (configuration != null) {
            return;
        }
        this.configuration = ConfigLoader.load(this.configFile);
        LoggingConfigurator.configure(configuration.config());
        LoggerFactory.getLogger(CommandLineInterface.class)
                .debug("Using configuration from {}", configuration.describeSource());
    }

    /**
     * Returns the validated configuration, loading it on first use.
     *
     * @throws InvalidConfigurationException If the configuration file is missing or invalid.
     */
    public KeelConfiguration getConfiguration() {
        initialize();
        return configuration;
    }

    /**
     * Opens a fresh import session over the local file system with the configured settings.
     *
     * @throws InvalidConfigurationException If the configuration file is missing or invalid.
     */
    public ImportSession openSession() {
        final ImportSettings settings = getConfiguration().imports();
        return new ImportSession(settings, new LocalSourceFileSystem(), ImportSession.defaultBundledLocator(settings));
    }
}
