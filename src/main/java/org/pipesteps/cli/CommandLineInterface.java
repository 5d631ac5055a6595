package org.pipesteps.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.pipesteps.cli.commands.CollectCommand;
import org.pipesteps.cli.commands.ResetCommand;
import org.pipesteps.cli.commands.RunCommand;
import org.pipesteps.cli.commands.StatusCommand;
import org.pipesteps.cli.config.ConfigLoader;
import org.pipesteps.cli.config.LoggingConfigurator;
import org.pipesteps.datapipeline.api.exceptions.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "pipe-steps",
    mixinStandardHelpOptions = true,
    version = "pipe-steps 1.0",
    description = "Restartable batch pipeline with per-step checkpoints",
    subcommands = {
        RunCommand.class,
        StatusCommand.class,
        CollectCommand.class,
        ResetCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    static final String LOGGING_FORMAT_PROPERTY = "pipesteps.logging.format";

    @Option(
        names = {"-c", "--config"},
        description = "Path to configuration file (default: config/pipe-steps.conf)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // No subcommand given
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        System.exit(createCommandLine().execute(args));
    }

    /**
     * Creates a fully configured CommandLine instance.
     * <p>
     * Use this method in tests to get the same configuration as the CLI entry point.
     *
     * @return A configured CommandLine instance.
     */
    public static CommandLine createCommandLine() {
        CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("pipe-steps");
        return commandLine;
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     *
     * @return the resolved configuration
     * @throws ConfigurationException if the configuration file is missing or unparsable
     */
    public Config getConfig() {
        if (config != null) {
            return config;
        }
        Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);
        Config loaded;
        try {
            loaded = ConfigLoader.resolve(configFile, (level, message) -> {
                switch (level) {
                    case INFO -> logger.debug(message);
                    case WARN -> logger.warn(message);
                }
            });
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        } catch (ConfigException e) {
            throw new ConfigurationException("Failed to load or parse configuration: " + e.getMessage(), e);
        }

        if (loaded.hasPath("logging.format")) {
            String format = loaded.getString("logging.format");
            String appender = "PLAIN".equalsIgnoreCase(format) ? "STDOUT_PLAIN" : "STDOUT";
            if (!appender.equals(System.getProperty(LOGGING_FORMAT_PROPERTY))) {
                System.setProperty(LOGGING_FORMAT_PROPERTY, appender);
                reconfigureLogback();
            }
        }
        try {
            LoggingConfigurator.configure(loaded);
        } catch (IllegalArgumentException | ConfigException e) {
            throw new ConfigurationException("Invalid logging configuration: " + e.getMessage(), e);
        }
        config = loaded;
        return config;
    }

    private void reconfigureLogback() {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        java.net.URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        try {
            JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            configurator.doConfigure(configUrl);
        } catch (Exception e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }
}
