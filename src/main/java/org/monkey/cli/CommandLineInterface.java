package org.monkey.cli;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.monkey.cli.commands.ParseCommand;
import org.monkey.cli.commands.ReplCommand;
import org.monkey.cli.commands.RunCommand;
import org.monkey.cli.commands.TokensCommand;
import org.monkey.cli.config.ConfigLoader;
import org.monkey.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.net.URL;
import java.util.Objects;
import java.util.concurrent.Callable;

@Command(
    name = "monkey",
    mixinStandardHelpOptions = true,
    version = "Monkey 1.0",
    description = "Monkey - lexer, parser and evaluator for a small expression language",
    subcommands = {
        ReplCommand.class,
        RunCommand.class,
        ParseCommand.class,
        TokensCommand.class,
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
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("monkey");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration and applies its logging settings on first use.
     * @return The resolved configuration.
     * @throws CommandLine.ParameterException if the configuration file is missing or malformed.
     */
    public Config getConfig() {
        if (config == null) {
            initialize();
        }
        return config;
    }

    private void initialize() {
        try {
            config = ConfigLoader.load(configFile);
        } catch (IllegalArgumentException | ConfigException e) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Failed to load configuration: " + e.getMessage(), e);
        }

        if (config.hasPath("logging.format")) {
            final String appender = LoggingConfigurator.appenderFor(config.getString("logging.format"));
            if (!Objects.equals(System.getProperty(LoggingConfigurator.FORMAT_PROPERTY, "STDERR_PLAIN"), appender)) {
                System.setProperty(LoggingConfigurator.FORMAT_PROPERTY, appender);
                reconfigureLogback();
            }
        }
        LoggingConfigurator.configure(config);
    }

    private void reconfigureLogback() {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        final URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        try {
            configurator.doConfigure(configUrl);
        } catch (JoranException e) {
            LOG.warn("Failed to reconfigure Logback: {}", e.getMessage());
        }
    }
}
