package org.loxlang.cli;

import java.io.File;
import java.net.URL;
import java.util.concurrent.Callable;

import org.loxlang.cli.commands.ReplCommand;
import org.loxlang.cli.commands.RunCommand;
import org.loxlang.cli.commands.TokensCommand;
import org.loxlang.cli.config.ConfigLoader;
import org.loxlang.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(
    name = "lox",
    mixinStandardHelpOptions = true,
    version = "Lox 1.0",
    description = "Scanner, parser, resolver and tree-walking interpreter for the Lox language",
    exitCodeOnInvalidInput = 64,
    subcommands = {
        RunCommand.class,
        ReplCommand.class,
        TokensCommand.class,
        CommandLine.HelpCommand.class
    },
    footer = {
        "",
        "Exit codes: 0 success, 64 usage error, 65 lexical/syntax/resolution error,",
        "            66 unreadable script, 70 runtime error"
    }
)
public class CommandLineInterface implements Callable<Integer> {

    static final String LOGGING_FORMAT_PROPERTY = "lox.logging.format";

    @Option(
        names = {"--config"},
        description = "Path to a configuration file (default: config/lox.conf)"
    )
    private File configFile;

    @Spec
    private CommandSpec spec;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // Without a subcommand there is nothing to run.
        spec.commandLine().usage(spec.commandLine().getOut());
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
        commandLine.setCommandName("lox");
        return commandLine;
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        try {
            this.config = ConfigLoader.resolve(this.configFile, (level, message) -> {
                switch (level) {
                    case INFO -> logger.debug(message);
                    case WARN -> logger.warn(message);
                }
            });
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
        } catch (ConfigException e) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Failed to load or parse configuration: " + e.getMessage(), e);
        }

        if (config.hasPath("logging.format")) {
            final String format = config.getString("logging.format");
            System.setProperty(LOGGING_FORMAT_PROPERTY, "COLOR".equalsIgnoreCase(format) ? "STDERR_COLOR" : "STDERR_PLAIN");
            reconfigureLogback();
        }
        LoggingConfigurator.configure(config);

        initialized = true;
    }

    private void reconfigureLogback() {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        final URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        try {
            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            configurator.doConfigure(configUrl);
        } catch (JoranException e) {
            spec.commandLine().getErr().println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }

    /**
     * Gets the resolved configuration, loading it and applying its logging settings on first use.
     *
     * @return The application configuration.
     * @throws CommandLine.ParameterException if the configuration file is missing or invalid.
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
