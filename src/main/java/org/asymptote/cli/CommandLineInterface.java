package org.asymptote.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.asymptote.cli.commands.AnalyzeCommand;
import org.asymptote.cli.commands.TokensCommand;
import org.asymptote.cli.config.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "asymptote",
    mixinStandardHelpOptions = true,
    version = "Asymptote 1.0",
    description = "Asymptote - asymptotic complexity analysis of pseudocode",
    subcommands = {
        AnalyzeCommand.class,
        TokensCommand.class,
        CommandLine.HelpCommand.class
    },
    footer = {
        "",
        "Exit codes:",
        "  0  analysis completed (semantic findings are reported as diagnostics)",
        "  1  lexical, syntax or resource-budget failure",
        "  2  input file or configuration could not be read"
    }
)
public class CommandLineInterface implements Callable<Integer> {

    public static final int EXIT_OK = 0;
    public static final int EXIT_ANALYSIS_FAILED = 1;
    public static final int EXIT_IO_ERROR = 2;

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/asymptote.conf)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return EXIT_OK;
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
        commandLine.setCommandName("asymptote");
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        return commandLine;
    }

    /**
     * Loads the configuration on first use.
     *
     * @return the resolved configuration.
     * @throws IllegalArgumentException            if the configured file does not exist.
     * @throws com.typesafe.config.ConfigException if it cannot be parsed.
     */
    public Config getConfig() {
        if (config == null) {
            config = ConfigLoader.resolve(configFile, (level, message) -> {
                switch (level) {
                    case INFO -> LOG.debug(message);
                    case WARN -> LOG.warn(message);
                }
            });
            if (config.hasPath("asymptote.logging.format")) {
                final String format = config.getString("asymptote.logging.format");
                System.setProperty("asymptote.logging.format", "PLAIN".equalsIgnoreCase(format) ? "STDOUT_PLAIN" : "STDOUT");
                reconfigureLogback();
            }
        }
        return config;
    }

    private void reconfigureLogback() {
        try {
            ch.qos.logback.classic.LoggerContext context = (ch.qos.logback.classic.LoggerContext) LoggerFactory.getILoggerFactory();
            ch.qos.logback.classic.joran.JoranConfigurator configurator = new ch.qos.logback.classic.joran.JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            java.net.URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
            if (configUrl != null) {
                configurator.doConfigure(configUrl);
            }
        } catch (ch.qos.logback.core.joran.spi.JoranException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }
}
