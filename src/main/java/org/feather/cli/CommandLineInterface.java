package org.feather.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.feather.cli.commands.TokenizeCommand;
import org.feather.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "feather",
    mixinStandardHelpOptions = true,
    version = "Feather 1.0",
    description = "Feather - lexical front end of the Feather language",
    subcommands = {
        TokenizeCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final String CONFIG_FILE_NAME = "feather.conf";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: feather.conf)"
    )
    private File configFile;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("feather");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        try {
            final File fileToLoad = resolveConfigFile(logger);
            // Config load order: System Props > Env Vars > File > Classpath defaults
            Config fallback = ConfigFactory.load();
            if (fileToLoad != null) {
                fallback = ConfigFactory.parseFile(fileToLoad).withFallback(fallback);
            }
            this.config = ConfigFactory.systemProperties()
                    .withFallback(ConfigFactory.systemEnvironment())
                    .withFallback(fallback)
                    .resolve();
        } catch (ConfigException e) {
            logger.error("Failed to load or parse configuration: {}", e.getMessage());
            System.exit(1);
        }

        LoggingConfigurator.configure(config);
        initialized = true;
    }

    /**
     * Picks the configuration file: {@code --config}, then {@code -Dconfig.file}, then
     * {@code feather.conf} in the working directory. Returns {@code null} when only the
     * classpath defaults apply.
     */
    private File resolveConfigFile(final Logger logger) {
        if (this.configFile != null) {
            if (!this.configFile.exists()) {
                logger.error("Configuration file specified via --config was not found: {}", this.configFile.getAbsolutePath());
                System.exit(1);
            }
            logger.info("Using configuration file specified via --config: {}", this.configFile.getAbsolutePath());
            return this.configFile;
        }

        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                logger.error("Configuration file specified via -Dconfig.file was not found: {}", systemConfigFile.getAbsolutePath());
                System.exit(1);
            }
            logger.info("Using configuration file specified via -Dconfig.file: {}", systemConfigFile.getAbsolutePath());
            return systemConfigFile;
        }

        final File cwdConfigFile = new File(CONFIG_FILE_NAME);
        if (cwdConfigFile.exists()) {
            logger.info("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
            return cwdConfigFile;
        }

        logger.debug("No '{}' found in current directory. Using default configuration from classpath.", CONFIG_FILE_NAME);
        return null;
    }

    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
