package org.asymptote.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.security.CodeSource;
import java.security.ProtectionDomain;

/**
 * Loads the application configuration for the CLI.
 * <p>
 * Layers, from highest to lowest precedence:
 * <ol>
 *   <li>Java system properties ({@code -Dasymptote.analysis.budget.max-depth=32})</li>
 *   <li>Environment variables</li>
 *   <li>The user configuration file, found by {@link #resolve(File, ConfigMessageHandler)}</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 * Substitutions are resolved once, after all layers are merged, so a user override of a
 * referenced value reaches every place that refers to it.
 */
public final class ConfigLoader {

    private static final String CONFIG_DIR = "config";
    private static final String CONFIG_FILE_NAME = "asymptote.conf";

    private ConfigLoader() {
    }

    /**
     * Severity of a resolution message.
     */
    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives progress messages while the configuration file is located.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {

        /**
         * @param level   the severity of the message.
         * @param message the human-readable description.
         */
        void log(MessageLevel level, String message);
    }

    /**
     * Locates the configuration file and loads it. The first match wins:
     * <ol>
     *   <li>the file passed with {@code --config};</li>
     *   <li>the file named by {@code -Dconfig.file};</li>
     *   <li>{@code config/asymptote.conf} in the working directory;</li>
     *   <li>{@code APP_HOME/config/asymptote.conf} next to the {@code lib} directory of the running jar;</li>
     *   <li>none: classpath defaults only.</li>
     * </ol>
     *
     * @param explicitConfigFile config file from the CLI option, or {@code null} for discovery.
     * @param handler            callback for resolution messages.
     * @return the resolved configuration.
     * @throws IllegalArgumentException            if an explicitly named file does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed or resolved.
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            if (!explicitConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file not found: " + explicitConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO,
                    "Using configuration file specified via --config: " + explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file specified via -Dconfig.file not found: " + systemConfigFile);
            }
            handler.log(MessageLevel.INFO, "Using configuration file specified via -Dconfig.file: " + systemConfigFile);
            return loadFromFile(systemConfigFile);
        }

        final File cwdConfigFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (cwdConfigFile.exists()) {
            handler.log(MessageLevel.INFO,
                    "Using configuration file found in current directory: " + cwdConfigFile.getAbsolutePath());
            return loadFromFile(cwdConfigFile);
        }

        final File installationConfigFile = detectInstallationConfigFile();
        if (installationConfigFile != null) {
            handler.log(MessageLevel.INFO,
                    "Using configuration file from installation directory: " + installationConfigFile.getAbsolutePath());
            return loadFromFile(installationConfigFile);
        }

        handler.log(MessageLevel.INFO, "No '" + CONFIG_DIR + "/" + CONFIG_FILE_NAME
                + "' found, using default configuration from classpath.");
        return loadDefaults();
    }

    /**
     * Loads a configuration file merged with system properties, environment and classpath defaults.
     */
    static Config loadFromFile(final File configFile) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.parseFile(configFile))
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    /**
     * Loads system properties, environment and classpath defaults, without a user file.
     */
    static Config loadDefaults() {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    /**
     * Infers {@code APP_HOME} from the jar location ({@code APP_HOME/lib/asymptote.jar}).
     *
     * @return {@code APP_HOME/config/asymptote.conf}, or {@code null} if it cannot be determined or does not exist.
     */
    private static File detectInstallationConfigFile() {
        final ProtectionDomain protectionDomain = ConfigLoader.class.getProtectionDomain();
        final CodeSource codeSource = protectionDomain != null ? protectionDomain.getCodeSource() : null;
        if (codeSource == null || codeSource.getLocation() == null) {
            return null;
        }
        final URL location = codeSource.getLocation();
        final File jarOrClasses;
        try {
            jarOrClasses = new File(location.toURI());
        } catch (URISyntaxException | IllegalArgumentException e) {
            // Not a file location (e.g. a nested jar); discovery falls through to classpath defaults.
            return null;
        }
        if (!jarOrClasses.isFile() || jarOrClasses.getParentFile() == null) {
            return null;
        }
        final File appHome = jarOrClasses.getParentFile().getParentFile();
        if (appHome == null) {
            return null;
        }
        final File configFile = new File(new File(appHome, CONFIG_DIR), CONFIG_FILE_NAME);
        return configFile.exists() ? configFile : null;
    }
}
