package org.pointerviz.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;

/**
 * Configuration loader for the command line.
 * <p>
 * Composes HOCON configuration from multiple sources with the following precedence
 * (highest to lowest):
 * <ol>
 *   <li>Java system properties ({@code -Dkey=value})</li>
 *   <li>Environment variables</li>
 *   <li>User configuration file ({@code config/pointerviz.conf} or a file given with {@code --config})</li>
 *   <li>Default reference configuration ({@code reference.conf} on the classpath)</li>
 * </ol>
 * Substitutions are resolved only after all layers are composed, so a user override of a value that
 * {@code reference.conf} refers to reaches every place that refers to it.
 *
 * @see #resolve(File, ConfigMessageHandler)
 */
public final class ConfigLoader {

    static final String CONFIG_DIR = "config";
    static final String CONFIG_FILE_NAME = "pointerviz.conf";

    private ConfigLoader() {
    }

    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives progress messages while the configuration file is being located.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {

        void log(MessageLevel level, String message);
    }

    /**
     * Resolves configuration using this discovery cascade:
     * <ol>
     *   <li>the file passed via {@code --config}</li>
     *   <li>the file named by {@code -Dconfig.file}</li>
     *   <li>{@code config/pointerviz.conf} relative to the working directory</li>
     *   <li>classpath defaults only</li>
     * </ol>
     *
     * @param explicitConfigFile config file from the CLI option, or {@code null} for discovery.
     * @param handler            callback for resolution progress messages.
     * @return the resolved configuration.
     * @throws IllegalArgumentException            if an explicitly named file does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed or resolved.
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        return resolve(explicitConfigFile, new File(CONFIG_DIR, CONFIG_FILE_NAME), handler);
    }

    static Config resolve(final File explicitConfigFile, final File workingDirConfigFile,
                          final ConfigMessageHandler handler) {
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
                        "Configuration file specified via -Dconfig.file not found: "
                                + systemConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO,
                    "Using configuration file specified via -Dconfig.file: " + systemConfigFile.getAbsolutePath());
            return loadFromFile(systemConfigFile);
        }

        if (workingDirConfigFile.exists()) {
            handler.log(MessageLevel.INFO,
                    "Using configuration file found in current directory: " + workingDirConfigFile.getAbsolutePath());
            return loadFromFile(workingDirConfigFile);
        }

        handler.log(MessageLevel.INFO,
                "No '" + CONFIG_DIR + "/" + CONFIG_FILE_NAME + "' found. Using default configuration from classpath.");
        return loadDefaults();
    }

    /**
     * Loads a configuration file merged with classpath defaults.
     */
    static Config loadFromFile(final File configFile) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.parseFile(configFile))
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    static Config loadDefaults() {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }
}
