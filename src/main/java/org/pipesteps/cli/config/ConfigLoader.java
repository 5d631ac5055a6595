package org.pipesteps.cli.config;

import java.io.File;
import java.util.function.BiConsumer;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Loads the pipe-steps configuration.
 * <p>
 * Layers, highest precedence first:
 * <ol>
 *   <li>Java system properties ({@code -Dpipeline.batchSize=50})</li>
 *   <li>Environment variables</li>
 *   <li>The user configuration file, if one is found</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 * The reference configuration is merged unresolved so that substitutions in it see user overrides.
 */
public final class ConfigLoader {

    static final String CONFIG_DIR = "config";
    static final String CONFIG_FILE_NAME = "pipe-steps.conf";

    private ConfigLoader() {
    }

    /** Severity of a resolution message. */
    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Finds the user configuration file and loads the layered configuration.
     * <p>
     * The file is taken from, in order: the {@code --config} option, the {@code -Dconfig.file}
     * system property, {@code config/pipe-steps.conf} in the working directory. Without any of
     * them only the classpath defaults are used.
     *
     * @param explicitConfigFile file from the command line, or {@code null}
     * @param handler receives one message describing which source was chosen
     * @return the resolved configuration
     * @throws IllegalArgumentException if an explicitly named file does not exist
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed or resolved
     */
    public static Config resolve(File explicitConfigFile, BiConsumer<MessageLevel, String> handler) {
        if (explicitConfigFile != null) {
            if (!explicitConfigFile.isFile()) {
                throw new IllegalArgumentException("Configuration file not found: " + explicitConfigFile.getAbsolutePath());
            }
            handler.accept(MessageLevel.INFO, "Using configuration file " + explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.isFile()) {
                throw new IllegalArgumentException(
                    "Configuration file specified via -Dconfig.file not found: " + systemConfigFile);
            }
            handler.accept(MessageLevel.INFO, "Using configuration file from -Dconfig.file: " + systemConfigFile);
            return loadFromFile(systemConfigFile);
        }

        File cwdConfigFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (cwdConfigFile.isFile()) {
            handler.accept(MessageLevel.INFO, "Using configuration file " + cwdConfigFile.getAbsolutePath());
            return loadFromFile(cwdConfigFile);
        }

        handler.accept(MessageLevel.WARN,
            "No " + CONFIG_DIR + "/" + CONFIG_FILE_NAME + " found, using built-in defaults");
        return loadDefaults();
    }

    static Config loadFromFile(File configFile) {
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
