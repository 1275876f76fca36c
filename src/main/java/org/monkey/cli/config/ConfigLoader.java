package org.monkey.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the application configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** Name of the configuration file looked up in the working directory. */
    public static final String CONFIG_FILE_NAME = "monkey.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration using {@value #CONFIG_FILE_NAME} from the working directory, if present.
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load() {
        return load(null);
    }

    /**
     * Loads the application configuration, respecting the precedence order:
     * 1. Java System Properties (e.g., -Dmonkey.repl.prompt="> ")
     * 2. Environment Variables
     * 3. Configuration File (the given one, otherwise monkey.conf in the working directory)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param configFile An explicit configuration file, or null to look in the working directory.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws IllegalArgumentException if an explicit file was given but does not exist.
     */
    public static Config load(final File configFile) {
        final Config fileConfig;
        if (configFile != null) {
            if (!configFile.isFile()) {
                throw new IllegalArgumentException("Configuration file not found: " + configFile.getAbsolutePath());
            }
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            final File cwdConfigFile = new File(CONFIG_FILE_NAME);
            if (cwdConfigFile.isFile()) {
                LOG.info("Loading configuration from file: {}", cwdConfigFile.getAbsolutePath());
                fileConfig = ConfigFactory.parseFile(cwdConfigFile);
            } else {
                LOG.debug("Configuration file '{}' not found. Using defaults.", cwdConfigFile.getPath());
                fileConfig = ConfigFactory.empty();
            }
        }

        // Chain the configs together. The one provided first wins.
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.parseResources("reference.conf"))
                .resolve();
    }
}
