package org.simforge.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the compiler configuration from its layered sources.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    public static final String CONFIG_FILE_NAME = "simforge.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. Environment variables
     * 2. Java system properties ({@code -Dkey=value})
     * 3. {@code simforge.conf} in the working directory
     * 4. Default values from {@code reference.conf} on the classpath
     *
     * @return A resolved {@link Config} containing the merged configuration.
     */
    public static Config load() {
        return load(new File(CONFIG_FILE_NAME));
    }

    /**
     * Same as {@link #load()} with an explicit configuration file in place of {@code simforge.conf}.
     *
     * @param configFile The file layered between system properties and the defaults; skipped if it does not exist.
     */
    public static Config load(final File configFile) {
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config sysConfig = ConfigFactory.systemProperties();

        final Config fileConfig;
        if (configFile.exists() && !configFile.isDirectory()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("Configuration file '{}' not found or is a directory, using defaults.", configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        return envConfig
            .withFallback(sysConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }

    /**
     * Loads a configuration from a classpath resource, falling back to {@code reference.conf}.
     * Environment and system properties are not consulted.
     *
     * @param resource The classpath resource, e.g. {@code test-layout.conf}.
     */
    public static Config load(final String resource) {
        return ConfigFactory.parseResources(resource)
            .withFallback(ConfigFactory.parseResources("reference.conf"))
            .resolve();
    }
}
