package org.spicenum.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the application configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** The configuration file picked up from the working directory when none is given explicitly. */
    public static final String CONFIG_FILE_NAME = "spicenum.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the application configuration, respecting the precedence order:
     * 1. CLI arguments as Java System Properties (e.g., -Dspicenum.output.format=JSON)
     * 2. Environment Variables
     * 3. Configuration File ({@code configFile}, or spicenum.conf in the working directory)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param configFile An explicitly requested configuration file, or {@code null}.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws com.typesafe.config.ConfigException if an explicit file is missing or any source is malformed.
     */
    public static Config load(final File configFile) {
        final Config fileConfig;
        if (configFile != null) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile, ConfigParseOptions.defaults().setAllowMissing(false));
        } else {
            final File cwdConfigFile = new File(CONFIG_FILE_NAME);
            if (cwdConfigFile.isFile()) {
                LOG.info("Loading configuration from file: {}", cwdConfigFile.getAbsolutePath());
                fileConfig = ConfigFactory.parseFile(cwdConfigFile);
            } else {
                LOG.debug("Configuration file '{}' not found. Using defaults from classpath.", CONFIG_FILE_NAME);
                fileConfig = ConfigFactory.empty();
            }
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }
}
