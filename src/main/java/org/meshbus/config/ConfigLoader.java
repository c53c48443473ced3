package org.meshbus.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the mesh configuration from layered sources.
 * <p>
 * Precedence, highest first:
 * <ol>
 *   <li>Java system properties ({@code -Dmeshbus.buses.llm.callTimeout=10s})</li>
 *   <li>Environment overrides ({@code CONFIG_FORCE_meshbus_buses_llm_callTimeout=10s})</li>
 *   <li>The configuration file ({@value #CONFIG_FILE_NAME} in the working directory by default)</li>
 *   <li>Defaults from {@code reference.conf} on the classpath</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    public static final String CONFIG_FILE_NAME = "meshbus.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration using {@value #CONFIG_FILE_NAME} from the working directory.
     */
    public static Config load() {
        return load(CONFIG_FILE_NAME);
    }

    /**
     * Loads the configuration using the given file. The location is tried as a filesystem
     * path first and as a classpath resource second. A missing or empty file is not an error.
     *
     * @param configLocation Path or classpath resource of the configuration file.
     * @return The merged and resolved configuration.
     */
    public static Config load(String configLocation) {
        final Config systemConfig = ConfigFactory.systemProperties();
        final Config envConfig = ConfigFactory.systemEnvironmentOverrides();
        final Config fileConfig = loadFile(configLocation);
        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        return systemConfig
            .withFallback(envConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }

    private static Config loadFile(String configLocation) {
        final File configFile = new File(configLocation);
        final Config fileConfig;
        if (configFile.isFile()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            fileConfig = ConfigFactory.parseResources(configLocation);
            if (!fileConfig.isEmpty()) {
                LOG.info("Loading configuration from classpath resource: {}", configLocation);
            }
        }
        if (fileConfig.isEmpty()) {
            LOG.warn("Configuration file '{}' not found or is empty. Using defaults.", configLocation);
        }
        return fileConfig;
    }
}
