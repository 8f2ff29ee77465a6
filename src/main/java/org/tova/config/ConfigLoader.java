package org.tova.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the compiler configuration from its sources.
 * The precedence order, highest first:
 * <ol>
 *   <li>Environment variables</li>
 *   <li>Java system properties ({@code -Dtova.compiler.strict=true})</li>
 *   <li>The configuration file ({@code tova.conf} in the working directory, or the file given)</li>
 *   <li>Defaults from {@code reference.conf} on the classpath</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** Name of the configuration file looked up in the working directory. */
    public static final String CONFIG_FILE_NAME = "tova.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration using {@code tova.conf} from the working directory, if present.
     * @return The resolved configuration.
     */
    public static Config load() {
        return load(null);
    }

    /**
     * Loads the configuration.
     * @param configFile An explicit configuration file, or {@code null} to look for {@value #CONFIG_FILE_NAME}.
     * @return The resolved configuration.
     * @throws IllegalArgumentException if an explicit file does not exist.
     */
    public static Config load(File configFile) {
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config propertyConfig = ConfigFactory.systemProperties();
        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");
        return envConfig
                .withFallback(propertyConfig)
                .withFallback(fileConfig(configFile))
                .withFallback(defaultConfig)
                .resolve();
    }

    private static Config fileConfig(File explicit) {
        if (explicit != null) {
            if (!explicit.isFile()) {
                throw new IllegalArgumentException("Configuration file not found: " + explicit.getAbsolutePath());
            }
            LOG.info("Loading configuration from file: {}", explicit.getAbsolutePath());
            return ConfigFactory.parseFile(explicit);
        }
        final File configFile = new File(CONFIG_FILE_NAME);
        if (configFile.isFile()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            return ConfigFactory.parseFile(configFile);
        }
        LOG.debug("Configuration file '{}' not found. Using defaults.", configFile.getPath());
        return ConfigFactory.empty();
    }
}
