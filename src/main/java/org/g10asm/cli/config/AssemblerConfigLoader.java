package org.g10asm.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileNotFoundException;

/**
 * Loads the assembler configuration.
 * <p>
 * Load order: System Props &gt; Env Vars &gt; File &gt; Classpath defaults. The file is the one given
 * with <code>--config</code>, or <code>g10asm.conf</code> in the working directory if it exists.
 */
public final class AssemblerConfigLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(AssemblerConfigLoader.class);
    public static final String CONFIG_FILE_NAME = "g10asm.conf";

    private AssemblerConfigLoader() {}

    /**
     * @param configFile An explicit configuration file, or {@code null}.
     * @return The resolved configuration.
     * @throws FileNotFoundException if an explicit file was given but does not exist.
     * @throws com.typesafe.config.ConfigException if a file cannot be parsed or resolved.
     */
    public static Config load(final File configFile) throws FileNotFoundException {
        return load(configFile, new File(CONFIG_FILE_NAME));
    }

    /**
     * Variant with an explicit default file location.
     * @param configFile An explicit configuration file, or {@code null}.
     * @param defaultFile The file used when no explicit file is given; ignored if it does not exist.
     * @return The resolved configuration.
     * @throws FileNotFoundException if an explicit file was given but does not exist.
     */
    static Config load(final File configFile, final File defaultFile) throws FileNotFoundException {
        Config fileConfig = ConfigFactory.empty();
        if (configFile != null) {
            if (!configFile.exists()) {
                throw new FileNotFoundException("Configuration file specified via --config was not found: "
                        + configFile.getAbsolutePath());
            }
            LOGGER.debug("Using configuration file specified via --config: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else if (defaultFile.exists()) {
            LOGGER.debug("Using configuration file found in current directory: {}", defaultFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(defaultFile);
        } else {
            LOGGER.debug("No '{}' found. Using default configuration from classpath.", CONFIG_FILE_NAME);
        }

        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.load())
                .resolve();
    }
}
