package org.g10asm.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link LoggingConfigurator}. Logger levels are restored after each test.
 */
public class LoggingConfiguratorTest {

    private static final String TEST_LOGGER = "org.g10asm.test.logging";

    private LoggerContext context;
    private Level rootLevel;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        context = (LoggerContext) LoggerFactory.getILoggerFactory();
        rootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
    }

    @AfterEach
    void tearDown() {
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
        context.getLogger(TEST_LOGGER).setLevel(null);
        System.clearProperty(LoggingConfigurator.FORMAT_PROPERTY);
        LoggingConfigurator.reset();
    }

    /**
     * Verifies that the default level and specific levels are applied.
     */
    @Test
    @Tag("unit")
    void testLevelsAreApplied() {
        // Arrange
        Config config = ConfigFactory.parseString(
                "logging { default-level = \"ERROR\", levels { \"" + TEST_LOGGER + "\" = \"DEBUG\" } }");

        // Act
        LoggingConfigurator.configure(config);

        // Assert
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
        assertThat(context.getLogger(TEST_LOGGER).getLevel()).isEqualTo(Level.DEBUG);
    }

    /**
     * Verifies that a second call has no effect until the state is reset.
     */
    @Test
    @Tag("unit")
    void testConfigureIsIdempotent() {
        // Arrange
        LoggingConfigurator.configure(ConfigFactory.parseString(
                "logging.levels { \"" + TEST_LOGGER + "\" = \"INFO\" }"));

        // Act
        LoggingConfigurator.configure(ConfigFactory.parseString(
                "logging.levels { \"" + TEST_LOGGER + "\" = \"TRACE\" }"));

        // Assert
        assertThat(context.getLogger(TEST_LOGGER).getLevel()).isEqualTo(Level.INFO);
    }

    /**
     * Verifies that an unknown level name is ignored.
     */
    @Test
    @Tag("unit")
    void testUnknownLevelIsIgnored() {
        // Arrange
        Config config = ConfigFactory.parseString("logging.levels { \"" + TEST_LOGGER + "\" = \"LOUD\" }");

        // Act
        LoggingConfigurator.configure(config);

        // Assert
        assertThat(context.getLogger(TEST_LOGGER).getLevel()).isNull();
    }

    /**
     * Verifies that the plain format selects the plain appender.
     */
    @Test
    @Tag("unit")
    void testPlainFormat() {
        // Arrange
        Config config = ConfigFactory.parseString("logging.format = \"PLAIN\"");

        // Act
        LoggingConfigurator.configure(config);

        // Assert
        assertThat(System.getProperty(LoggingConfigurator.FORMAT_PROPERTY)).isEqualTo("STDERR_PLAIN");
        assertThat(context.getProperty(LoggingConfigurator.FORMAT_PROPERTY)).isEqualTo("STDERR_PLAIN");
    }

    /**
     * Verifies that a single logger level can be set directly.
     */
    @Test
    @Tag("unit")
    void testSetLevel() {
        // Act
        LoggingConfigurator.setLevel(TEST_LOGGER, "TRACE");

        // Assert
        assertThat(context.getLogger(TEST_LOGGER).getLevel()).isEqualTo(Level.TRACE);
    }
}
