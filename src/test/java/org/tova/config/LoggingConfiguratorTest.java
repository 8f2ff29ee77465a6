package org.tova.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for applying the {@code logging} section to Logback.
 */
public class LoggingConfiguratorTest {

    private LoggerContext context;
    private Level rootLevel;

    @BeforeEach
    void setUp() {
        context = (LoggerContext) LoggerFactory.getILoggerFactory();
        rootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
        LoggingConfigurator.reset();
    }

    @AfterEach
    void tearDown() {
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
        context.getLogger("org.tova.sample").setLevel(null);
        LoggingConfigurator.reset();
    }

    @Test
    @Tag("unit")
    void testLevelsAreApplied() {
        // Arrange
        Config config = ConfigFactory.parseString(
                "logging { default-level = \"ERROR\", levels { \"org.tova.sample\" = \"DEBUG\" } }");

        // Act
        LoggingConfigurator.configure(config);

        // Assert
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
        assertThat(context.getLogger("org.tova.sample").getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    @Tag("unit")
    void testSecondCallIsIgnoredUntilReset() {
        // Arrange
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.tova.sample\" = \"DEBUG\" }"));

        // Act
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.tova.sample\" = \"ERROR\" }"));

        // Assert
        assertThat(context.getLogger("org.tova.sample").getLevel()).isEqualTo(Level.DEBUG);

        // Act
        LoggingConfigurator.reset();
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.tova.sample\" = \"ERROR\" }"));

        // Assert
        assertThat(context.getLogger("org.tova.sample").getLevel()).isEqualTo(Level.ERROR);
    }
}
