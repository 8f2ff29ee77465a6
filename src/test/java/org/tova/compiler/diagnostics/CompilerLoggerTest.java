package org.tova.compiler.diagnostics;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.tova.compiler.backend.targets.ServerCodegen;
import org.tova.compiler.frontend.semantics.SemanticAnalyzer;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the per-class compiler loggers and the shared verbosity cap.
 */
public class CompilerLoggerTest {

    private static final String BACKEND = "org.tova.compiler.backend";
    private static final String FRONTEND = "org.tova.compiler.frontend";

    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
    private int verbosity;

    @BeforeEach
    void setUp() {
        verbosity = CompilerLogger.getVerbosity();
        appender.start();
        logger(BACKEND).addAppender(appender);
        logger(FRONTEND).addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        CompilerLogger.setVerbosity(verbosity);
        for (String name : new String[] {BACKEND, FRONTEND}) {
            logger(name).detachAppender(appender);
            logger(name).setLevel(null);
        }
    }

    private static Logger logger(String name) {
        return ((LoggerContext) LoggerFactory.getILoggerFactory()).getLogger(name);
    }

    @Test
    @Tag("unit")
    void testMessagesUseTheOwnerClassLogger() {
        // Arrange
        CompilerLogger.setVerbosity(CompilerLogger.DEBUG);
        logger(BACKEND).setLevel(Level.DEBUG);

        // Act
        CompilerLogger.of(ServerCodegen.class).debug("Server target: {} route(s)", 2);

        // Assert
        assertThat(appender.list).singleElement().satisfies(event -> {
            assertThat(event.getLoggerName()).isEqualTo(ServerCodegen.class.getName());
            assertThat(event.getFormattedMessage()).isEqualTo("Server target: 2 route(s)");
        });
    }

    @Test
    @Tag("unit")
    void testPackageLevelsApplyPerPhase() {
        // Arrange
        CompilerLogger.setVerbosity(CompilerLogger.DEBUG);
        logger(BACKEND).setLevel(Level.WARN);
        logger(FRONTEND).setLevel(Level.DEBUG);

        // Act
        CompilerLogger.of(ServerCodegen.class).debug("hidden");
        CompilerLogger.of(SemanticAnalyzer.class).debug("shown");

        // Assert
        assertThat(appender.list).extracting(ILoggingEvent::getFormattedMessage).containsExactly("shown");
    }

    @Test
    @Tag("unit")
    void testVerbosityCapsOutputAndIsClamped() {
        // Arrange
        logger(BACKEND).setLevel(Level.TRACE);
        CompilerLogger.setVerbosity(CompilerLogger.WARN);

        // Act
        CompilerLogger log = CompilerLogger.of(ServerCodegen.class);
        log.info("dropped");
        log.warn("kept");

        // Assert
        assertThat(appender.list).extracting(ILoggingEvent::getFormattedMessage).containsExactly("kept");
        CompilerLogger.setVerbosity(42);
        assertThat(CompilerLogger.getVerbosity()).isEqualTo(CompilerLogger.TRACE);
        CompilerLogger.setVerbosity(-3);
        assertThat(CompilerLogger.getVerbosity()).isEqualTo(CompilerLogger.ERROR);
    }
}
