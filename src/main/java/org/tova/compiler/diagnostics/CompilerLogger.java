package org.tova.compiler.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logger of one compiler phase. Each instance writes to the SLF4J logger named after its owning
 * class, so {@code logging.levels} can target the lexer, the analyzer or a single backend.
 * On top of the Logback levels, a process-wide verbosity set by {@link #setVerbosity(int)}
 * caps what the compiler reports: 0=ERROR, 1=WARN, 2=INFO, 3=DEBUG, 4=TRACE.
 */
public final class CompilerLogger {

    public static final int ERROR = 0;
    public static final int WARN = 1;
    public static final int INFO = 2;
    public static final int DEBUG = 3;
    public static final int TRACE = 4;

    private static volatile int verbosity = INFO;

    private final Logger logger;

    private CompilerLogger(Logger logger) {
        this.logger = logger;
    }

    /**
     * @param owner The class whose name the messages are logged under.
     * @return A logger for that class.
     */
    public static CompilerLogger of(Class<?> owner) {
        return new CompilerLogger(LoggerFactory.getLogger(owner));
    }

    /**
     * Sets the verbosity shared by all compiler loggers.
     * @param level The new level, clamped to [ERROR, TRACE].
     */
    public static void setVerbosity(int level) {
        verbosity = Math.max(ERROR, Math.min(TRACE, level));
    }

    public static int getVerbosity() {
        return verbosity;
    }

    /**
     * @return The name of the underlying SLF4J logger.
     */
    public String name() {
        return logger.getName();
    }

    public void error(String format, Object... args) {
        if (verbosity >= ERROR) logger.error(format, args);
    }

    public void warn(String format, Object... args) {
        if (verbosity >= WARN) logger.warn(format, args);
    }

    public void info(String format, Object... args) {
        if (verbosity >= INFO) logger.info(format, args);
    }

    public void debug(String format, Object... args) {
        if (verbosity >= DEBUG && logger.isDebugEnabled()) logger.debug(format, args);
    }

    public void trace(String format, Object... args) {
        if (verbosity >= TRACE && logger.isTraceEnabled()) logger.trace(format, args);
    }
}
