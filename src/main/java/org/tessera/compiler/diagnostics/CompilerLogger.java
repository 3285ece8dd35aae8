package org.tessera.compiler.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Minimal compiler-internal logger with integer verbosity levels.
 * Levels: 0=ERROR, 1=WARN, 2=INFO, 3=DEBUG, 4=TRACE
 * Messages above the configured verbosity are dropped before they reach SLF4J; the
 * Logback level of {@code org.tessera.compiler} still applies on top.
 */
public final class CompilerLogger {

    /** Lowest verbosity. */
    public static final int ERROR = 0;
    /** Verbosity at which debug messages are emitted. */
    public static final int DEBUG = 3;
    /** Highest verbosity. */
    public static final int TRACE = 4;
    private static volatile int level = 2;

    private static final Logger logger = LoggerFactory.getLogger(CompilerLogger.class);

    private CompilerLogger() {}

    /**
     * Sets the logging verbosity level. Out-of-range values are clamped.
     * @param newLevel The new level to set.
     */
    public static void setLevel(int newLevel) { level = Math.max(ERROR, Math.min(TRACE, newLevel)); }

    /**
     * @return The current verbosity level.
     */
    public static int getLevel() { return level; }

    /**
     * Logs a debug message.
     * @param msg The message to log.
     */
    public static void debug(String msg) {
        if (level >= DEBUG) logger.debug(msg);
    }
}
