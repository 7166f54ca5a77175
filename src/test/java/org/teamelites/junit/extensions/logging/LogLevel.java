package org.teamelites.junit.extensions.logging;

import ch.qos.logback.classic.Level;

/**
 * Log levels watched by {@link LogWatchExtension}.
 */
public enum LogLevel {
    WARN(Level.WARN),
    ERROR(Level.ERROR);

    private final Level logbackLevel;

    LogLevel(Level logbackLevel) {
        this.logbackLevel = logbackLevel;
    }

    Level toLogback() {
        return logbackLevel;
    }
}
