package work.cinit.trace.api;

import java.util.Locale;
import org.apache.logging.log4j.Level;

/**
 * Log thresholds accepted by the command line.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    FATAL;

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return WARN;
        }
        try {
            return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value);
        }
    }

    public Level toLog4j() {
        return Level.toLevel(name());
    }
}
