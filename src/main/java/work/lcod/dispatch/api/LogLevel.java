package work.lcod.dispatch.api;

import java.util.Locale;

/**
 * Log thresholds accepted by the shell and configuration files.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    OFF;

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return WARN;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("FATAL".equals(normalized)) {
            return ERROR;
        }
        try {
            return LogLevel.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value);
        }
    }
}
