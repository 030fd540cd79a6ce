package work.lcod.dispatch.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.dispatch.api.LogLevel;

/**
 * Applies a {@link LogLevel} to the Logback root logger.
 */
final class LogLevels {
    private LogLevels() {}

    static void apply(LogLevel level) {
        var root = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (root instanceof Logger logback) {
            logback.setLevel(toLogback(level));
        }
    }

    static Level toLogback(LogLevel level) {
        switch (level) {
            case TRACE:
                return Level.TRACE;
            case DEBUG:
                return Level.DEBUG;
            case INFO:
                return Level.INFO;
            case WARN:
                return Level.WARN;
            case ERROR:
                return Level.ERROR;
            default:
                return Level.OFF;
        }
    }
}
