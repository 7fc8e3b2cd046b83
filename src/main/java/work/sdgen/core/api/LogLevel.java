package work.sdgen.core.api;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import java.util.Locale;
import org.slf4j.LoggerFactory;

/**
 * Log thresholds accepted by the runner and the CLI.
 */
public enum LogLevel {
    TRACE(Level.TRACE),
    DEBUG(Level.DEBUG),
    INFO(Level.INFO),
    WARN(Level.WARN),
    ERROR(Level.ERROR),
    FATAL(Level.ERROR);

    static final String BASE_LOGGER = "work.sdgen";

    private final Level logbackLevel;

    LogLevel(Level logbackLevel) {
        this.logbackLevel = logbackLevel;
    }

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return INFO;
        }
        try {
            return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value);
        }
    }

    public Level logbackLevel() {
        return logbackLevel;
    }

    /**
     * Applies this threshold to the root logger and to the {@code work.sdgen} loggers. A no-op when SLF4J is not
     * bound to Logback.
     */
    public void apply() {
        for (String name : new String[] {org.slf4j.Logger.ROOT_LOGGER_NAME, BASE_LOGGER}) {
            if (LoggerFactory.getLogger(name) instanceof Logger logger) {
                logger.setLevel(logbackLevel);
            }
        }
    }
}
