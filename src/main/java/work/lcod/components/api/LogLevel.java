package work.lcod.components.api;

import java.util.Locale;

/**
 * Runtime log thresholds accepted on the command line.
 */
public enum LogLevel {
    TRACE("trace"),
    DEBUG("debug"),
    INFO("info"),
    WARN("warn"),
    ERROR("error"),
    FATAL("error");

    static final String SIMPLE_LOGGER_LEVEL = "org.slf4j.simpleLogger.defaultLogLevel";

    private final String slf4jLevel;

    LogLevel(String slf4jLevel) {
        this.slf4jLevel = slf4jLevel;
    }

    public String slf4jLevel() {
        return slf4jLevel;
    }

    /**
     * Must run before the first logger is created; the simple binding reads its level once.
     */
    public void apply() {
        System.setProperty(SIMPLE_LOGGER_LEVEL, slf4jLevel);
    }

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
}
