package work.marlowe.kernel.api;

import java.util.Locale;

/**
 * Log thresholds accepted by the CLI and {@code marlowe.toml}, mapped onto the SLF4J simple binding.
 */
public enum LogLevel {
    TRACE("trace"),
    DEBUG("debug"),
    INFO("info"),
    WARN("warn"),
    ERROR("error"),
    FATAL("off");

    /** System property read by {@code slf4j-simple} when its first logger is created. */
    public static final String SIMPLE_LOGGER_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";

    private final String simpleLoggerLevel;

    LogLevel(String simpleLoggerLevel) {
        this.simpleLoggerLevel = simpleLoggerLevel;
    }

    public String simpleLoggerLevel() {
        return simpleLoggerLevel;
    }

    /**
     * Selects this threshold for loggers created from now on. Has no effect on loggers that already exist.
     */
    public void install() {
        System.setProperty(SIMPLE_LOGGER_PROPERTY, simpleLoggerLevel);
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
