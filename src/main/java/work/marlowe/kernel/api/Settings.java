package work.marlowe.kernel.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseResult;
import work.marlowe.kernel.shared.TimeParser;

/**
 * Defaults read from {@code marlowe.toml}:
 *
 * <pre>
 * [interpreter]
 * max_steps = 10000
 *
 * [advisor]
 * window = "24h"
 *
 * [log]
 * level = "info"
 * </pre>
 */
public record Settings(long maxSteps, Duration window, LogLevel logLevel) {
    public static final String FILE_NAME = "marlowe.toml";
    public static final Settings DEFAULT = new Settings(0L, Duration.ofHours(24), LogLevel.WARN);

    public Settings {
        Objects.requireNonNull(window, "window");
        Objects.requireNonNull(logLevel, "logLevel");
    }

    /**
     * Reads {@code path}; a missing or unreadable file yields {@link #DEFAULT}. Nothing is logged unless the file is
     * rejected, so callers can still pick the log level from the result.
     */
    public static Settings load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            return DEFAULT;
        }
        try {
            TomlParseResult result = Toml.parse(Files.readString(path));
            if (result.hasErrors()) {
                log().warn("Ignoring {}: {}", path, result.errors().get(0).toString());
                return DEFAULT;
            }
            return fromToml(result);
        } catch (IOException | IllegalArgumentException | TomlInvalidTypeException ex) {
            log().warn("Ignoring {}: {}", path, ex.getMessage());
            return DEFAULT;
        }
    }

    public static Settings fromToml(TomlParseResult result) {
        long maxSteps = DEFAULT.maxSteps();
        Long configured = result.getLong("interpreter.max_steps");
        if (configured != null) {
            maxSteps = configured;
        }
        Duration window = TimeParser.parseDuration(result.getString("advisor.window")).orElse(DEFAULT.window());
        String level = result.getString("log.level");
        LogLevel logLevel = level == null ? DEFAULT.logLevel() : LogLevel.from(level);
        return new Settings(maxSteps, window, logLevel);
    }

    private static Logger log() {
        return LoggerFactory.getLogger(Settings.class);
    }
}
