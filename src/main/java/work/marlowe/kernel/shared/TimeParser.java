package work.marlowe.kernel.shared;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses the time arguments accepted by the CLI and config: durations ({@code 30s}, {@code 2m}, {@code 24h},
 * {@code 7d}) and POSIX timestamps (epoch milliseconds or ISO-8601 instants).
 */
public final class TimeParser {
    private TimeParser() {}

    public static Optional<Duration> parseDuration(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        long multiplier = 1L;
        if (trimmed.endsWith("ms")) {
            trimmed = trimmed.substring(0, trimmed.length() - 2);
        } else if (trimmed.endsWith("s")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 1_000L;
        } else if (trimmed.endsWith("m")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 60_000L;
        } else if (trimmed.endsWith("h")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 3_600_000L;
        } else if (trimmed.endsWith("d")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 86_400_000L;
        }
        try {
            long value = Long.parseLong(trimmed.trim());
            if (value < 0) {
                throw new IllegalArgumentException("Duration must not be negative: " + raw);
            }
            return Optional.of(Duration.ofMillis(Math.multiplyExact(value, multiplier)));
        } catch (NumberFormatException | ArithmeticException ex) {
            throw new IllegalArgumentException("Invalid duration: " + raw, ex);
        }
    }

    /**
     * Reads a timestamp as milliseconds since the epoch.
     */
    public static BigInteger parseTimestamp(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Timestamp must not be blank");
        }
        String trimmed = raw.trim();
        if (trimmed.chars().allMatch(ch -> Character.isDigit(ch) || ch == '-')) {
            try {
                return new BigInteger(trimmed);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Invalid timestamp: " + raw, ex);
            }
        }
        try {
            return BigInteger.valueOf(Instant.parse(trimmed).toEpochMilli());
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Invalid timestamp: " + raw, ex);
        }
    }

    public static BigInteger toTimeout(Instant instant) {
        return BigInteger.valueOf(instant.toEpochMilli());
    }
}
