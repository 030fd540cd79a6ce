package work.lcod.dispatch.shared;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses user-friendly durations ({@code 100ms}, {@code 2s}, {@code 1m}, {@code 1h}). A bare number is
 * read as milliseconds.
 */
public final class DurationParser {
    private DurationParser() {}

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        long multiplier = 1L;
        String digits = trimmed;
        if (trimmed.endsWith("ms")) {
            digits = trimmed.substring(0, trimmed.length() - 2);
        } else if (trimmed.endsWith("s")) {
            digits = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 1_000L;
        } else if (trimmed.endsWith("m")) {
            digits = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 60_000L;
        } else if (trimmed.endsWith("h")) {
            digits = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 3_600_000L;
        }
        long value;
        try {
            value = Long.parseLong(digits.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid duration: " + raw, ex);
        }
        if (value < 0) {
            throw new IllegalArgumentException("Duration must not be negative: " + raw);
        }
        return Optional.of(Duration.ofMillis(Math.multiplyExact(value, multiplier)));
    }
}
