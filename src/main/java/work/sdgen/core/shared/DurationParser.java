package work.sdgen.core.shared;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses poll intervals and timeouts written as {@code 500ms}, {@code 2s}, {@code 1.5m} or {@code 1h}.
 * A bare number is read as milliseconds.
 */
public final class DurationParser {
    private static final Pattern FORMAT = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*(ms|s|m|h)?");

    private DurationParser() {}

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        var matcher = FORMAT.matcher(raw.trim().toLowerCase(Locale.ROOT));
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Unsupported duration: " + raw);
        }
        double amount = Double.parseDouble(matcher.group(1));
        String unit = matcher.group(2) == null ? "ms" : matcher.group(2);
        double millis = switch (unit) {
            case "s" -> amount * 1_000d;
            case "m" -> amount * 60_000d;
            case "h" -> amount * 3_600_000d;
            default -> amount;
        };
        return Optional.of(Duration.ofMillis(Math.round(millis)));
    }

    public static String format(Duration duration) {
        long millis = duration.toMillis();
        if (millis % 3_600_000L == 0 && millis > 0) {
            return millis / 3_600_000L + "h";
        }
        if (millis % 60_000L == 0 && millis > 0) {
            return millis / 60_000L + "m";
        }
        if (millis % 1_000L == 0 && millis > 0) {
            return millis / 1_000L + "s";
        }
        return millis + "ms";
    }
}
