package de.mirkosertic.transcripts.transcript;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses TTML time expressions and renders them as {@code HH:MM:SS}.
 * <p>
 * Supported forms are offset times ({@code 12.5}, {@code 12.5s}, {@code 250ms}, {@code 3m}, {@code 1h})
 * and clock times ({@code 01:02:03} or {@code 01:02:03.250}).
 */
public final class TimestampFormatter {

    static final String ZERO = "00:00:00";

    private static final Pattern OFFSET_TIME = Pattern.compile("(\\d+(?:\\.\\d+)?)(h|m|s|ms)?");
    private static final Pattern CLOCK_TIME = Pattern.compile("(\\d+):(\\d{1,2}):(\\d{1,2}(?:\\.\\d+)?)");

    private TimestampFormatter() {
    }

    /**
     * @return the parsed offset, or null if the expression is missing or not understood
     */
    public static @Nullable Duration parse(final @Nullable String expression) {
        if (expression == null || expression.isBlank()) {
            return null;
        }
        final String trimmed = expression.trim();

        try {
            final Matcher clock = CLOCK_TIME.matcher(trimmed);
            if (clock.matches()) {
                final long hours = Long.parseLong(clock.group(1));
                final long minutes = Long.parseLong(clock.group(2));
                final double seconds = Double.parseDouble(clock.group(3));
                return Duration.ofHours(hours)
                        .plusMinutes(minutes)
                        .plusMillis(Math.round(seconds * 1000));
            }

            final Matcher offset = OFFSET_TIME.matcher(trimmed);
            if (offset.matches()) {
                final double value = Double.parseDouble(offset.group(1));
                final String unit = offset.group(2) == null ? "s" : offset.group(2);
                final double millis = switch (unit) {
                    case "h" -> value * 3_600_000;
                    case "m" -> value * 60_000;
                    case "ms" -> value;
                    default -> value * 1000;
                };
                return Duration.ofMillis(Math.round(millis));
            }
        } catch (final NumberFormatException | ArithmeticException e) {
            return null;
        }
        return null;
    }

    /**
     * Render as {@code HH:MM:SS}, truncating fractional seconds. Null renders as {@code 00:00:00}.
     */
    public static String format(final @Nullable Duration timestamp) {
        if (timestamp == null || timestamp.isNegative()) {
            return ZERO;
        }
        return String.format(Locale.ROOT, "%02d:%02d:%02d",
                timestamp.toHours(), timestamp.toMinutesPart(), timestamp.toSecondsPart());
    }
}
