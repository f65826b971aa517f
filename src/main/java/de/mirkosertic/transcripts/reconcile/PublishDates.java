package de.mirkosertic.transcripts.reconcile;

import org.jspecify.annotations.Nullable;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Renders library publish times, which count seconds from 2001-01-01T00:00:00Z.
 */
public final class PublishDates {

    public static final String UNKNOWN_DATE = "UnknownDate";

    static final Instant REFERENCE_INSTANT = Instant.parse("2001-01-01T00:00:00Z");

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd");

    private PublishDates() {
    }

    /**
     * @return {@code YYYY-MM-DD}, or {@code UnknownDate} for null and out-of-range values
     */
    public static String format(final @Nullable Long publishTime) {
        if (publishTime == null) {
            return UNKNOWN_DATE;
        }
        try {
            final LocalDate date = REFERENCE_INSTANT.plusSeconds(publishTime).atZone(ZoneOffset.UTC).toLocalDate();
            if (date.getYear() < 1 || date.getYear() > 9999) {
                return UNKNOWN_DATE;
            }
            return DATE_FORMAT.format(date);
        } catch (final DateTimeException | ArithmeticException e) {
            return UNKNOWN_DATE;
        }
    }
}
