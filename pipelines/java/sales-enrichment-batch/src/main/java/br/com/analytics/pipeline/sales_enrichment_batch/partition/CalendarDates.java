package br.com.analytics.pipeline.sales_enrichment_batch.partition;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Optional;

/**
 * Reads the calendar date out of a timestamp stored as text. Only the first ten
 * characters ({@code yyyy-MM-dd}) are looked at; whatever follows (time of day,
 * zone, nanoseconds) is ignored.
 */
public final class CalendarDates {

    public static final int DATE_PREFIX_LENGTH = 10;

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("uuuu-MM-dd")
            .withResolverStyle(ResolverStyle.STRICT);

    private CalendarDates() {
    }

    public static Optional<LocalDate> parse(@Nullable String timestamp) {
        if (timestamp == null) {
            return Optional.empty();
        }
        String text = timestamp.strip();
        if (text.length() < DATE_PREFIX_LENGTH) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(text.substring(0, DATE_PREFIX_LENGTH), DATE));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
