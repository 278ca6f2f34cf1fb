package br.com.analytics.pipeline.marketing_preprocess_batch.quality;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.TemporalQuery;
import java.util.List;
import java.util.Locale;

public final class LenientDateParser {

    private static final List<DateTimeFormatter> FORMATTERS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ISO_OFFSET_DATE_TIME,
            pattern("uuuu-MM-dd HH:mm[:ss]"),
            pattern("uuuu/MM/dd"),
            pattern("M/d/uuuu"),
            pattern("dd.MM.uuuu"),
            pattern("uuuuMMdd"),
            pattern("MMM d, uuuu"),
            pattern("d MMM uuuu")
    );

    private static final TemporalQuery<LocalDate> TO_DATE = LocalDate::from;

    private LenientDateParser() {
    }

    public static @Nullable LocalDate parse(@Nullable String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        for (DateTimeFormatter formatter : FORMATTERS) {
            try {
                return formatter.parse(value, TO_DATE);
            } catch (DateTimeParseException e) {
                // try the next layout
            }
        }
        return null;
    }

    private static DateTimeFormatter pattern(String pattern) {
        return DateTimeFormatter.ofPattern(pattern, Locale.ENGLISH).withResolverStyle(ResolverStyle.STRICT);
    }
}
