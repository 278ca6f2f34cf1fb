package br.com.analytics.pipeline.marketing_preprocess_batch.model;

import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;

public record CellValue(
        Kind kind,
        String text,
        @Nullable BigDecimal number
) {

    // cells with a larger exponent count as text
    private static final int MAX_SCALE = 1000;

    public enum Kind {
        TEXT,
        NUMBER
    }

    /**
     * Classifies a raw cell. Returns {@code null} for blank or missing cells.
     */
    public static @Nullable CellValue classify(@Nullable String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String trimmed = raw.trim();
        BigDecimal number = parseNumber(trimmed);
        if (number != null) {
            return new CellValue(Kind.NUMBER, trimmed, number);
        }
        return new CellValue(Kind.TEXT, trimmed, null);
    }

    public static @Nullable BigDecimal parseNumber(@Nullable String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        BigDecimal value;
        try {
            value = new BigDecimal(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
        return Math.abs(value.scale()) > MAX_SCALE ? null : value;
    }

    public boolean isText() {
        return kind == Kind.TEXT;
    }
}
