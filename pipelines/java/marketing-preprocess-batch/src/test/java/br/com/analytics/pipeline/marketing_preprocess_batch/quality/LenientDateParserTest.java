package br.com.analytics.pipeline.marketing_preprocess_batch.quality;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class LenientDateParserTest {

    private static final LocalDate NEW_YEAR = LocalDate.of(2024, 1, 1);

    @Test
    void acceptsCommonLayouts() {
        assertEquals(NEW_YEAR, LenientDateParser.parse("2024-01-01"));
        assertEquals(NEW_YEAR, LenientDateParser.parse(" 2024-01-01 "));
        assertEquals(NEW_YEAR, LenientDateParser.parse("2024-01-01T08:30:00"));
        assertEquals(NEW_YEAR, LenientDateParser.parse("2024-01-01 08:30"));
        assertEquals(NEW_YEAR, LenientDateParser.parse("2024/01/01"));
        assertEquals(NEW_YEAR, LenientDateParser.parse("1/1/2024"));
        assertEquals(NEW_YEAR, LenientDateParser.parse("01.01.2024"));
        assertEquals(NEW_YEAR, LenientDateParser.parse("20240101"));
        assertEquals(NEW_YEAR, LenientDateParser.parse("Jan 1, 2024"));
        assertEquals(NEW_YEAR, LenientDateParser.parse("1 Jan 2024"));
    }

    @Test
    void rejectsGarbageAndImpossibleDates() {
        assertNull(LenientDateParser.parse("not-a-date"));
        assertNull(LenientDateParser.parse("2024-02-30"));
        assertNull(LenientDateParser.parse(""));
        assertNull(LenientDateParser.parse(null));
    }
}
