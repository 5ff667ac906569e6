package com.pipeline.amts.storage;

import org.junit.jupiter.api.Test;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TimestampParserTest {

    private static final ZoneId ZURICH = ZoneId.of("Europe/Zurich");

    @Test
    void shouldUseExplicitOffset() {
        assertEquals(Instant.parse("2024-03-01T10:00:00Z"),
                TimestampParser.toInstant("2024-03-01T12:00:00+02:00", ZURICH, null));
    }

    @Test
    void shouldInterpretLocalTimeInZone() {
        assertEquals(Instant.parse("2024-03-01T12:00:00Z"),
                TimestampParser.toInstant("2024-03-01 12:00:00", ZoneOffset.UTC, null));
        assertEquals(Instant.parse("2024-03-01T11:00:00Z"),
                TimestampParser.toInstant("2024-03-01 12:00:00", ZURICH, null));
    }

    @Test
    void shouldAcceptCommonLocalFormats() {
        assertEquals(Instant.parse("2024-03-01T09:05:00Z"),
                TimestampParser.toInstant("3/1/2024 9:05", ZoneOffset.UTC, null));
        assertEquals(Instant.parse("2024-03-01T09:05:00Z"),
                TimestampParser.toInstant("2024/03/01 09:05:00", ZoneOffset.UTC, null));
        assertEquals(Instant.parse("2024-03-01T09:05:00Z"),
                TimestampParser.toInstant("2024-03-01T09:05:00", ZoneOffset.UTC, null));
    }

    @Test
    void shouldUseConfiguredFormat() {
        DateTimeFormatter format = DateTimeFormatter.ofPattern("dd.MM.yyyy HH:mm");
        assertEquals(Instant.parse("2024-03-01T12:00:00Z"),
                TimestampParser.toInstant("01.03.2024 12:00", ZoneOffset.UTC, format));
    }

    @Test
    void shouldShiftTimeInDstGapToTransition() {
        // 2024-03-31 02:00 -> 03:00 in Europe/Zurich
        assertEquals(Instant.parse("2024-03-31T01:00:00Z"),
                TimestampParser.toInstant("2024-03-31 02:30:00", ZURICH, null));
    }

    @Test
    void shouldRejectAmbiguousTimeInDstOverlap() {
        assertThrows(DateTimeException.class,
                () -> TimestampParser.toInstant("2024-10-27 02:30:00", ZURICH, null));
    }

    @Test
    void shouldRejectEmptyAndGarbage() {
        assertThrows(DateTimeException.class, () -> TimestampParser.toInstant("  ", ZoneOffset.UTC, null));
        assertThrows(DateTimeException.class, () -> TimestampParser.toInstant("yesterday", ZoneOffset.UTC, null));
    }

    @Test
    void shouldParseDateOnlyAsUtcMidnight() {
        assertEquals(Instant.parse("2024-01-15T00:00:00Z"), TimestampParser.parseUtc("2024-01-15"));
        assertEquals(Instant.parse("2024-01-15T06:30:00Z"), TimestampParser.parseUtc("2024-01-15 06:30:00"));
    }
}
