package com.autohistorian.util;

import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class TimeParsingTest {

    @Test
    void trailingZIsReadAsUtc() {
        assertEquals(OffsetDateTime.of(2024, 3, 1, 10, 15, 0, 0, ZoneOffset.UTC),
                TimeParsing.parseLenient("2024-03-01T10:15:00Z"));
    }

    @Test
    void explicitOffsetIsKept() {
        OffsetDateTime t = TimeParsing.parseLenient("2024-03-01T10:15:00-05:00");
        assertEquals(ZoneOffset.ofHours(-5), t.getOffset());
        assertEquals(15, t.getHour());
    }

    @Test
    void compactOffsetFromNytIsAccepted() {
        assertEquals(OffsetDateTime.of(2024, 3, 1, 12, 0, 0, 0, ZoneOffset.UTC),
                TimeParsing.parseLenient("2024-03-01T12:00:00+0000"));
    }

    @Test
    void plainDateIsUtcMidnight() {
        assertEquals(OffsetDateTime.of(2024, 2, 20, 0, 0, 0, 0, ZoneOffset.UTC),
                TimeParsing.parseLenient("2024-02-20"));
    }

    @Test
    void localDateTimeIsReadAsUtc() {
        assertEquals(OffsetDateTime.of(2024, 2, 20, 8, 30, 0, 0, ZoneOffset.UTC),
                TimeParsing.parseLenient("2024-02-20T08:30"));
    }

    @Test
    void garbageYieldsNull() {
        assertNull(TimeParsing.parseLenient(null));
        assertNull(TimeParsing.parseLenient(""));
        assertNull(TimeParsing.parseLenient("null"));
        assertNull(TimeParsing.parseLenient("early March"));
        assertNull(TimeParsing.parseLenient("2024-13-45"));
    }
}
