package com.encarbot.db;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TimestampsTest {

    @Test
    void formatShouldBeFixedWidthSoTextOrderMatchesTime() {
        String early = Timestamps.format(Instant.parse("2024-03-01T09:00:00Z"));
        String late = Timestamps.format(Instant.parse("2024-03-01T10:00:00.5Z"));

        assertEquals("2024-03-01T09:00:00.000Z", early);
        assertEquals(early.length(), late.length());
        assertTrue(early.compareTo(late) < 0);
    }

    @Test
    void parseShouldAcceptLegacySpaceSeparatedRows() {
        assertEquals(Instant.parse("2023-01-01T12:30:00Z"), Timestamps.parse("2023-01-01 12:30:00"));
        assertNull(Timestamps.parse(" "));
        assertNull(Timestamps.format(null));
    }
}
