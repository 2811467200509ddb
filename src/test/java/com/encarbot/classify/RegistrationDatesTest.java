package com.encarbot.classify;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class RegistrationDatesTest {
    private static final ZoneId SEOUL = ZoneId.of("Asia/Seoul");

    @Test
    void normalize_shouldAcceptCommonSeparators() {
        assertEquals("2024/01/05", RegistrationDates.normalize("2024-1-5"));
        assertEquals("2024/01/05", RegistrationDates.normalize("2024.01.05"));
        assertEquals("2024/01/05", RegistrationDates.normalize("등록 2024/01/05"));
        assertNull(RegistrationDates.normalize("2024/13/40"));
        assertNull(RegistrationDates.normalize(""));
    }

    @Test
    void daysSince_shouldCountInMarketplaceZone() {
        // 2024-01-10T16:00Z is already 2024-01-11 in Seoul.
        Clock clock = Clock.fixed(Instant.parse("2024-01-10T16:00:00Z"), ZoneOffset.UTC);

        assertEquals(10, RegistrationDates.daysSince("2024/01/01", clock, SEOUL));
        assertNull(RegistrationDates.daysSince(null, clock, SEOUL));
    }
}
