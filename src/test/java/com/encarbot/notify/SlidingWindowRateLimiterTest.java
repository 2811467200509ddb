package com.encarbot.notify;

import com.encarbot.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SlidingWindowRateLimiterTest {

    @Test
    void shouldAdmitAtMostMaxEventsPerWindow() {
        MutableClock clock = new MutableClock(Instant.parse("2024-03-01T00:00:00Z"));
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(3, Duration.ofSeconds(60), clock);

        assertTrue(limiter.tryAcquire());
        clock.advance(Duration.ofSeconds(10));
        assertTrue(limiter.tryAcquire());
        assertTrue(limiter.tryAcquire());
        assertFalse(limiter.tryAcquire());
        assertEquals(3, limiter.inWindow());

        clock.advance(Duration.ofSeconds(50));
        assertTrue(limiter.tryAcquire());
        assertFalse(limiter.tryAcquire());

        clock.advance(Duration.ofSeconds(10));
        assertTrue(limiter.tryAcquire());
    }

    @Test
    void shouldRejectNonPositiveLimit() {
        assertThrows(IllegalArgumentException.class,
                () -> new SlidingWindowRateLimiter(0, Duration.ofSeconds(60), new MutableClock(Instant.EPOCH)));
    }
}
