package com.encarbot.classify;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TrulyNewRuleTest {
    private final TrulyNewRule rule = new TrulyNewRule(
            new NewListingCriteria(30, 7, 100, 10, Duration.ofMinutes(15), List.of()));

    @Test
    void listingInsideMaxAgeShouldQualifyEvenPastRecentWindow() {
        assertEquals(Optional.of(TrulyNewRule.Reason.WITHIN_MAX_AGE), rule.evaluate(8, 5));
    }

    @Test
    void recentLowViewListingShouldQualifyAsRecent() {
        assertEquals(Optional.of(TrulyNewRule.Reason.RECENT_LOW_VIEWS), rule.evaluate(3, 5));
        assertEquals(Optional.of(TrulyNewRule.Reason.RECENT_LOW_VIEWS), rule.evaluate(0, 99));
    }

    @Test
    void recentListingWithManyViewsShouldFallBackToMaxAge() {
        assertEquals(Optional.of(TrulyNewRule.Reason.WITHIN_MAX_AGE), rule.evaluate(3, 150));
    }

    @Test
    void staleRegistrationShouldNeverQualify() {
        assertTrue(rule.evaluate(31, 0).isEmpty());
        assertTrue(rule.evaluate(400, 1).isEmpty());
    }

    @Test
    void undatedListingShouldQualifyOnlyWithFewViews() {
        assertEquals(Optional.of(TrulyNewRule.Reason.UNDATED_LOW_VIEWS), rule.evaluate(null, 10));
        assertTrue(rule.evaluate(null, 11).isEmpty());
    }
}
