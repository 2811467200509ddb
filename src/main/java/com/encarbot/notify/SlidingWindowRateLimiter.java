package com.encarbot.notify;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * At most {@code maxEvents} acquisitions per rolling window. Refused acquisitions are not
 * queued.
 */
public final class SlidingWindowRateLimiter {
    private final int maxEvents;
    private final Duration window;
    private final Clock clock;
    private final Deque<Instant> granted = new ArrayDeque<>();

    public SlidingWindowRateLimiter(int maxEvents, Duration window, Clock clock) {
        if (maxEvents < 1) {
            throw new IllegalArgumentException("maxEvents must be >= 1");
        }
        this.maxEvents = maxEvents;
        this.window = window;
        this.clock = clock;
    }

    public synchronized boolean tryAcquire() {
        Instant now = clock.instant();
        Instant horizon = now.minus(window);
        while (!granted.isEmpty() && !granted.peekFirst().isAfter(horizon)) {
            granted.pollFirst();
        }
        if (granted.size() >= maxEvents) {
            return false;
        }
        granted.addLast(now);
        return true;
    }

    public synchronized int inWindow() {
        return granted.size();
    }
}
