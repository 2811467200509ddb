package com.encarbot.runner;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAdjusters;

/**
 * When a scheduled cycle becomes due, judged from the time of its previous run.
 */
public interface Cadence {

    /**
     * @param lastRun previous run, or null when the cycle has never run
     */
    boolean isDue(ZonedDateTime now, ZonedDateTime lastRun);

    /** Whether a cycle that never ran should start right away. */
    boolean runsAtStartup();

    static Cadence every(Duration interval) {
        return new Every(interval);
    }

    static Cadence dailyAt(LocalTime time) {
        return new DailyAt(time);
    }

    static Cadence weeklyAt(DayOfWeek day, LocalTime time) {
        return new WeeklyAt(day, time);
    }

    record Every(Duration interval) implements Cadence {
        public Every {
            if (interval == null || interval.isZero() || interval.isNegative()) {
                throw new IllegalArgumentException("interval must be positive");
            }
        }

        @Override
        public boolean isDue(ZonedDateTime now, ZonedDateTime lastRun) {
            return lastRun == null || !now.isBefore(lastRun.plus(interval));
        }

        @Override
        public boolean runsAtStartup() {
            return true;
        }
    }

    record DailyAt(LocalTime time) implements Cadence {
        @Override
        public boolean isDue(ZonedDateTime now, ZonedDateTime lastRun) {
            ZonedDateTime slot = now.with(time);
            if (slot.isAfter(now)) {
                slot = slot.minusDays(1);
            }
            return lastRun == null || lastRun.isBefore(slot);
        }

        @Override
        public boolean runsAtStartup() {
            return false;
        }
    }

    record WeeklyAt(DayOfWeek day, LocalTime time) implements Cadence {
        @Override
        public boolean isDue(ZonedDateTime now, ZonedDateTime lastRun) {
            ZonedDateTime slot = now.with(TemporalAdjusters.previousOrSame(day)).with(time);
            if (slot.isAfter(now)) {
                slot = slot.minusWeeks(1);
            }
            return lastRun == null || lastRun.isBefore(slot);
        }

        @Override
        public boolean runsAtStartup() {
            return false;
        }
    }
}
