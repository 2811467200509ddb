package com.encarbot.runner;

import com.encarbot.config.Config;
import com.encarbot.model.CycleType;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;
import java.util.List;
import java.util.Locale;

public record ScheduledCycle(CycleType type, Cadence cadence) {

    /**
     * Regular and quick scans on minute intervals, closure scans every few hours, the
     * daily summary at a fixed time and cleanup once a week. Population is not scheduled;
     * the orchestrator substitutes it for a scan while the store is empty.
     */
    public static List<ScheduledCycle> fromConfig(Config config) {
        return List.of(
                new ScheduledCycle(CycleType.REGULAR,
                        Cadence.every(Duration.ofMinutes(Math.max(1, config.getInt("monitor.check_interval_minutes", 10))))),
                new ScheduledCycle(CycleType.QUICK,
                        Cadence.every(Duration.ofMinutes(Math.max(1, config.getInt("monitor.quick_scan_minutes", 5))))),
                new ScheduledCycle(CycleType.CLOSURE,
                        Cadence.every(Duration.ofHours(Math.max(1, config.getInt("closure.interval_hours", 6))))),
                new ScheduledCycle(CycleType.DAILY_SUMMARY,
                        Cadence.dailyAt(LocalTime.parse(config.getString("monitor.daily_summary_time", "08:00")))),
                new ScheduledCycle(CycleType.CLEANUP,
                        Cadence.weeklyAt(
                                DayOfWeek.valueOf(config.getString("cleanup.day", "SUNDAY").toUpperCase(Locale.ROOT)),
                                LocalTime.parse(config.getString("cleanup.time", "02:00"))))
        );
    }
}
