package com.encarbot.core;

import com.encarbot.model.ClassificationLabel;
import com.encarbot.model.ClosureReason;
import com.encarbot.model.CycleType;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Transient execution context of one monitoring cycle: counters, step timings and the
 * final outcome. Never persisted as-is; {@link #getSummary()} is what lands in the log
 * table and the cycle report.
 */
public final class MonitoringCycle {
    public static final String STEP_FETCH = "FETCH";
    public static final String STEP_CLASSIFY = "CLASSIFY";
    public static final String STEP_NOTIFY = "NOTIFY";
    public static final String STEP_ENRICH = "ENRICH";
    public static final String STEP_CLOSURE_SCAN = "CLOSURE_SCAN";
    public static final String STEP_CLEANUP = "CLEANUP";

    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_INSTANT;

    private final CycleType type;
    private final Instant startedAt;
    private Instant finishedAt;

    private int pagesFetched;
    private int scanned;
    private int newCount;
    private int updated;
    private int unchanged;
    private int closed;
    private int errors;
    private int notified;
    private int enriched;
    private int deleted;
    private boolean interrupted;
    private String failure;

    private final Map<ClosureReason, Integer> closuresByReason = new EnumMap<>(ClosureReason.class);
    private final Map<String, StepStat> steps = new LinkedHashMap<>();
    private final Map<String, Deque<Long>> stepStartsNanos = new HashMap<>();

    public MonitoringCycle(CycleType type, Instant startedAt) {
        this.type = type == null ? CycleType.REGULAR : type;
        this.startedAt = startedAt == null ? Instant.now() : startedAt;
        this.failure = "";
    }

    public synchronized CycleType type() {
        return type;
    }

    public synchronized Instant startedAt() {
        return startedAt;
    }

    public synchronized Instant finishedAt() {
        return finishedAt;
    }

    public synchronized void startStep(String name) {
        String key = sanitizeStepName(name);
        steps.putIfAbsent(key, new StepStat(key));
        stepStartsNanos.computeIfAbsent(key, ignored -> new ArrayDeque<>()).push(System.nanoTime());
    }

    public synchronized void endStep(String name, long itemsIn, long itemsOut, long errorCount) {
        String key = sanitizeStepName(name);
        StepStat stat = steps.computeIfAbsent(key, StepStat::new);
        long startedNanos = 0L;
        Deque<Long> stack = stepStartsNanos.get(key);
        if (stack != null && !stack.isEmpty()) {
            startedNanos = stack.pop();
        }
        long elapsedMs = startedNanos <= 0L
                ? 0L
                : Math.max(0L, (System.nanoTime() - startedNanos) / 1_000_000L);
        stat.elapsedMs += elapsedMs;
        stat.itemsIn += Math.max(0L, itemsIn);
        stat.itemsOut += Math.max(0L, itemsOut);
        stat.errorCount += Math.max(0L, errorCount);
    }

    public synchronized void recordPage(int items) {
        pagesFetched++;
        scanned += Math.max(0, items);
    }

    public synchronized void recordClassification(ClassificationLabel label) {
        if (label == null) {
            return;
        }
        switch (label) {
            case NEW -> newCount++;
            case UPDATED -> updated++;
            case UNCHANGED -> unchanged++;
        }
    }

    public synchronized void recordClosure(ClosureReason reason) {
        closed++;
        if (reason != null) {
            closuresByReason.merge(reason, 1, Integer::sum);
        }
    }

    public synchronized void recordChecked(int count) {
        scanned += Math.max(0, count);
    }

    public synchronized void recordError() {
        errors++;
    }

    public synchronized void recordNotified(int count) {
        notified += Math.max(0, count);
    }

    public synchronized void recordEnriched() {
        enriched++;
    }

    public synchronized void recordDeleted(int count) {
        deleted += Math.max(0, count);
    }

    public synchronized void markInterrupted() {
        interrupted = true;
    }

    public synchronized void fail(String message) {
        failure = message == null || message.isBlank() ? "failed" : message.trim();
    }

    public synchronized void finish() {
        if (finishedAt == null) {
            finishedAt = Instant.now();
        }
    }

    public synchronized String status() {
        if (!failure.isEmpty()) {
            return "FAILED";
        }
        if (interrupted) {
            return "INTERRUPTED";
        }
        return errors > 0 ? "PARTIAL" : "SUCCESS";
    }

    public synchronized int scanned() {
        return scanned;
    }

    public synchronized int newCount() {
        return newCount;
    }

    public synchronized int updated() {
        return updated;
    }

    public synchronized int unchanged() {
        return unchanged;
    }

    public synchronized int closed() {
        return closed;
    }

    public synchronized int errors() {
        return errors;
    }

    public synchronized int notified() {
        return notified;
    }

    public synchronized int enriched() {
        return enriched;
    }

    public synchronized int deleted() {
        return deleted;
    }

    public synchronized int pagesFetched() {
        return pagesFetched;
    }

    public synchronized String failure() {
        return failure;
    }

    public synchronized Map<ClosureReason, Integer> closuresByReason() {
        return Map.copyOf(closuresByReason);
    }

    public synchronized long totalElapsedMs() {
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        return Math.max(0L, Duration.between(startedAt, end).toMillis());
    }

    public synchronized List<StepRecord> stepRecords() {
        List<StepRecord> out = new ArrayList<>();
        for (StepStat stat : steps.values()) {
            out.add(new StepRecord(stat.name, stat.elapsedMs, stat.itemsIn, stat.itemsOut, stat.errorCount));
        }
        return out;
    }

    /** One-line form used for the monitoring_log details column. */
    public synchronized String getShortSummary() {
        StringBuilder sb = new StringBuilder();
        sb.append("status=").append(status())
                .append(" pages=").append(pagesFetched)
                .append(" scanned=").append(scanned)
                .append(" new=").append(newCount)
                .append(" updated=").append(updated)
                .append(" closed=").append(closed)
                .append(" notified=").append(notified)
                .append(" errors=").append(errors);
        if (deleted > 0) {
            sb.append(" deleted=").append(deleted);
        }
        if (!failure.isEmpty()) {
            sb.append(" failure=").append(failure);
        }
        return sb.toString();
    }

    public synchronized String getSummary() {
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        StringBuilder sb = new StringBuilder();
        sb.append("cycle=").append(type.label()).append('\n');
        sb.append("status=").append(status()).append('\n');
        sb.append("started_at=").append(ISO.format(startedAt)).append('\n');
        sb.append("finished_at=").append(ISO.format(end)).append('\n');
        sb.append("total_elapsed_ms=").append(Math.max(0L, Duration.between(startedAt, end).toMillis())).append('\n');
        sb.append("pages=").append(pagesFetched).append('\n');
        sb.append("scanned=").append(scanned).append('\n');
        sb.append("new=").append(newCount).append('\n');
        sb.append("updated=").append(updated).append('\n');
        sb.append("unchanged=").append(unchanged).append('\n');
        sb.append("closed=").append(closed);
        if (!closuresByReason.isEmpty()) {
            sb.append(' ').append(formatReasons());
        }
        sb.append('\n');
        sb.append("notified=").append(notified).append('\n');
        sb.append("enriched=").append(enriched).append('\n');
        sb.append("deleted=").append(deleted).append('\n');
        sb.append("errors=").append(errors).append('\n');
        if (!failure.isEmpty()) {
            sb.append("failure=").append(failure).append('\n');
        }
        if (!steps.isEmpty()) {
            sb.append("steps:\n");
            for (StepStat stat : steps.values()) {
                sb.append(String.format(
                        Locale.US,
                        "  %s elapsed_ms=%d in=%d out=%d err=%d%n",
                        stat.name,
                        stat.elapsedMs,
                        stat.itemsIn,
                        stat.itemsOut,
                        stat.errorCount
                ));
            }
        }
        return sb.toString().trim();
    }

    private String formatReasons() {
        StringBuilder sb = new StringBuilder("(");
        boolean first = true;
        for (Map.Entry<ClosureReason, Integer> entry : closuresByReason.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey().label()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }

    private String sanitizeStepName(String name) {
        String step = name == null ? "" : name.trim();
        return step.isEmpty() ? "UNKNOWN_STEP" : step.toUpperCase(Locale.ROOT);
    }

    private static final class StepStat {
        private final String name;
        private long elapsedMs;
        private long itemsIn;
        private long itemsOut;
        private long errorCount;

        private StepStat(String name) {
            this.name = name;
        }
    }

    public record StepRecord(String name, long elapsedMs, long itemsIn, long itemsOut, long errorCount) {
    }
}
