package com.encarbot.closure;

import com.encarbot.model.ClosureReason;

import java.util.EnumMap;
import java.util.Map;

public final class ClosureScanResult {
    private int checked;
    private int closed;
    private int errors;
    private int stillActive;
    private boolean stopped;
    private final Map<ClosureReason, Integer> closuresByReason = new EnumMap<>(ClosureReason.class);

    void recordActive() {
        checked++;
        stillActive++;
    }

    void recordClosed(ClosureReason reason) {
        checked++;
        closed++;
        closuresByReason.merge(reason, 1, Integer::sum);
    }

    void recordAlreadyClosed() {
        checked++;
    }

    void recordError() {
        checked++;
        errors++;
    }

    void markStopped() {
        stopped = true;
    }

    public int checked() {
        return checked;
    }

    public int closed() {
        return closed;
    }

    public int errors() {
        return errors;
    }

    public int stillActive() {
        return stillActive;
    }

    public boolean stopped() {
        return stopped;
    }

    public Map<ClosureReason, Integer> closuresByReason() {
        return Map.copyOf(closuresByReason);
    }

    @Override
    public String toString() {
        return "checked=" + checked + " closed=" + closed + " errors=" + errors
                + " still_active=" + stillActive + " by_reason=" + closuresByReason;
    }
}
