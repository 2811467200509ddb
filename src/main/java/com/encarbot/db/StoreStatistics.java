package com.encarbot.db;

import java.util.Map;

public record StoreStatistics(
        int total,
        int active,
        int closed,
        int coupe,
        int lease,
        int trulyNew,
        int firstSeenLast24h,
        Map<String, Integer> closuresByReason
) {
    public StoreStatistics {
        closuresByReason = closuresByReason == null ? Map.of() : Map.copyOf(closuresByReason);
    }
}
