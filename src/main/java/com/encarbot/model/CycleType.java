package com.encarbot.model;

import java.util.Locale;

public enum CycleType {
    POPULATION("population"),
    REGULAR("regular"),
    QUICK("quick"),
    CLOSURE("closure"),
    CLEANUP("cleanup"),
    DAILY_SUMMARY("daily_summary");

    private final String label;

    CycleType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static CycleType fromLabel(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            throw new IllegalArgumentException("cycle type must not be empty");
        }
        String target = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (CycleType type : values()) {
            if (type.label.equals(target)) {
                return type;
            }
        }
        throw new IllegalArgumentException("unknown cycle type: " + raw);
    }
}
