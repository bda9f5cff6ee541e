package com.chicu.aimotuner.tuning;

import java.util.Locale;

public enum TuningMode {
    QUICK,
    FULL;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TuningMode fromLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Tuning mode is blank");
        }
        String x = label.trim().toUpperCase(Locale.ROOT);
        for (TuningMode m : values()) {
            if (m.name().equals(x)) return m;
        }
        throw new IllegalArgumentException("Unknown tuning mode: " + label);
    }
}
