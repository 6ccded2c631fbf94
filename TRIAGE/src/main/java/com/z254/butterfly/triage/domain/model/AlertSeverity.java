package com.z254.butterfly.triage.domain.model;

import java.util.Locale;

/**
 * Alert severity, ordered from most to least severe.
 */
public enum AlertSeverity {
    CRITICAL(4),
    HIGH(3),
    MEDIUM(2),
    LOW(1),
    INFO(0);

    private final int weight;

    AlertSeverity(int weight) {
        this.weight = weight;
    }

    /**
     * Causal weight, CRITICAL=4 down to INFO=0.
     */
    public int getWeight() {
        return weight;
    }

    /**
     * Ranking priority, CRITICAL=0 down to INFO=4. Lower sorts first.
     */
    public int getPriority() {
        return CRITICAL.weight - weight;
    }

    /**
     * Lenient lookup used for externally produced payloads.
     *
     * @return the matching severity, or {@code null} if the value is blank or unknown
     */
    public static AlertSeverity fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
