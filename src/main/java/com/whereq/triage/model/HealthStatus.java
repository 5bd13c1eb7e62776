package com.whereq.triage.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Bucketed system health
 */
public enum HealthStatus {
    EXCELLENT(0.8),
    GOOD(0.6),
    FAIR(0.4),
    POOR(0.2),
    CRITICAL(Double.NEGATIVE_INFINITY);

    private final double lowerBound;

    HealthStatus(double lowerBound) {
        this.lowerBound = lowerBound;
    }

    public static HealthStatus fromScore(double score) {
        for (HealthStatus status : values()) {
            if (score >= status.lowerBound) {
                return status;
            }
        }
        return CRITICAL;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
