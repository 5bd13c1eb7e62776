package com.whereq.triage.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Priority requested by the caller for an analysis job
 */
public enum RequestedPriority {
    URGENT(100),
    HIGH(75),
    NORMAL(50),
    LOW(25);

    private final int baseScore;

    RequestedPriority(int baseScore) {
        this.baseScore = baseScore;
    }

    public int getBaseScore() {
        return baseScore;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Missing or unrecognised values fall back to NORMAL
     */
    @JsonCreator
    public static RequestedPriority fromString(String value) {
        if (value == null || value.isBlank()) {
            return NORMAL;
        }
        for (RequestedPriority priority : values()) {
            if (priority.name().equalsIgnoreCase(value.trim())) {
                return priority;
            }
        }
        return NORMAL;
    }
}
