package com.whereq.triage.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Why the load monitor kept or replaced the classified queue
 */
public enum AdjustmentReason {
    OPTIMAL_ASSIGNMENT,
    ORIGINAL_QUEUE_OVERLOADED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
