package com.whereq.triage.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Subscription tier of the submitting user
 */
public enum UserTier {
    FREE(5),
    BASIC(10),
    PRO(20),
    ENTERPRISE(30);

    private final int priorityBonus;

    UserTier(int priorityBonus) {
        this.priorityBonus = priorityBonus;
    }

    /**
     * Bonus added to the job priority score for this tier
     */
    public int getPriorityBonus() {
        return priorityBonus;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Unknown tiers get free-tier treatment.
     */
    @JsonCreator
    public static UserTier fromString(String value) {
        if (value == null) {
            return null;
        }
        for (UserTier tier : values()) {
            if (tier.name().equalsIgnoreCase(value.trim())) {
                return tier;
            }
        }
        return FREE;
    }
}
