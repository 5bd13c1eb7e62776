package com.whereq.triage.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * The six fixed processing queues an analysis job can be assigned to.
 * The wire name doubles as the queue name in the job store.
 */
public enum QueueTier {
    INSTANT_PROCESSING("instant_processing"),
    FAST_PROCESSING("fast_processing"),
    STANDARD_PROCESSING("standard_processing"),
    PRIORITY_PROCESSING("priority_processing"),
    HEAVY_PROCESSING("heavy_processing"),
    ULTRA_HEAVY("ultra_heavy");

    private final String queueName;

    QueueTier(String queueName) {
        this.queueName = queueName;
    }

    @JsonValue
    public String getQueueName() {
        return queueName;
    }

    /**
     * Resolve a tier from its queue name or enum constant name (case-insensitive)
     */
    public static Optional<QueueTier> fromQueueName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(tier -> tier.queueName.equalsIgnoreCase(name) || tier.name().equalsIgnoreCase(name))
            .findFirst();
    }

    @JsonCreator
    static QueueTier fromJson(String name) {
        return fromQueueName(name)
            .orElseThrow(() -> new IllegalArgumentException("Unknown queue: " + name));
    }

    @Override
    public String toString() {
        return queueName;
    }
}
