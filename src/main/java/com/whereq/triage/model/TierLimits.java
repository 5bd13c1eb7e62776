package com.whereq.triage.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.Set;

/**
 * Static capacity and eligibility limits of one queue tier.
 * Never mutated after startup.
 */
@Value
@Builder
public class TierLimits {

    /**
     * Largest file (bytes) accepted by the tier, inclusive. Long.MAX_VALUE means unbounded.
     */
    long maxFileSize;

    /**
     * Highest complexity score accepted by the tier, inclusive
     */
    double maxComplexity;

    /**
     * Worker slots available to the tier
     */
    int maxWorkers;

    /**
     * Execution timeout handed to the worker fleet; null means unbounded
     */
    Duration timeout;

    int priorityBase;

    /**
     * User tiers allowed on this queue; empty means everyone
     */
    @Singular
    Set<UserTier> eligibleUserTiers;

    public boolean isUnboundedFileSize() {
        return maxFileSize == Long.MAX_VALUE;
    }

    public boolean hasTimeout() {
        return timeout != null;
    }

    public boolean isEligible(UserTier userTier) {
        return eligibleUserTiers.isEmpty() || eligibleUserTiers.contains(userTier);
    }

    /**
     * Inclusive fit check against both thresholds
     */
    public boolean accommodates(long fileSize, double complexity) {
        return fileSize <= maxFileSize && complexity <= maxComplexity;
    }
}
