package com.whereq.triage.config;

import com.whereq.triage.model.QueueTier;
import com.whereq.triage.model.TierLimits;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable table of tier limits, frozen from {@link TriageProperties} at startup.
 *
 * @author WhereQ Inc.
 */
@Slf4j
public final class QueueTierCatalog {

    private final Map<QueueTier, TierLimits> limits;

    private QueueTierCatalog(Map<QueueTier, TierLimits> limits) {
        this.limits = Collections.unmodifiableMap(limits);
    }

    /**
     * Build a catalog from configuration. Tiers and fields left unset keep their built-in limits.
     *
     * @param tiers tier configuration keyed by tier
     * @return frozen catalog
     */
    public static QueueTierCatalog from(Map<QueueTier, TriageProperties.TierConfig> tiers) {
        Map<QueueTier, TriageProperties.TierConfig> defaults = TriageProperties.defaultTiers();
        Map<QueueTier, TierLimits> limits = new EnumMap<>(QueueTier.class);

        for (QueueTier tier : QueueTier.values()) {
            TriageProperties.TierConfig configured = tiers.get(tier);
            TriageProperties.TierConfig config = configured == null
                ? defaults.get(tier)
                : configured.mergedOver(defaults.get(tier));

            if (config.getMaxWorkers() <= 0) {
                throw new IllegalStateException("Queue tier " + tier + " needs at least one worker");
            }
            if (config.getMaxComplexity() < 0 || config.getMaxComplexity() > 1) {
                throw new IllegalStateException("Queue tier " + tier + " needs a complexity limit within [0,1]");
            }

            TierLimits tierLimits = TierLimits.builder()
                .maxFileSize(config.getMaxFileSize() == null
                    ? Long.MAX_VALUE : config.getMaxFileSize().toBytes())
                .maxComplexity(config.getMaxComplexity())
                .maxWorkers(config.getMaxWorkers())
                .timeout(config.getTimeout())
                .priorityBase(config.getPriorityBase())
                .eligibleUserTiers(config.getUserTiers() == null ? Set.of() : config.getUserTiers())
                .build();

            limits.put(tier, tierLimits);
            log.debug("Queue tier {}: {}", tier, tierLimits);
        }

        return new QueueTierCatalog(limits);
    }

    /**
     * Catalog with the built-in default limits
     */
    public static QueueTierCatalog defaults() {
        return from(new TriageProperties().getTiers());
    }

    public TierLimits get(QueueTier tier) {
        return limits.get(tier);
    }

    public Map<QueueTier, TierLimits> asMap() {
        return limits;
    }
}
