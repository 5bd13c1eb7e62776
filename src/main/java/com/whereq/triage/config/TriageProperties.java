package com.whereq.triage.config;

import com.whereq.triage.model.QueueTier;
import com.whereq.triage.model.UserTier;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.unit.DataSize;

import java.time.Duration;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration properties for WhereQ Triage.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "triage")
@Data
public class TriageProperties {

    /**
     * Zone used to decide the local hour for peak-hour handling.
     */
    private String timeZone = "Asia/Seoul";

    private Map<QueueTier, TierConfig> tiers = defaultTiers();

    private LoadConfig load = new LoadConfig();

    private PeakConfig peak = new PeakConfig();

    private StoreConfig store = new StoreConfig();

    private OptimizerConfig optimizer = new OptimizerConfig();

    private AlertConfig alerts = new AlertConfig();

    /**
     * One tier entry. Unset fields fall back to the built-in limits of the same tier,
     * so an override only needs the fields it changes.
     */
    @Data
    public static class TierConfig {
        /**
         * Largest accepted file. Unbounded when unset here and in the defaults.
         */
        private DataSize maxFileSize;

        private Double maxComplexity;

        private Integer maxWorkers;

        /**
         * Worker timeout. Unbounded when unset here and in the defaults.
         */
        private Duration timeout;

        private Integer priorityBase;

        /**
         * User tiers allowed on the queue. Empty means every tier.
         */
        private Set<UserTier> userTiers;

        /**
         * Copy of this entry with every unset field taken from the given defaults
         */
        public TierConfig mergedOver(TierConfig defaults) {
            TierConfig merged = new TierConfig();
            merged.setMaxFileSize(maxFileSize != null ? maxFileSize : defaults.getMaxFileSize());
            merged.setMaxComplexity(maxComplexity != null ? maxComplexity : defaults.getMaxComplexity());
            merged.setMaxWorkers(maxWorkers != null ? maxWorkers : defaults.getMaxWorkers());
            merged.setTimeout(timeout != null ? timeout : defaults.getTimeout());
            merged.setPriorityBase(priorityBase != null ? priorityBase : defaults.getPriorityBase());
            merged.setUserTiers(userTiers != null ? userTiers : defaults.getUserTiers());
            return merged;
        }
    }

    @Data
    public static class LoadConfig {
        /**
         * Load above which a classified queue is considered overloaded.
         */
        private double overloadThreshold = 0.85;

        /**
         * Alternatives must be strictly below this load to receive a redirect.
         */
        private double alternativeMaxLoad = 0.7;

        /**
         * Load above which the optimiser reports a queue as congested.
         */
        private double congestionThreshold = 0.8;

        /**
         * Congested queues with fewer pending jobs are ignored.
         */
        private long congestionMinPendingJobs = 5;

        /**
         * Load below which the optimiser reports a queue as idle.
         */
        private double idleThreshold = 0.2;

        /**
         * Health score below which a queue issue is raised.
         */
        private double healthAlertThreshold = 0.7;
    }

    @Data
    public static class PeakConfig {
        /**
         * Local hours that get the extra peak delay.
         */
        private List<Integer> hours = List.of(9, 10, 11, 14, 15, 16);

        /**
         * Local hours right before a peak, used for predictive scaling advice.
         */
        private List<Integer> approachingHours = List.of(8, 13);

        private long extraDelaySeconds = 3;
    }

    @Data
    public static class StoreConfig {
        /**
         * How long finished jobs stay visible to statistics.
         */
        private Duration retention = Duration.ofHours(24);

        /**
         * Maximum completed jobs sampled for the average processing time.
         */
        private int processingTimeSample = 100;
    }

    @Data
    public static class OptimizerConfig {
        private boolean enabled = true;

        /**
         * Interval between periodic optimisation cycles.
         */
        private Duration interval = Duration.ofMinutes(5);

        /**
         * Delay before the first cycle after startup.
         */
        private Duration initialDelay = Duration.ofSeconds(30);
    }

    @Data
    public static class AlertConfig {
        /**
         * Webhook receiving health issues and periodic reports. Alerts are only logged when unset.
         */
        private String webhookUrl;

        private Duration timeout = Duration.ofSeconds(10);
    }

    /**
     * Built-in tier table
     */
    static Map<QueueTier, TierConfig> defaultTiers() {
        Map<QueueTier, TierConfig> tiers = new EnumMap<>(QueueTier.class);
        tiers.put(QueueTier.INSTANT_PROCESSING,
            tier(DataSize.ofMegabytes(1), 0.3, 4, Duration.ofSeconds(10), 100));
        tiers.put(QueueTier.FAST_PROCESSING,
            tier(DataSize.ofMegabytes(10), 0.6, 6, Duration.ofSeconds(30), 80));
        tiers.put(QueueTier.STANDARD_PROCESSING,
            tier(DataSize.ofMegabytes(50), 0.8, 4, Duration.ofMinutes(2), 60));

        TierConfig priority = tier(DataSize.ofMegabytes(50), 0.8, 8, Duration.ofMinutes(2), 90);
        priority.setUserTiers(new HashSet<>(Set.of(UserTier.PRO, UserTier.ENTERPRISE)));
        tiers.put(QueueTier.PRIORITY_PROCESSING, priority);

        tiers.put(QueueTier.HEAVY_PROCESSING,
            tier(null, 1.0, 2, Duration.ofMinutes(10), 40));
        tiers.put(QueueTier.ULTRA_HEAVY,
            tier(null, 1.0, 1, null, 20));
        return tiers;
    }

    private static TierConfig tier(DataSize maxFileSize, double maxComplexity, int maxWorkers,
                                   Duration timeout, int priorityBase) {
        TierConfig config = new TierConfig();
        config.setMaxFileSize(maxFileSize);
        config.setMaxComplexity(maxComplexity);
        config.setMaxWorkers(maxWorkers);
        config.setTimeout(timeout);
        config.setPriorityBase(priorityBase);
        config.setUserTiers(new HashSet<>());
        return config;
    }
}
