package com.whereq.triage.monitor;

import com.whereq.triage.config.QueueTierCatalog;
import com.whereq.triage.config.TriageProperties;
import com.whereq.triage.model.QueueAdjustment;
import com.whereq.triage.model.QueueStatistics;
import com.whereq.triage.model.QueueTier;
import com.whereq.triage.model.TierLimits;
import com.whereq.triage.model.UserTier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.function.Tuple2;
import reactor.util.function.Tuples;

import java.util.Arrays;

/**
 * Computes queue load and redirects submissions away from overloaded queues.
 * Stateless: every decision is made on a fresh read of the job store, so concurrent
 * submissions may act on slightly stale numbers.
 */
@Slf4j
@Component
public class QueueLoadMonitor {

    private static final double WORKER_WEIGHT = 0.7;
    private static final double PENDING_WEIGHT = 0.3;

    private final QueueStatisticsCollector statisticsCollector;
    private final QueueTierCatalog catalog;
    private final TriageProperties.LoadConfig loadConfig;

    public QueueLoadMonitor(QueueStatisticsCollector statisticsCollector,
                            QueueTierCatalog catalog,
                            TriageProperties properties) {
        this.statisticsCollector = statisticsCollector;
        this.catalog = catalog;
        this.loadConfig = properties.getLoad();
    }

    /**
     * Current load of a queue in [0,1]
     *
     * @param queue the queue
     * @return Mono with the load factor
     */
    public Mono<Double> getQueueCurrentLoad(QueueTier queue) {
        return statisticsCollector.getQueueStatistics(queue)
            .map(stats -> calculateLoad(stats, catalog.get(queue)));
    }

    /**
     * Keep the classified queue, or redirect to the least loaded alternative when it is overloaded
     *
     * @param queue classified queue
     * @param fileSize file size in bytes
     * @param userTier submitting user's tier, alternatives must accept it
     * @return Mono with the adjustment
     */
    public Mono<QueueAdjustment> adjustQueueIfNeeded(QueueTier queue, long fileSize, UserTier userTier) {
        return getQueueCurrentLoad(queue)
            .flatMap(load -> {
                if (load <= loadConfig.getOverloadThreshold()) {
                    return Mono.just(QueueAdjustment.keep(queue, load));
                }

                return findAlternativeQueue(queue, fileSize, userTier)
                    .map(alternative -> {
                        log.info("Queue overloaded, redirecting from {} to {} (load {})",
                            queue, alternative, String.format("%.2f", load));
                        return QueueAdjustment.redirect(queue, alternative, load);
                    })
                    .defaultIfEmpty(QueueAdjustment.keep(queue, load));
            });
    }

    /**
     * Least loaded queue, other than the original, that fits the file, accepts the user tier
     * and is below the alternative load limit. Ties go to the queue declared first.
     */
    Mono<QueueTier> findAlternativeQueue(QueueTier original, long fileSize, UserTier userTier) {
        return Flux.fromIterable(Arrays.asList(QueueTier.values()))
            .filter(tier -> tier != original)
            .filter(tier -> fileSize <= catalog.get(tier).getMaxFileSize())
            .filter(tier -> catalog.get(tier).isEligible(userTier))
            .concatMap(tier -> getQueueCurrentLoad(tier).map(load -> Tuples.of(tier, load)))
            .filter(candidate -> candidate.getT2() < loadConfig.getAlternativeMaxLoad())
            .reduce((best, candidate) -> candidate.getT2() < best.getT2() ? candidate : best)
            .map(Tuple2::getT1);
    }

    /**
     * Weighted worker utilisation and pending ratio, capped at 1.0
     */
    public static double calculateLoad(QueueStatistics stats, TierLimits limits) {
        double workerUtilization = (double) stats.getRunningJobs() / limits.getMaxWorkers();
        double pendingRatio = stats.getTotalJobs() > 0
            ? (double) stats.getPendingJobs() / stats.getTotalJobs()
            : 0.0;

        return Math.min(workerUtilization * WORKER_WEIGHT + pendingRatio * PENDING_WEIGHT, 1.0);
    }
}
