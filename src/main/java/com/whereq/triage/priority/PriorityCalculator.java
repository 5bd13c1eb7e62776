package com.whereq.triage.priority;

import com.whereq.triage.config.TriageProperties;
import com.whereq.triage.model.QueueTier;
import com.whereq.triage.model.RequestedPriority;
import com.whereq.triage.model.SubmissionPreconditions;
import com.whereq.triage.model.UserTier;
import com.whereq.triage.monitor.QueueLoadMonitor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalTime;

/**
 * Priority score and admission delay of a job.
 *
 * The delay grows with the load of the target queue and during peak hours, spreading bursts
 * before jobs reach the workers.
 */
@Slf4j
@Component
public class PriorityCalculator {

    public static final int MIN_PRIORITY = 0;
    public static final int MAX_PRIORITY = 200;

    private static final long MB = 1024L * 1024L;
    private static final long LARGE_FILE_THRESHOLD = 20 * MB;
    private static final int LARGE_FILE_PENALTY = -5;
    private static final int COMPLEXITY_FACTOR = 20;

    private final QueueLoadMonitor loadMonitor;
    private final Clock clock;
    private final TriageProperties.PeakConfig peakConfig;

    public PriorityCalculator(QueueLoadMonitor loadMonitor, Clock clock, TriageProperties properties) {
        this.loadMonitor = loadMonitor;
        this.clock = clock;
        this.peakConfig = properties.getPeak();
    }

    /**
     * Priority score of a job; higher runs first
     *
     * @param fileSize size in bytes
     * @param complexity complexity in [0,1]
     * @param userTier tier of the submitting user
     * @param requestedPriority caller priority, null means normal
     * @return score in [0,200]
     */
    public int calculatePriorityScore(long fileSize, double complexity, UserTier userTier,
                                      RequestedPriority requestedPriority) {
        SubmissionPreconditions.checkFileSize(fileSize);
        SubmissionPreconditions.checkComplexity(complexity);
        SubmissionPreconditions.checkUserTier(userTier);

        RequestedPriority priority = requestedPriority == null ? RequestedPriority.NORMAL : requestedPriority;

        int base = priority.getBaseScore();
        int tierBonus = userTier.getPriorityBonus();
        // more complex jobs are started earlier
        int complexityAdjustment = (int) Math.round(complexity * COMPLEXITY_FACTOR);
        int sizePenalty = fileSize > LARGE_FILE_THRESHOLD ? LARGE_FILE_PENALTY : 0;

        int score = base + tierBonus + complexityAdjustment + sizePenalty;
        return Math.max(MIN_PRIORITY, Math.min(score, MAX_PRIORITY));
    }

    /**
     * Delay in seconds before the job becomes available to workers
     *
     * @param queue target queue
     * @return Mono with the delay
     */
    public Mono<Long> calculateOptimalDelay(QueueTier queue) {
        return loadMonitor.getQueueCurrentLoad(queue)
            .map(load -> {
                long delay = baseDelay(load) + (isPeakHour() ? peakConfig.getExtraDelaySeconds() : 0);
                log.debug("Delay for {}: load={}, peak={} -> {}s", queue, load, isPeakHour(), delay);
                return delay;
            });
    }

    static long baseDelay(double load) {
        if (load <= 0.3) {
            return 0;
        } else if (load <= 0.6) {
            return 2;
        } else if (load <= 0.8) {
            return 5;
        } else if (load <= 0.9) {
            return 10;
        }
        return 15;
    }

    boolean isPeakHour() {
        return peakConfig.getHours().contains(LocalTime.now(clock).getHour());
    }
}
