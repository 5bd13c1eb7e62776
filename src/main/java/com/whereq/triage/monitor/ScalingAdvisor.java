package com.whereq.triage.monitor;

import com.whereq.triage.alert.HealthAlertNotifier;
import com.whereq.triage.config.TriageProperties;
import com.whereq.triage.model.QueueStatistics;
import com.whereq.triage.model.QueueTier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Looks at a queue right after a job was placed on it and advises on worker scaling.
 * Advice is logged and alerted only; actual scaling is done by the infrastructure.
 */
@Slf4j
@Component
public class ScalingAdvisor {

    private static final double SCALE_UP_BACKLOG_PER_WORKER = 3.0;
    private static final double SCALE_UP_MIN_PROCESSING_SECONDS = 60.0;

    private final QueueStatisticsCollector statisticsCollector;
    private final HealthAlertNotifier alertNotifier;
    private final double healthAlertThreshold;

    public ScalingAdvisor(QueueStatisticsCollector statisticsCollector,
                          HealthAlertNotifier alertNotifier,
                          TriageProperties properties) {
        this.statisticsCollector = statisticsCollector;
        this.alertNotifier = alertNotifier;
        this.healthAlertThreshold = properties.getLoad().getHealthAlertThreshold();
    }

    /**
     * Check a queue, log scaling advice and raise a health alert when needed.
     * The alert is sent in the background; the returned Mono only waits for the statistics read.
     *
     * @param queue the queue
     * @return Mono with the advice given
     */
    public Mono<ScalingAdvice> monitorAndScale(QueueTier queue) {
        return statisticsCollector.getQueueStatistics(queue)
            .map(stats -> {
                ScalingAdvice advice = adviseScaling(stats);
                switch (advice) {
                    case SCALE_UP -> log.info("Scaling up queue {} - high load detected (pending={}, running={})",
                        queue, stats.getPendingJobs(), stats.getRunningJobs());
                    case SCALE_DOWN -> log.info("Scaling down queue {} - low utilization (running={})",
                        queue, stats.getRunningJobs());
                    case NONE -> log.debug("No scaling needed for queue {}", queue);
                }

                double health = QueuePerformanceAnalyzer.calculateQueueHealthScore(stats);
                if (health < healthAlertThreshold) {
                    alertNotifier.notifyQueueHealthIssue(queue, health, stats).subscribe();
                }
                return advice;
            });
    }

    static ScalingAdvice adviseScaling(QueueStatistics stats) {
        double backlogPerWorker = (double) stats.getPendingJobs() / Math.max(stats.getRunningJobs(), 1);
        if (backlogPerWorker > SCALE_UP_BACKLOG_PER_WORKER
                && stats.getAvgProcessingTime() > SCALE_UP_MIN_PROCESSING_SECONDS) {
            return ScalingAdvice.SCALE_UP;
        }
        if (stats.getPendingJobs() == 0 && stats.getRunningJobs() > 1) {
            return ScalingAdvice.SCALE_DOWN;
        }
        return ScalingAdvice.NONE;
    }
}
