package com.whereq.triage.monitor;

import com.whereq.triage.config.TriageProperties;
import com.whereq.triage.model.OptimizationAction;
import com.whereq.triage.model.OptimizationResult;
import com.whereq.triage.model.QueueTier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Periodic optimisation pass over all queues.
 *
 * Every action is advisory. The job store cannot move already-enqueued jobs between queues,
 * so congestion is reported rather than redistributed.
 */
@Slf4j
@Component
public class QueueOptimizer {

    private final QueueLoadMonitor loadMonitor;
    private final QueueStatisticsCollector statisticsCollector;
    private final Clock clock;
    private final TriageProperties.LoadConfig loadConfig;
    private final TriageProperties.PeakConfig peakConfig;

    public QueueOptimizer(QueueLoadMonitor loadMonitor,
                          QueueStatisticsCollector statisticsCollector,
                          Clock clock,
                          TriageProperties properties) {
        this.loadMonitor = loadMonitor;
        this.statisticsCollector = statisticsCollector;
        this.clock = clock;
        this.loadConfig = properties.getLoad();
        this.peakConfig = properties.getPeak();
    }

    /**
     * Run one optimisation pass
     *
     * @return Mono with the advisory actions produced
     */
    public Mono<OptimizationResult> optimizeQueueAssignments() {
        log.info("Starting intelligent queue optimization");
        Instant start = clock.instant();

        Mono<List<OptimizationAction>> congestion = identifyCongestedQueues().collectList();
        Mono<List<OptimizationAction>> idle = detectIdleQueues().map(List::of).defaultIfEmpty(List.of());
        Mono<List<OptimizationAction>> predictive = Mono.justOrEmpty(applyPredictiveScaling())
            .map(List::of)
            .defaultIfEmpty(List.of());

        return Mono.zip(congestion, idle, predictive)
            .map(tuple -> {
                List<OptimizationAction> actions = new ArrayList<>(tuple.getT1());
                actions.addAll(tuple.getT2());
                actions.addAll(tuple.getT3());

                Duration elapsed = Duration.between(start, clock.instant());
                log.info("Queue optimization completed: {} optimizations applied in {} ms",
                    actions.size(), elapsed.toMillis());

                return OptimizationResult.builder()
                    .optimizationsApplied(actions)
                    .optimizationTime(elapsed)
                    .performanceImprovement(estimatePerformanceImprovement(actions))
                    .build();
            });
    }

    /**
     * Congestion alerts for queues above the congestion threshold with a meaningful backlog
     */
    Flux<OptimizationAction> identifyCongestedQueues() {
        return Flux.fromIterable(Arrays.asList(QueueTier.values()))
            .concatMap(queue -> loadMonitor.getQueueCurrentLoad(queue)
                .filter(load -> load > loadConfig.getCongestionThreshold())
                .flatMap(load -> statisticsCollector.getQueueStatistics(queue))
                .flatMap(stats -> {
                    long pending = stats.getPendingJobs();
                    if (pending < loadConfig.getCongestionMinPendingJobs()) {
                        return Mono.empty();
                    }

                    log.info("Queue {} is congested with {} pending jobs", queue, pending);
                    return Mono.just(OptimizationAction.builder()
                        .action(OptimizationAction.ActionType.CONGESTION_ALERT)
                        .queue(queue)
                        .pendingJobs(pending)
                        .recommendation("Consider manual intervention or worker scaling")
                        .build());
                }));
    }

    /**
     * One action listing every queue below the idle threshold
     */
    Mono<OptimizationAction> detectIdleQueues() {
        return Flux.fromIterable(Arrays.asList(QueueTier.values()))
            .concatMap(queue -> loadMonitor.getQueueCurrentLoad(queue)
                .filter(load -> load < loadConfig.getIdleThreshold())
                .map(load -> queue))
            .collectList()
            .filter(idle -> !idle.isEmpty())
            .map(idle -> OptimizationAction.builder()
                .action(OptimizationAction.ActionType.IDLE_WORKERS_DETECTED)
                .idleQueues(idle)
                .recommendation("Consider reducing worker allocation for idle queues")
                .build());
    }

    /**
     * Fixed hour-of-day heuristic: warn one hour before the usual peaks
     */
    OptimizationAction applyPredictiveScaling() {
        int hour = LocalTime.now(clock).getHour();
        if (!peakConfig.getApproachingHours().contains(hour)) {
            return null;
        }

        return OptimizationAction.builder()
            .action(OptimizationAction.ActionType.PREDICTIVE_SCALING)
            .reason("peak_hours_approaching")
            .recommendation("Prepare for increased load in the next hour")
            .build();
    }

    static String estimatePerformanceImprovement(List<OptimizationAction> actions) {
        return actions.isEmpty() ? "No optimizations needed" : "5-15% improvement expected";
    }
}
