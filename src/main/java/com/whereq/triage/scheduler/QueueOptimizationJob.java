package com.whereq.triage.scheduler;

import com.whereq.triage.alert.HealthAlertNotifier;
import com.whereq.triage.metrics.QueueMetrics;
import com.whereq.triage.model.OptimizationCycleReport;
import com.whereq.triage.model.QueueTier;
import com.whereq.triage.monitor.QueueLoadMonitor;
import com.whereq.triage.monitor.QueueOptimizer;
import com.whereq.triage.monitor.QueuePerformanceAnalyzer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Arrays;

/**
 * Periodic queue analysis and optimisation, run outside the request path.
 * Overlapping cycles are harmless: reads are idempotent and every action is advisory.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "triage.optimizer", name = "enabled", havingValue = "true", matchIfMissing = true)
public class QueueOptimizationJob {

    private final QueuePerformanceAnalyzer performanceAnalyzer;
    private final QueueOptimizer queueOptimizer;
    private final QueueLoadMonitor loadMonitor;
    private final QueueMetrics queueMetrics;
    private final HealthAlertNotifier alertNotifier;
    private final Clock clock;

    @Scheduled(fixedRateString = "${triage.optimizer.interval:PT5M}",
        initialDelayString = "${triage.optimizer.initial-delay:PT30S}")
    public void perform() {
        log.info("Running intelligent queue optimization");

        runCycle()
            .subscribe(
                report -> log.info("Queue optimization completed: {} optimizations, overall health: {}",
                    report.getOptimizationResults().getOptimizationsApplied().size(),
                    report.getPerformanceAnalysis().getOverallHealth().getStatus().wireName()),
                error -> log.error("Queue optimization cycle failed", error));
    }

    /**
     * Analyse, optimise, refresh gauges and publish the report
     *
     * @return Mono with the cycle report
     */
    public Mono<OptimizationCycleReport> runCycle() {
        return performanceAnalyzer.analyzeQueuePerformance()
            .flatMap(analysis -> queueOptimizer.optimizeQueueAssignments()
                .map(optimization -> OptimizationCycleReport.builder()
                    .performanceAnalysis(analysis)
                    .optimizationResults(optimization)
                    .timestamp(clock.instant())
                    .build()))
            .flatMap(report -> refreshLoadGauges()
                .doOnSuccess(v -> queueMetrics.recordHealth(report.getPerformanceAnalysis()))
                .then(alertNotifier.publishReport(report.getPerformanceAnalysis(), report.getOptimizationResults()))
                .thenReturn(report));
    }

    private Mono<Void> refreshLoadGauges() {
        return Flux.fromIterable(Arrays.asList(QueueTier.values()))
            .concatMap(queue -> loadMonitor.getQueueCurrentLoad(queue)
                .doOnNext(load -> queueMetrics.recordLoad(queue, load)))
            .then();
    }
}
