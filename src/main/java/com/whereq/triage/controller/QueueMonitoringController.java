package com.whereq.triage.controller;

import com.whereq.triage.config.QueueTierCatalog;
import com.whereq.triage.dto.QueueStatusResponse;
import com.whereq.triage.model.OptimizationResult;
import com.whereq.triage.model.PerformanceAnalysis;
import com.whereq.triage.model.QueueTier;
import com.whereq.triage.monitor.QueueLoadMonitor;
import com.whereq.triage.monitor.QueueOptimizer;
import com.whereq.triage.monitor.QueuePerformanceAnalyzer;
import com.whereq.triage.monitor.QueueStatisticsCollector;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Read-only queue monitoring and on-demand optimisation
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/queues")
@RequiredArgsConstructor
@Tag(name = "Queues", description = "Queue statistics, health analysis and optimisation advice")
public class QueueMonitoringController {

    private final QueueStatisticsCollector statisticsCollector;
    private final QueuePerformanceAnalyzer performanceAnalyzer;
    private final QueueOptimizer queueOptimizer;
    private final QueueTierCatalog catalog;

    @GetMapping("/performance")
    @Operation(summary = "Queue performance", description = "Per-queue health and the system-wide aggregate")
    public Mono<PerformanceAnalysis> performance() {
        return performanceAnalyzer.analyzeQueuePerformance();
    }

    @PostMapping("/optimize")
    @Operation(summary = "Run optimisation", description = "Run one advisory optimisation pass now")
    public Mono<OptimizationResult> optimize() {
        log.info("Manual queue optimization requested");
        return queueOptimizer.optimizeQueueAssignments();
    }

    @GetMapping("/{queue}/stats")
    @Operation(summary = "Queue statistics", description = "Current statistics and load factor of one queue")
    public Mono<ResponseEntity<QueueStatusResponse>> stats(@PathVariable("queue") String queueName) {
        return QueueTier.fromQueueName(queueName)
            .map(queue -> statisticsCollector.getQueueStatistics(queue)
                .map(stats -> ResponseEntity.ok(QueueStatusResponse.builder()
                    .queue(queue)
                    .stats(stats)
                    .loadFactor(QueueLoadMonitor.calculateLoad(stats, catalog.get(queue)))
                    .limits(catalog.get(queue))
                    .build())))
            .orElseGet(() -> {
                log.debug("Statistics requested for unknown queue {}", queueName);
                return Mono.just(ResponseEntity.notFound().build());
            });
    }
}
