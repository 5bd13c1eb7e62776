package com.whereq.triage.monitor;

import com.whereq.triage.model.HealthStatus;
import com.whereq.triage.model.JobState;
import com.whereq.triage.model.PerformanceAnalysis;
import com.whereq.triage.model.PerformanceMetrics;
import com.whereq.triage.model.QueueHealthReport;
import com.whereq.triage.model.QueueStatistics;
import com.whereq.triage.model.QueueTier;
import com.whereq.triage.model.ResponseTimePercentiles;
import com.whereq.triage.model.SystemHealth;
import com.whereq.triage.store.JobFilter;
import com.whereq.triage.store.JobStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Per-queue performance and health analysis, plus the system-wide aggregate.
 */
@Slf4j
@Component
public class QueuePerformanceAnalyzer {

    private static final Duration THROUGHPUT_WINDOW = Duration.ofHours(1);
    private static final Duration PERCENTILE_WINDOW = Duration.ofHours(24);

    private static final double SUCCESS_WEIGHT = 0.3;
    private static final double LOW_FAILURE_WEIGHT = 0.2;
    private static final double LATENCY_WEIGHT = 0.3;
    private static final double EFFICIENCY_WEIGHT = 0.2;

    private static final double DEFAULT_EFFICIENCY = 0.8;
    private static final double MIN_EFFICIENCY = 0.1;

    private static final double SYSTEM_HEALTH_TARGET = 0.7;
    private static final double QUEUE_ATTENTION_THRESHOLD = 0.6;

    private final JobStore jobStore;
    private final QueueStatisticsCollector statisticsCollector;
    private final Clock clock;

    public QueuePerformanceAnalyzer(JobStore jobStore,
                                    QueueStatisticsCollector statisticsCollector,
                                    Clock clock) {
        this.jobStore = jobStore;
        this.statisticsCollector = statisticsCollector;
        this.clock = clock;
    }

    /**
     * Analyse every queue independently and aggregate the result
     *
     * @return Mono with the full analysis
     */
    public Mono<PerformanceAnalysis> analyzeQueuePerformance() {
        return Flux.fromIterable(Arrays.asList(QueueTier.values()))
            .concatMap(this::analyzeQueue)
            .collectList()
            .map(reports -> {
                Map<QueueTier, QueueHealthReport> byQueue = new EnumMap<>(QueueTier.class);
                reports.forEach(report -> byQueue.put(report.getQueue(), report));

                return PerformanceAnalysis.builder()
                    .individualQueues(byQueue)
                    .overallHealth(calculateOverallSystemHealth(reports))
                    .systemRecommendations(generateSystemRecommendations(reports))
                    .analysisTimestamp(clock.instant())
                    .build();
            });
    }

    /**
     * Health report of a single queue
     *
     * @param queue the queue
     * @return Mono with the report
     */
    public Mono<QueueHealthReport> analyzeQueue(QueueTier queue) {
        return statisticsCollector.getQueueStatistics(queue)
            .flatMap(stats -> calculateQueuePerformance(queue, stats)
                .map(performance -> QueueHealthReport.builder()
                    .queue(queue)
                    .stats(stats)
                    .performance(performance)
                    .healthScore(calculateQueueHealthScore(performance))
                    .recommendations(generateQueueRecommendations(performance))
                    .build()));
    }

    /**
     * Derive performance metrics from statistics; a queue without jobs gets the defaults
     */
    public Mono<PerformanceMetrics> calculateQueuePerformance(QueueTier queue, QueueStatistics stats) {
        if (stats.getTotalJobs() == 0) {
            return Mono.just(PerformanceMetrics.defaults());
        }

        Instant now = clock.instant();

        return Mono.zip(
                calculateThroughput(queue, now),
                calculateResponseTimePercentiles(queue, now))
            .map(tuple -> {
                PerformanceMetrics performance = performanceFromStatistics(stats);
                performance.setThroughput(tuple.getT1());
                performance.setResponseTimePercentiles(tuple.getT2());
                return performance;
            });
    }

    /**
     * Metrics that follow from the statistics alone. Throughput and percentiles are left at zero.
     */
    static PerformanceMetrics performanceFromStatistics(QueueStatistics stats) {
        long totalJobs = stats.getTotalJobs();
        if (totalJobs == 0) {
            return PerformanceMetrics.defaults();
        }

        return PerformanceMetrics.builder()
            .throughput(0)
            .successRate((double) stats.getCompletedJobs() / totalJobs)
            .failureRate((double) stats.getFailedJobs() / totalJobs)
            .avgLatency(stats.getQueueLatency())
            .workerEfficiency(calculateWorkerEfficiency(stats))
            .responseTimePercentiles(ResponseTimePercentiles.ZERO)
            .build();
    }

    /**
     * Health score computed straight from statistics, with no further store reads.
     * Equal to the score of the full metrics, which throughput and percentiles do not affect.
     */
    public static double calculateQueueHealthScore(QueueStatistics stats) {
        return calculateQueueHealthScore(performanceFromStatistics(stats));
    }

    /**
     * Composite health in [0,1]. Inputs are clamped to their valid ranges first.
     */
    public static double calculateQueueHealthScore(PerformanceMetrics performance) {
        double successRate = clamp(performance.getSuccessRate());
        double failureRate = clamp(performance.getFailureRate());
        double latencyScore = calculateLatencyScore(performance.getAvgLatency());
        double efficiency = clamp(performance.getWorkerEfficiency());

        return SUCCESS_WEIGHT * successRate
            + LOW_FAILURE_WEIGHT * (1 - failureRate)
            + LATENCY_WEIGHT * latencyScore
            + EFFICIENCY_WEIGHT * efficiency;
    }

    static double calculateLatencyScore(double latencySeconds) {
        if (latencySeconds <= 30) {
            return 1.0;
        } else if (latencySeconds <= 120) {
            return 0.8;
        } else if (latencySeconds <= 300) {
            return 0.6;
        } else if (latencySeconds <= 600) {
            return 0.4;
        }
        return 0.2;
    }

    static double calculateWorkerEfficiency(QueueStatistics stats) {
        if (stats.getAvgProcessingTime() == 0) {
            return DEFAULT_EFFICIENCY;
        }
        return Math.max(1.0 - stats.getQueueLatency() / 3600.0, MIN_EFFICIENCY);
    }

    static List<String> generateQueueRecommendations(PerformanceMetrics performance) {
        List<String> recommendations = new ArrayList<>();

        if (performance.getFailureRate() > 0.05) {
            recommendations.add("High failure rate detected - investigate error patterns");
        }
        if (performance.getAvgLatency() > 300) {
            recommendations.add("High latency - consider increasing worker capacity");
        }
        if (performance.getWorkerEfficiency() < 0.6) {
            recommendations.add("Low worker efficiency - optimize job processing logic");
        }
        if (performance.getThroughput() < 10) {
            recommendations.add("Low throughput - review queue configuration");
        }

        return recommendations;
    }

    static SystemHealth calculateOverallSystemHealth(List<QueueHealthReport> reports) {
        double average = averageHealth(reports);

        return SystemHealth.builder()
            .overallScore(average)
            .status(HealthStatus.fromScore(average))
            .worstPerformingQueue(reports.stream()
                .min(Comparator.comparingDouble(QueueHealthReport::getHealthScore))
                .map(QueueHealthReport::getQueue)
                .orElse(null))
            .bestPerformingQueue(reports.stream()
                .max(Comparator.comparingDouble(QueueHealthReport::getHealthScore))
                .map(QueueHealthReport::getQueue)
                .orElse(null))
            .build();
    }

    static List<String> generateSystemRecommendations(List<QueueHealthReport> reports) {
        List<String> recommendations = new ArrayList<>();

        if (averageHealth(reports) < SYSTEM_HEALTH_TARGET) {
            recommendations.add("System health below optimal - consider scaling up resources");
        }

        long needingAttention = reports.stream()
            .filter(report -> report.getHealthScore() < QUEUE_ATTENTION_THRESHOLD)
            .count();
        if (needingAttention > 0) {
            recommendations.add(needingAttention + " queues need attention");
        }

        return recommendations;
    }

    /**
     * Nearest-rank percentile over an ascending list
     */
    static double percentile(List<Double> sorted, int percentile) {
        if (sorted.isEmpty()) {
            return 0.0;
        }
        int index = (int) Math.ceil(percentile / 100.0 * sorted.size()) - 1;
        return sorted.get(Math.max(index, 0));
    }

    private Mono<Double> calculateThroughput(QueueTier queue, Instant now) {
        return jobStore.countJobs(queue, JobFilter.finishedSince(JobState.COMPLETED, now.minus(THROUGHPUT_WINDOW)))
            .defaultIfEmpty(0L)
            .map(Long::doubleValue);
    }

    private Mono<ResponseTimePercentiles> calculateResponseTimePercentiles(QueueTier queue, Instant now) {
        return jobStore.processingTimes(queue, now.minus(PERCENTILE_WINDOW), Integer.MAX_VALUE)
            .map(duration -> duration.toMillis() / 1000.0)
            .sort()
            .collectList()
            .map(times -> times.isEmpty()
                ? ResponseTimePercentiles.ZERO
                : ResponseTimePercentiles.builder()
                    .p50(percentile(times, 50))
                    .p95(percentile(times, 95))
                    .p99(percentile(times, 99))
                    .build());
    }

    private static double averageHealth(List<QueueHealthReport> reports) {
        return reports.stream()
            .mapToDouble(QueueHealthReport::getHealthScore)
            .average()
            .orElse(0.0);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(value, 1.0));
    }
}
