package com.whereq.triage.monitor;

import com.whereq.triage.config.TriageProperties;
import com.whereq.triage.model.OptimizationAction;
import com.whereq.triage.model.QueueStatistics;
import com.whereq.triage.model.QueueTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class QueueOptimizerTest {

    private static final ZoneId SEOUL = ZoneId.of("Asia/Seoul");
    // 12:00 local
    private static final Clock MIDDAY = Clock.fixed(Instant.parse("2026-03-02T03:00:00Z"), SEOUL);
    // 08:00 local
    private static final Clock BEFORE_MORNING_PEAK = Clock.fixed(Instant.parse("2026-03-01T23:00:00Z"), SEOUL);
    // 13:00 local
    private static final Clock BEFORE_AFTERNOON_PEAK = Clock.fixed(Instant.parse("2026-03-02T04:00:00Z"), SEOUL);

    private QueueLoadMonitor loadMonitor;
    private QueueStatisticsCollector statisticsCollector;

    @BeforeEach
    void setUp() {
        loadMonitor = mock(QueueLoadMonitor.class);
        statisticsCollector = mock(QueueStatisticsCollector.class);
        when(loadMonitor.getQueueCurrentLoad(any())).thenReturn(Mono.just(0.5));
        when(statisticsCollector.getQueueStatistics(any())).thenReturn(Mono.just(QueueStatistics.builder().build()));
    }

    private QueueOptimizer optimizer(Clock clock) {
        return new QueueOptimizer(loadMonitor, statisticsCollector, clock, new TriageProperties());
    }

    @Test
    void nothingToDoOnModerateLoadOffPeak() {
        StepVerifier.create(optimizer(MIDDAY).optimizeQueueAssignments())
            .assertNext(result -> {
                assertThat(result.getOptimizationsApplied()).isEmpty();
                assertThat(result.getPerformanceImprovement()).isEqualTo("No optimizations needed");
                assertThat(result.getOptimizationTime()).isNotNull();
            })
            .verifyComplete();
    }

    @Test
    void congestedQueueWithBacklogRaisesAlert() {
        when(loadMonitor.getQueueCurrentLoad(QueueTier.STANDARD_PROCESSING)).thenReturn(Mono.just(0.9));
        when(statisticsCollector.getQueueStatistics(QueueTier.STANDARD_PROCESSING))
            .thenReturn(Mono.just(QueueStatistics.builder().totalJobs(12).pendingJobs(8).runningJobs(4).build()));

        StepVerifier.create(optimizer(MIDDAY).identifyCongestedQueues())
            .assertNext(action -> {
                assertThat(action.getAction()).isEqualTo(OptimizationAction.ActionType.CONGESTION_ALERT);
                assertThat(action.getQueue()).isEqualTo(QueueTier.STANDARD_PROCESSING);
                assertThat(action.getPendingJobs()).isEqualTo(8L);
                assertThat(action.getRecommendation()).isEqualTo("Consider manual intervention or worker scaling");
            })
            .verifyComplete();
    }

    @Test
    void congestionWithSmallBacklogIsIgnored() {
        when(loadMonitor.getQueueCurrentLoad(QueueTier.ULTRA_HEAVY)).thenReturn(Mono.just(1.0));
        when(statisticsCollector.getQueueStatistics(QueueTier.ULTRA_HEAVY))
            .thenReturn(Mono.just(QueueStatistics.builder().totalJobs(5).pendingJobs(4).runningJobs(1).build()));

        StepVerifier.create(optimizer(MIDDAY).identifyCongestedQueues())
            .verifyComplete();
    }

    @Test
    void idleQueuesAreListedInOneAction() {
        when(loadMonitor.getQueueCurrentLoad(QueueTier.INSTANT_PROCESSING)).thenReturn(Mono.just(0.0));
        when(loadMonitor.getQueueCurrentLoad(QueueTier.HEAVY_PROCESSING)).thenReturn(Mono.just(0.1));
        when(loadMonitor.getQueueCurrentLoad(QueueTier.FAST_PROCESSING)).thenReturn(Mono.just(0.2));

        StepVerifier.create(optimizer(MIDDAY).detectIdleQueues())
            .assertNext(action -> {
                assertThat(action.getAction()).isEqualTo(OptimizationAction.ActionType.IDLE_WORKERS_DETECTED);
                assertThat(action.getIdleQueues())
                    .containsExactly(QueueTier.INSTANT_PROCESSING, QueueTier.HEAVY_PROCESSING);
            })
            .verifyComplete();
    }

    @Test
    void predictiveScalingOnlyBeforePeaks() {
        assertThat(optimizer(MIDDAY).applyPredictiveScaling()).isNull();

        OptimizationAction morning = optimizer(BEFORE_MORNING_PEAK).applyPredictiveScaling();
        assertThat(morning.getAction()).isEqualTo(OptimizationAction.ActionType.PREDICTIVE_SCALING);
        assertThat(morning.getReason()).isEqualTo("peak_hours_approaching");

        assertThat(optimizer(BEFORE_AFTERNOON_PEAK).applyPredictiveScaling()).isNotNull();
    }

    @Test
    void fullPassCombinesAllActions() {
        when(loadMonitor.getQueueCurrentLoad(QueueTier.STANDARD_PROCESSING)).thenReturn(Mono.just(0.95));
        when(loadMonitor.getQueueCurrentLoad(QueueTier.ULTRA_HEAVY)).thenReturn(Mono.just(0.0));
        when(statisticsCollector.getQueueStatistics(QueueTier.STANDARD_PROCESSING))
            .thenReturn(Mono.just(QueueStatistics.builder().totalJobs(20).pendingJobs(16).runningJobs(4).build()));

        StepVerifier.create(optimizer(BEFORE_MORNING_PEAK).optimizeQueueAssignments())
            .assertNext(result -> {
                assertThat(result.getOptimizationsApplied())
                    .extracting(OptimizationAction::getAction)
                    .containsExactly(
                        OptimizationAction.ActionType.CONGESTION_ALERT,
                        OptimizationAction.ActionType.IDLE_WORKERS_DETECTED,
                        OptimizationAction.ActionType.PREDICTIVE_SCALING);
                assertThat(result.getPerformanceImprovement()).isEqualTo("5-15% improvement expected");
            })
            .verifyComplete();
    }

    @Test
    void improvementEstimateDependsOnActions() {
        assertThat(QueueOptimizer.estimatePerformanceImprovement(List.of())).isEqualTo("No optimizations needed");
        assertThat(QueueOptimizer.estimatePerformanceImprovement(
            List.of(OptimizationAction.builder().build()))).isEqualTo("5-15% improvement expected");
    }
}
