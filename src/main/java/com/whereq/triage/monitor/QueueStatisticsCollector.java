package com.whereq.triage.monitor;

import com.whereq.triage.config.TriageProperties;
import com.whereq.triage.model.JobState;
import com.whereq.triage.model.QueueStatistics;
import com.whereq.triage.model.QueueTier;
import com.whereq.triage.store.JobFilter;
import com.whereq.triage.store.JobStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Reads per-queue aggregates from the job store. Nothing is cached; every call hits the store.
 */
@Slf4j
@Component
public class QueueStatisticsCollector {

    private static final Duration PROCESSING_TIME_WINDOW = Duration.ofHours(1);

    private final JobStore jobStore;
    private final Clock clock;
    private final int processingTimeSample;

    public QueueStatisticsCollector(JobStore jobStore, Clock clock, TriageProperties properties) {
        this.jobStore = jobStore;
        this.clock = clock;
        this.processingTimeSample = properties.getStore().getProcessingTimeSample();
    }

    /**
     * Collect statistics of one queue
     *
     * @param queue the queue
     * @return Mono with the statistics; missing data reads as zero
     */
    public Mono<QueueStatistics> getQueueStatistics(QueueTier queue) {
        Instant now = clock.instant();

        return Mono.zip(
                jobStore.countJobs(queue, JobFilter.any()).defaultIfEmpty(0L),
                jobStore.countJobs(queue, JobFilter.inState(JobState.PENDING)).defaultIfEmpty(0L),
                jobStore.countJobs(queue, JobFilter.inState(JobState.RUNNING)).defaultIfEmpty(0L),
                jobStore.countJobs(queue, JobFilter.inState(JobState.FAILED)).defaultIfEmpty(0L),
                jobStore.countJobs(queue, JobFilter.inState(JobState.COMPLETED)).defaultIfEmpty(0L),
                averageProcessingTime(queue, now),
                queueLatency(queue, now))
            .map(counts -> QueueStatistics.builder()
                .totalJobs(counts.getT1())
                .pendingJobs(counts.getT2())
                .runningJobs(counts.getT3())
                .failedJobs(counts.getT4())
                .completedJobs(counts.getT5())
                .avgProcessingTime(counts.getT6())
                .queueLatency(counts.getT7())
                .build())
            .doOnNext(stats -> log.debug("Statistics for {}: {}", queue, stats));
    }

    /**
     * Mean processing time in seconds of jobs completed during the last hour
     */
    private Mono<Double> averageProcessingTime(QueueTier queue, Instant now) {
        return jobStore.processingTimes(queue, now.minus(PROCESSING_TIME_WINDOW), processingTimeSample)
            .map(duration -> duration.toMillis() / 1000.0)
            .collectList()
            .map(times -> times.stream().mapToDouble(Double::doubleValue).average().orElse(0.0));
    }

    /**
     * Age in seconds of the oldest pending job, 0 when nothing is pending
     */
    private Mono<Double> queueLatency(QueueTier queue, Instant now) {
        return jobStore.oldestPendingSince(queue)
            .map(oldest -> Math.max(Duration.between(oldest, now).toMillis(), 0) / 1000.0)
            .defaultIfEmpty(0.0);
    }
}
