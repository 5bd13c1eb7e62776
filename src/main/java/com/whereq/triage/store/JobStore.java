package com.whereq.triage.store;

import com.whereq.triage.model.QueueTier;
import com.whereq.triage.model.QueuedJob;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;

/**
 * Durable job queue the analysis jobs are handed to.
 * Reads return zero or empty when there is nothing to report; errors are only raised when the store itself fails.
 */
public interface JobStore {

    /**
     * Count the jobs of a queue
     *
     * @param queue the queue
     * @param filter which jobs to count
     * @return Mono with the count, 0 when nothing matches
     */
    Mono<Long> countJobs(QueueTier queue, JobFilter filter);

    /**
     * Creation time of the oldest pending job
     *
     * @param queue the queue
     * @return Mono with the instant, empty when nothing is pending
     */
    Mono<Instant> oldestPendingSince(QueueTier queue);

    /**
     * Created-to-finished durations of jobs completed since the given instant, newest first
     *
     * @param queue the queue
     * @param since lower bound of the finish time
     * @param limit maximum number of durations
     * @return Flux of durations
     */
    Flux<Duration> processingTimes(QueueTier queue, Instant since, int limit);

    /**
     * Enqueue a job
     *
     * @param job the job to enqueue
     * @return Mono with the job handle
     */
    Mono<String> enqueue(QueuedJob job);

    /**
     * Claim the highest priority job whose delay has elapsed and mark it running
     *
     * @param queue the queue
     * @return Mono with the claimed job, empty when nothing is ready
     */
    Mono<QueuedJob> dequeue(QueueTier queue);

    /**
     * Record successful completion of a job
     *
     * @param jobId the job identifier
     * @return Mono that completes when recorded
     */
    Mono<Void> markCompleted(String jobId);

    /**
     * Record failure of a job
     *
     * @param jobId the job identifier
     * @param errorMessage reason reported by the worker
     * @return Mono that completes when recorded
     */
    Mono<Void> markFailed(String jobId, String errorMessage);

    /**
     * Check that the store answers
     *
     * @return Mono with true when reachable
     */
    Mono<Boolean> ping();
}
