package com.whereq.triage.store;

import com.whereq.triage.model.JobState;
import com.whereq.triage.model.QueueTier;
import com.whereq.triage.model.QueuedJob;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Job store test double keeping everything in memory.
 */
public class InMemoryJobStore implements JobStore {

    private final Map<String, StoredJob> jobs = new ConcurrentHashMap<>();
    private final AtomicInteger reads = new AtomicInteger();
    private final Clock clock;

    public InMemoryJobStore(Clock clock) {
        this.clock = clock;
    }

    /**
     * Add a job in the given state without going through enqueue
     */
    public String seed(QueueTier queue, JobState state, Instant enqueuedAt, Instant finishedAt) {
        String jobId = "seed-" + UUID.randomUUID();
        QueuedJob job = QueuedJob.builder()
            .jobId(jobId)
            .queue(queue)
            .enqueuedAt(enqueuedAt)
            .availableAt(enqueuedAt)
            .state(state)
            .build();
        jobs.put(jobId, new StoredJob(job, finishedAt));
        return jobId;
    }

    public void seedMany(QueueTier queue, JobState state, int count, Instant enqueuedAt, Instant finishedAt) {
        for (int i = 0; i < count; i++) {
            seed(queue, state, enqueuedAt, finishedAt);
        }
    }

    public List<QueuedJob> jobsOn(QueueTier queue) {
        return jobs.values().stream()
            .map(StoredJob::job)
            .filter(job -> job.getQueue() == queue)
            .collect(Collectors.toList());
    }

    public int readCount() {
        return reads.get();
    }

    @Override
    public Mono<Long> countJobs(QueueTier queue, JobFilter filter) {
        return Mono.fromSupplier(() -> {
            reads.incrementAndGet();
            return jobs.values().stream()
                .filter(stored -> stored.job().getQueue() == queue)
                .filter(stored -> filter.getState() == null || stored.job().getState() == filter.getState())
                .filter(stored -> filter.getFinishedSince() == null
                    || (stored.finishedAt() != null && !stored.finishedAt().isBefore(filter.getFinishedSince())))
                .count();
        });
    }

    @Override
    public Mono<Instant> oldestPendingSince(QueueTier queue) {
        return Mono.justOrEmpty(jobs.values().stream()
            .map(StoredJob::job)
            .filter(job -> job.getQueue() == queue && job.getState() == JobState.PENDING)
            .map(QueuedJob::getEnqueuedAt)
            .min(Comparator.naturalOrder()));
    }

    @Override
    public Flux<Duration> processingTimes(QueueTier queue, Instant since, int limit) {
        return Flux.fromIterable(jobs.values().stream()
            .filter(stored -> stored.job().getQueue() == queue)
            .filter(stored -> stored.job().getState() == JobState.COMPLETED)
            .filter(stored -> stored.finishedAt() != null && !stored.finishedAt().isBefore(since))
            .sorted(Comparator.comparing(StoredJob::finishedAt).reversed())
            .limit(limit)
            .map(stored -> Duration.between(stored.job().getEnqueuedAt(), stored.finishedAt()))
            .collect(Collectors.toList()));
    }

    @Override
    public Mono<String> enqueue(QueuedJob job) {
        return Mono.fromSupplier(() -> {
            jobs.put(job.getJobId(), new StoredJob(job, null));
            return job.getJobId();
        });
    }

    @Override
    public Mono<QueuedJob> dequeue(QueueTier queue) {
        Instant now = clock.instant();
        return Mono.justOrEmpty(jobs.values().stream()
            .map(StoredJob::job)
            .filter(job -> job.getQueue() == queue && job.getState() == JobState.PENDING)
            .filter(job -> !job.getAvailableAt().isAfter(now))
            .min(Comparator.comparingInt(QueuedJob::getPriority).reversed()
                .thenComparing(QueuedJob::getEnqueuedAt))
            .map(job -> {
                job.setState(JobState.RUNNING);
                return job;
            }));
    }

    @Override
    public Mono<Void> markCompleted(String jobId) {
        return finish(jobId, JobState.COMPLETED);
    }

    @Override
    public Mono<Void> markFailed(String jobId, String errorMessage) {
        return finish(jobId, JobState.FAILED);
    }

    @Override
    public Mono<Boolean> ping() {
        return Mono.just(true);
    }

    private Mono<Void> finish(String jobId, JobState outcome) {
        return Mono.defer(() -> {
            StoredJob stored = jobs.get(jobId);
            if (stored == null) {
                return Mono.error(new IllegalArgumentException("Job not found: " + jobId));
            }
            if (stored.job().getState().isTerminal()) {
                return Mono.error(new IllegalStateException("Job " + jobId + " already finished"));
            }
            stored.job().setState(outcome);
            jobs.put(jobId, new StoredJob(stored.job(), clock.instant()));
            return Mono.empty();
        });
    }

    private static final class StoredJob {
        private final QueuedJob job;
        private final Instant finishedAt;

        StoredJob(QueuedJob job, Instant finishedAt) {
            this.job = job;
            this.finishedAt = finishedAt;
        }

        QueuedJob job() {
            return job;
        }

        Instant finishedAt() {
            return finishedAt;
        }
    }
}
