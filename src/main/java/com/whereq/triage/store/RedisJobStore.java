package com.whereq.triage.store;

import com.whereq.triage.config.TriageProperties;
import com.whereq.triage.model.JobState;
import com.whereq.triage.model.QueueTier;
import com.whereq.triage.model.QueuedJob;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.connection.ReactiveRedisConnection;
import org.springframework.data.redis.core.ReactiveHashOperations;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Redis-backed job store.
 *
 * Layout per queue:
 * pending ZSET scored by enqueue time, ranked ZSET holding the same members in dequeue order,
 * running SET, completed and failed ZSETs scored by finish time,
 * and a durations ZSET ("jobId:millis") scored by finish time. Job fields live in a hash per job.
 */
@Slf4j
@Service
public class RedisJobStore implements JobStore {

    private static final String JOB_KEY_PREFIX = "triage:job:";
    private static final String QUEUE_KEY_PREFIX = "triage:queue:";

    /**
     * Pending jobs inspected per dequeue attempt
     */
    private static final long DEQUEUE_WINDOW = 50;

    /**
     * Ranked score is -priority * PRIORITY_STEP + enqueue millis: higher priority first, then oldest.
     * Exact in a double for priorities up to 200 and epoch millis below 1e13.
     */
    private static final double PRIORITY_STEP = 1e13;

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ReactiveHashOperations<String, String, String> hashOps;
    private final Clock clock;
    private final Duration retention;

    public RedisJobStore(ReactiveRedisTemplate<String, String> redisTemplate,
                         Clock clock,
                         TriageProperties properties) {
        this.redisTemplate = redisTemplate;
        this.hashOps = redisTemplate.opsForHash();
        this.clock = clock;
        this.retention = properties.getStore().getRetention();
    }

    @Override
    public Mono<Long> countJobs(QueueTier queue, JobFilter filter) {
        JobState state = filter.getState();
        if (state == null) {
            return Flux.merge(
                    countPending(queue),
                    countRunning(queue),
                    countFinished(queue, JobState.COMPLETED, filter.getFinishedSince()),
                    countFinished(queue, JobState.FAILED, filter.getFinishedSince()))
                .reduce(0L, Long::sum);
        }

        return switch (state) {
            case PENDING -> countPending(queue);
            case RUNNING -> countRunning(queue);
            case COMPLETED, FAILED -> countFinished(queue, state, filter.getFinishedSince());
        };
    }

    @Override
    public Mono<Instant> oldestPendingSince(QueueTier queue) {
        return redisTemplate.opsForZSet()
            .rangeWithScores(pendingKey(queue), Range.closed(0L, 0L))
            .next()
            .map(tuple -> Instant.ofEpochMilli(tuple.getScore().longValue()));
    }

    @Override
    public Flux<Duration> processingTimes(QueueTier queue, Instant since, int limit) {
        return redisTemplate.opsForZSet()
            .reverseRangeByScore(durationsKey(queue), sinceRange(since))
            .take(limit)
            .flatMap(member -> {
                int separator = member.lastIndexOf(':');
                try {
                    return Mono.just(Duration.ofMillis(Long.parseLong(member.substring(separator + 1))));
                } catch (NumberFormatException | IndexOutOfBoundsException e) {
                    log.warn("Skipping malformed duration entry {} on queue {}", member, queue);
                    return Mono.empty();
                }
            });
    }

    @Override
    public Mono<String> enqueue(QueuedJob job) {
        Map<String, String> fields = toHash(job);

        return hashOps.putAll(jobKey(job.getJobId()), fields)
            .then(redisTemplate.opsForZSet()
                .add(pendingKey(job.getQueue()), job.getJobId(), job.getEnqueuedAt().toEpochMilli()))
            .then(redisTemplate.opsForZSet()
                .add(rankedKey(job.getQueue()), job.getJobId(), rankScore(job)))
            .doOnSuccess(added -> log.info("Enqueued job {} on {} (priority {}, available at {})",
                job.getJobId(), job.getQueue(), job.getPriority(), job.getAvailableAt()))
            .thenReturn(job.getJobId());
    }

    @Override
    public Mono<QueuedJob> dequeue(QueueTier queue) {
        Instant now = clock.instant();

        return redisTemplate.opsForZSet()
            .range(rankedKey(queue), Range.closed(0L, DEQUEUE_WINDOW - 1))
            .concatMap(this::loadJob)
            .filter(job -> job.getAvailableAt() == null || !job.getAvailableAt().isAfter(now))
            .concatMap(job -> claim(queue, job, now))
            .next();
    }

    @Override
    public Mono<Void> markCompleted(String jobId) {
        return finish(jobId, JobState.COMPLETED, null);
    }

    @Override
    public Mono<Void> markFailed(String jobId, String errorMessage) {
        return finish(jobId, JobState.FAILED, errorMessage);
    }

    @Override
    public Mono<Boolean> ping() {
        return Mono.usingWhen(
            Mono.fromSupplier(() -> redisTemplate.getConnectionFactory().getReactiveConnection()),
            connection -> connection.ping().map("PONG"::equalsIgnoreCase),
            ReactiveRedisConnection::closeLater);
    }

    /**
     * Remove the job from the ranked set; only the caller that removes it owns it
     */
    private Mono<QueuedJob> claim(QueueTier queue, QueuedJob job, Instant now) {
        return redisTemplate.opsForZSet()
            .remove(rankedKey(queue), job.getJobId())
            .filter(removed -> removed > 0)
            .flatMap(removed -> {
                job.setState(JobState.RUNNING);
                return redisTemplate.opsForZSet().remove(pendingKey(queue), job.getJobId())
                    .then(hashOps.putAll(jobKey(job.getJobId()), Map.of(
                        "state", JobState.RUNNING.name(),
                        "startedAt", now.toString())))
                    .then(redisTemplate.opsForSet().add(runningKey(queue), job.getJobId()))
                    .doOnSuccess(v -> log.info("Job {} claimed from {}", job.getJobId(), queue))
                    .thenReturn(job);
            });
    }

    private Mono<Void> finish(String jobId, JobState outcome, String errorMessage) {
        Instant finishedAt = clock.instant();

        return loadJob(jobId)
            .switchIfEmpty(Mono.error(new IllegalArgumentException("Job not found: " + jobId)))
            .flatMap(job -> {
                if (job.getState().isTerminal()) {
                    return Mono.error(new IllegalStateException(
                        "Job " + jobId + " already finished as " + job.getState()));
                }

                QueueTier queue = job.getQueue();
                long finishedMillis = finishedAt.toEpochMilli();
                long processingMillis = Math.max(
                    Duration.between(job.getEnqueuedAt(), finishedAt).toMillis(), 0);

                Map<String, String> updates = new HashMap<>();
                updates.put("state", outcome.name());
                updates.put("finishedAt", finishedAt.toString());
                if (errorMessage != null) {
                    updates.put("errorMessage", errorMessage);
                }

                Mono<Boolean> recordDuration = outcome == JobState.COMPLETED
                    ? redisTemplate.opsForZSet().add(durationsKey(queue),
                        jobId + ":" + processingMillis, finishedMillis)
                    : Mono.just(true);

                return hashOps.putAll(jobKey(jobId), updates)
                    .then(redisTemplate.expire(jobKey(jobId), retention))
                    .then(redisTemplate.opsForZSet().remove(pendingKey(queue), jobId))
                    .then(redisTemplate.opsForZSet().remove(rankedKey(queue), jobId))
                    .then(redisTemplate.opsForSet().remove(runningKey(queue), jobId))
                    .then(redisTemplate.opsForZSet().add(finishedKey(queue, outcome), jobId, finishedMillis))
                    .then(recordDuration)
                    .then(prune(queue, finishedAt))
                    .doOnSuccess(v -> log.info("Job {} on {} finished as {} after {} ms",
                        jobId, queue, outcome, processingMillis));
            });
    }

    /**
     * Drop finished entries older than the retention window
     */
    private Mono<Void> prune(QueueTier queue, Instant now) {
        Range<Double> expired = Range.rightOpen(0d,
            (double) now.minus(retention).toEpochMilli());

        return Flux.merge(
                redisTemplate.opsForZSet().removeRangeByScore(finishedKey(queue, JobState.COMPLETED), expired),
                redisTemplate.opsForZSet().removeRangeByScore(finishedKey(queue, JobState.FAILED), expired),
                redisTemplate.opsForZSet().removeRangeByScore(durationsKey(queue), expired))
            .reduce(0L, Long::sum)
            .doOnNext(removed -> {
                if (removed > 0) {
                    log.debug("Pruned {} expired entries from {}", removed, queue);
                }
            })
            .then();
    }

    private Mono<Long> countPending(QueueTier queue) {
        return redisTemplate.opsForZSet().size(pendingKey(queue)).defaultIfEmpty(0L);
    }

    private Mono<Long> countRunning(QueueTier queue) {
        return redisTemplate.opsForSet().size(runningKey(queue)).defaultIfEmpty(0L);
    }

    private Mono<Long> countFinished(QueueTier queue, JobState state, Instant since) {
        String key = finishedKey(queue, state);
        Mono<Long> count = since == null
            ? redisTemplate.opsForZSet().size(key)
            : redisTemplate.opsForZSet().count(key, sinceRange(since));
        return count.defaultIfEmpty(0L);
    }

    private Mono<QueuedJob> loadJob(String jobId) {
        return hashOps.entries(jobKey(jobId))
            .collectMap(Map.Entry::getKey, Map.Entry::getValue)
            .filter(fields -> !fields.isEmpty())
            .map(fields -> fromHash(jobId, fields));
    }

    private static Map<String, String> toHash(QueuedJob job) {
        Map<String, String> fields = new HashMap<>();
        fields.put("queue", job.getQueue().getQueueName());
        fields.put("priority", String.valueOf(job.getPriority()));
        fields.put("delaySeconds", String.valueOf(job.getDelaySeconds()));
        fields.put("enqueuedAt", job.getEnqueuedAt().toString());
        fields.put("availableAt", job.getAvailableAt().toString());
        fields.put("state", job.getState().name());
        if (job.getFileId() != null) {
            fields.put("fileId", job.getFileId());
        }
        if (job.getUserId() != null) {
            fields.put("userId", job.getUserId());
        }
        if (job.getTimeout() != null) {
            fields.put("timeout", job.getTimeout().toString());
        }
        return fields;
    }

    private static QueuedJob fromHash(String jobId, Map<String, String> fields) {
        return QueuedJob.builder()
            .jobId(jobId)
            .fileId(fields.get("fileId"))
            .userId(fields.get("userId"))
            .queue(QueueTier.fromQueueName(fields.get("queue")).orElse(null))
            .priority(Integer.parseInt(fields.getOrDefault("priority", "0")))
            .delaySeconds(Long.parseLong(fields.getOrDefault("delaySeconds", "0")))
            .timeout(fields.containsKey("timeout") ? Duration.parse(fields.get("timeout")) : null)
            .enqueuedAt(Instant.parse(fields.get("enqueuedAt")))
            .availableAt(fields.containsKey("availableAt") ? Instant.parse(fields.get("availableAt")) : null)
            .state(JobState.valueOf(fields.getOrDefault("state", JobState.PENDING.name())))
            .build();
    }

    static double rankScore(QueuedJob job) {
        return -job.getPriority() * PRIORITY_STEP + job.getEnqueuedAt().toEpochMilli();
    }

    private static Range<Double> sinceRange(Instant since) {
        return Range.rightUnbounded(Range.Bound.inclusive((double) since.toEpochMilli()));
    }

    private static String jobKey(String jobId) {
        return JOB_KEY_PREFIX + jobId;
    }

    private static String pendingKey(QueueTier queue) {
        return QUEUE_KEY_PREFIX + queue.getQueueName() + ":pending";
    }

    private static String rankedKey(QueueTier queue) {
        return QUEUE_KEY_PREFIX + queue.getQueueName() + ":ranked";
    }

    private static String runningKey(QueueTier queue) {
        return QUEUE_KEY_PREFIX + queue.getQueueName() + ":running";
    }

    private static String durationsKey(QueueTier queue) {
        return QUEUE_KEY_PREFIX + queue.getQueueName() + ":durations";
    }

    private static String finishedKey(QueueTier queue, JobState state) {
        return QUEUE_KEY_PREFIX + queue.getQueueName() + ":" + state.name().toLowerCase();
    }
}
