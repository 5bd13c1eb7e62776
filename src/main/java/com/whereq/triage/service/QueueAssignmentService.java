package com.whereq.triage.service;

import com.whereq.triage.classifier.QueueClassifier;
import com.whereq.triage.config.QueueTierCatalog;
import com.whereq.triage.estimator.ComplexityEstimator;
import com.whereq.triage.metrics.QueueMetrics;
import com.whereq.triage.model.QueueAdjustment;
import com.whereq.triage.model.QueueAssignment;
import com.whereq.triage.model.QueueTier;
import com.whereq.triage.model.QueuedJob;
import com.whereq.triage.model.RequestedPriority;
import com.whereq.triage.model.SubmissionPreconditions;
import com.whereq.triage.model.SubmissionRequest;
import com.whereq.triage.monitor.QueueLoadMonitor;
import com.whereq.triage.monitor.ScalingAdvisor;
import com.whereq.triage.priority.PriorityCalculator;
import com.whereq.triage.priority.ProcessingTimeEstimator;
import com.whereq.triage.store.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Places analysis jobs on the best queue: estimate, classify, prioritise, delay,
 * redirect away from overload, then enqueue.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueueAssignmentService {

    private static final double MB = 1024.0 * 1024.0;

    private final ComplexityEstimator complexityEstimator;
    private final QueueClassifier queueClassifier;
    private final PriorityCalculator priorityCalculator;
    private final ProcessingTimeEstimator processingTimeEstimator;
    private final QueueLoadMonitor loadMonitor;
    private final ScalingAdvisor scalingAdvisor;
    private final QueueTierCatalog catalog;
    private final JobStore jobStore;
    private final QueueMetrics queueMetrics;
    private final Clock clock;

    /**
     * Assign a queue to an analysis request and enqueue the job
     *
     * @param request the submission
     * @return Mono with the assignment
     */
    public Mono<QueueAssignment> enqueueAnalysis(SubmissionRequest request) {
        return Mono.defer(() -> {
            Instant start = clock.instant();

            SubmissionPreconditions.checkFileSize(request.getFileSize());
            SubmissionPreconditions.checkUserTier(request.getUserTier());

            long fileSize = request.getFileSize();
            double complexity = complexityEstimator.estimateComplexity(
                fileSize, request.getFileName(), request.getSimilarFileHistory());
            RequestedPriority requestedPriority = request.getRequestedPriority() == null
                ? RequestedPriority.NORMAL
                : request.getRequestedPriority();

            log.info("Intelligent queue assignment: file_size={}MB, complexity={}, user_tier={}",
                String.format("%.2f", fileSize / MB), String.format("%.3f", complexity),
                request.getUserTier().wireName());

            QueueTier queue = queueClassifier.determineOptimalQueue(fileSize, complexity, request.getUserTier());
            int priority = priorityCalculator.calculatePriorityScore(
                fileSize, complexity, request.getUserTier(), requestedPriority);

            return priorityCalculator.calculateOptimalDelay(queue)
                .zipWith(loadMonitor.adjustQueueIfNeeded(queue, fileSize, request.getUserTier()))
                .flatMap(decision -> {
                    long delaySeconds = decision.getT1();
                    QueueAdjustment adjustment = decision.getT2();
                    QueueTier finalQueue = adjustment.getQueue();

                    log.info("Queue assignment: {} (priority: {}, wait: {}s, adjustment: {})",
                        finalQueue, priority, delaySeconds, adjustment.getReason().wireName());

                    QueuedJob job = QueuedJob.builder()
                        .jobId(generateJobId())
                        .fileId(request.getFileId())
                        .userId(request.getUserId())
                        .queue(finalQueue)
                        .priority(priority)
                        .delaySeconds(delaySeconds)
                        .timeout(catalog.get(finalQueue).getTimeout())
                        .enqueuedAt(start)
                        .availableAt(start.plusSeconds(delaySeconds))
                        .build();

                    return jobStore.enqueue(job)
                        .flatMap(jobId -> scalingAdvisor.monitorAndScale(finalQueue)
                            .onErrorResume(e -> {
                                log.warn("Scaling check on {} failed after job {} was enqueued: {}",
                                    finalQueue, jobId, e.getMessage());
                                return Mono.empty();
                            })
                            .then(Mono.fromSupplier(() -> QueueAssignment.builder()
                                .jobId(jobId)
                                .queue(finalQueue)
                                .priority(priority)
                                .delaySeconds(delaySeconds)
                                .estimatedProcessingTime(
                                    processingTimeEstimator.estimateProcessingTime(fileSize, complexity))
                                .estimatedComplexity(complexity)
                                .assignmentTime(Duration.between(start, clock.instant()))
                                .queueAdjustment(adjustment)
                                .build())));
                })
                .doOnNext(assignment -> {
                    queueMetrics.recordAssignment(assignment);
                    log.info("Queue assignment completed: {}", assignment);
                });
        })
        .doOnError(e -> log.error("Queue assignment failed for file {}: {}", request.getFileId(), e.getMessage()));
    }

    private String generateJobId() {
        return "job-" + UUID.randomUUID();
    }
}
