package com.whereq.triage.controller;

import com.whereq.triage.dto.JobFailureRequest;
import com.whereq.triage.model.QueueTier;
import com.whereq.triage.model.QueuedJob;
import com.whereq.triage.store.JobStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Endpoints used by the worker fleet to claim jobs and report their outcome
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Tag(name = "Workers", description = "Job claim and completion callbacks")
public class WorkerCallbackController {

    private final JobStore jobStore;

    @PostMapping("/queues/{queue}/dequeue")
    @Operation(summary = "Claim job", description = "Claim the highest priority ready job of a queue")
    public Mono<ResponseEntity<QueuedJob>> dequeue(@PathVariable("queue") String queueName) {
        return QueueTier.fromQueueName(queueName)
            .map(queue -> jobStore.dequeue(queue)
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.noContent().build()))
            .orElseGet(() -> Mono.just(ResponseEntity.notFound().build()));
    }

    @PostMapping("/jobs/{jobId}/complete")
    @Operation(summary = "Complete job", description = "Record successful completion")
    public Mono<ResponseEntity<Void>> complete(@PathVariable String jobId) {
        return handleOutcome(jobId, jobStore.markCompleted(jobId));
    }

    @PostMapping("/jobs/{jobId}/fail")
    @Operation(summary = "Fail job", description = "Record failure with the worker's error message")
    public Mono<ResponseEntity<Void>> fail(@PathVariable String jobId,
                                           @RequestBody(required = false) JobFailureRequest request) {
        String errorMessage = request == null ? null : request.getErrorMessage();
        return handleOutcome(jobId, jobStore.markFailed(jobId, errorMessage));
    }

    private Mono<ResponseEntity<Void>> handleOutcome(String jobId, Mono<Void> outcome) {
        return outcome
            .then(Mono.just(ResponseEntity.noContent().<Void>build()))
            .onErrorResume(IllegalArgumentException.class, e -> {
                log.warn("Outcome reported for unknown job {}", jobId);
                return Mono.just(ResponseEntity.notFound().build());
            })
            .onErrorResume(IllegalStateException.class, e -> {
                log.warn("Invalid outcome for job {}: {}", jobId, e.getMessage());
                return Mono.just(ResponseEntity.status(HttpStatus.CONFLICT).build());
            });
    }
}
