package com.whereq.triage.controller;

import com.whereq.triage.dto.AnalysisSubmitRequest;
import com.whereq.triage.dto.AnalysisSubmitResponse;
import com.whereq.triage.service.QueueAssignmentService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Clock;

/**
 * Controller for submitting Excel files to the analysis queues
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/analysis/jobs")
@RequiredArgsConstructor
@Tag(name = "Analysis jobs", description = "Queue assignment for Excel analysis jobs")
public class AnalysisJobController {

    private final QueueAssignmentService queueAssignmentService;
    private final Clock clock;

    /**
     * Submit a file for analysis
     *
     * @param request the submission
     * @return Mono with 202 Accepted and the queue assignment
     */
    @PostMapping
    @Operation(summary = "Submit analysis job", description = "Classify the file and enqueue it on the best queue")
    public Mono<ResponseEntity<AnalysisSubmitResponse>> submit(@Valid @RequestBody AnalysisSubmitRequest request) {
        log.info("Received analysis submission from user {}: file={}, size={}, tier={}",
            request.getUserId(), request.getFileName(), request.getFileSize(), request.getUserTier());

        return queueAssignmentService.enqueueAnalysis(request.toSubmission())
            .map(assignment -> ResponseEntity
                .status(HttpStatus.ACCEPTED)
                .location(URI.create("/api/v1/queues/" + assignment.getQueue().getQueueName() + "/stats"))
                .body(AnalysisSubmitResponse.accepted(assignment, clock.instant())))
            .onErrorResume(IllegalArgumentException.class, e -> {
                log.error("Validation error: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .badRequest()
                    .body(AnalysisSubmitResponse.error(e.getMessage(), clock.instant())));
            })
            .onErrorResume(Exception.class, e -> {
                log.error("Unexpected error during analysis submission", e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(AnalysisSubmitResponse.error("Internal server error: " + e.getMessage(), clock.instant())));
            });
    }
}
