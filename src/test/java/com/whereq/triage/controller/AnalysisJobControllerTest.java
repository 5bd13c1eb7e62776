package com.whereq.triage.controller;

import com.whereq.triage.dto.AnalysisSubmitResponse;
import com.whereq.triage.exception.InvalidSubmissionException;
import com.whereq.triage.model.QueueAdjustment;
import com.whereq.triage.model.QueueAssignment;
import com.whereq.triage.model.QueueTier;
import com.whereq.triage.model.RequestedPriority;
import com.whereq.triage.model.SubmissionRequest;
import com.whereq.triage.model.UserTier;
import com.whereq.triage.service.QueueAssignmentService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AnalysisJobControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-02T03:00:00Z");

    private QueueAssignmentService queueAssignmentService;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        queueAssignmentService = mock(QueueAssignmentService.class);
        client = WebTestClient.bindToController(new AnalysisJobController(queueAssignmentService,
            Clock.fixed(NOW, ZoneId.of("Asia/Seoul")))).build();
    }

    @Test
    void acceptedSubmissionReturnsAssignment() {
        when(queueAssignmentService.enqueueAnalysis(any())).thenReturn(Mono.just(QueueAssignment.builder()
            .jobId("job-1")
            .queue(QueueTier.PRIORITY_PROCESSING)
            .priority(105)
            .delaySeconds(2)
            .estimatedProcessingTime("3분")
            .estimatedComplexity(0.75)
            .queueAdjustment(QueueAdjustment.keep(QueueTier.PRIORITY_PROCESSING, 0.4))
            .build()));

        client.post().uri("/api/v1/analysis/jobs")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"fileId\":\"f-1\",\"userId\":\"u-1\",\"fileName\":\"model.xlsx\","
                + "\"fileSize\":31457280,\"userTier\":\"pro\",\"requestedPriority\":\"high\"}")
            .exchange()
            .expectStatus().isAccepted()
            .expectHeader().valueEquals("Location", "/api/v1/queues/priority_processing/stats")
            .expectBody()
            .jsonPath("$.assignment.jobId").isEqualTo("job-1")
            .jsonPath("$.assignment.queue").isEqualTo("priority_processing")
            .jsonPath("$.assignment.priority").isEqualTo(105)
            .jsonPath("$.assignment.queueAdjustment.reason").isEqualTo("optimal_assignment")
            .jsonPath("$.submittedAt").exists()
            .jsonPath("$.errorMessage").doesNotExist();

        ArgumentCaptor<SubmissionRequest> captor = ArgumentCaptor.forClass(SubmissionRequest.class);
        verify(queueAssignmentService).enqueueAnalysis(captor.capture());
        assertThat(captor.getValue().getUserTier()).isEqualTo(UserTier.PRO);
        assertThat(captor.getValue().getRequestedPriority()).isEqualTo(RequestedPriority.HIGH);
        assertThat(captor.getValue().getFileSize()).isEqualTo(31457280L);
        assertThat(captor.getValue().getSimilarFileHistory()).isEmpty();
    }

    @Test
    void missingPriorityDefaultsToNormal() {
        when(queueAssignmentService.enqueueAnalysis(any())).thenReturn(Mono.just(QueueAssignment.builder()
            .jobId("job-2")
            .queue(QueueTier.INSTANT_PROCESSING)
            .queueAdjustment(QueueAdjustment.keep(QueueTier.INSTANT_PROCESSING, 0.0))
            .build()));

        client.post().uri("/api/v1/analysis/jobs")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"fileId\":\"f-2\",\"userId\":\"u-2\",\"fileName\":\"small.csv\","
                + "\"fileSize\":819200,\"userTier\":\"free\"}")
            .exchange()
            .expectStatus().isAccepted();

        ArgumentCaptor<SubmissionRequest> captor = ArgumentCaptor.forClass(SubmissionRequest.class);
        verify(queueAssignmentService).enqueueAnalysis(captor.capture());
        assertThat(captor.getValue().getRequestedPriority()).isEqualTo(RequestedPriority.NORMAL);
    }

    @Test
    void malformedRequestIsRejectedBeforeAssignment() {
        client.post().uri("/api/v1/analysis/jobs")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"fileId\":\"f-3\",\"userId\":\"u-3\",\"fileName\":\"x.xlsx\",\"fileSize\":0,\"userTier\":\"free\"}")
            .exchange()
            .expectStatus().isBadRequest();

        verify(queueAssignmentService, never()).enqueueAnalysis(any());
    }

    @Test
    void invalidSubmissionMapsToBadRequest() {
        when(queueAssignmentService.enqueueAnalysis(any()))
            .thenReturn(Mono.error(new InvalidSubmissionException("File size must be positive, got 0")));

        client.post().uri("/api/v1/analysis/jobs")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"fileId\":\"f-4\",\"userId\":\"u-4\",\"fileName\":\"x.xlsx\",\"fileSize\":10,\"userTier\":\"free\"}")
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.errorMessage").isEqualTo("File size must be positive, got 0");
    }

    @Test
    void storeFailureMapsToServerError() {
        when(queueAssignmentService.enqueueAnalysis(any()))
            .thenReturn(Mono.error(new IllegalStateException("Redis unavailable")));

        client.post().uri("/api/v1/analysis/jobs")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"fileId\":\"f-5\",\"userId\":\"u-5\",\"fileName\":\"x.xlsx\",\"fileSize\":10,\"userTier\":\"basic\"}")
            .exchange()
            .expectStatus().is5xxServerError()
            .expectBody(AnalysisSubmitResponse.class)
            .value(response -> {
                assertThat(response.getErrorMessage()).isEqualTo("Internal server error: Redis unavailable");
                assertThat(response.getSubmittedAt()).isEqualTo(NOW);
            });
    }
}
