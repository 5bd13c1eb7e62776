package com.whereq.triage.controller;

import com.whereq.triage.model.JobState;
import com.whereq.triage.model.QueueTier;
import com.whereq.triage.model.QueuedJob;
import com.whereq.triage.store.InMemoryJobStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

class WorkerCallbackControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-02T03:00:00Z");

    private InMemoryJobStore jobStore;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        jobStore = new InMemoryJobStore(Clock.fixed(NOW, ZoneId.of("Asia/Seoul")));
        client = WebTestClient.bindToController(new WorkerCallbackController(jobStore)).build();
    }

    @Test
    void dequeueClaimsHighestPriorityReadyJob() {
        enqueue("job-low", QueueTier.FAST_PROCESSING, 40, NOW.minusSeconds(60), NOW.minusSeconds(60));
        enqueue("job-high", QueueTier.FAST_PROCESSING, 90, NOW.minusSeconds(10), NOW.minusSeconds(10));
        enqueue("job-delayed", QueueTier.FAST_PROCESSING, 150, NOW.minusSeconds(5), NOW.plusSeconds(10));

        client.post().uri("/api/v1/queues/fast_processing/dequeue")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.jobId").isEqualTo("job-high")
            .jsonPath("$.state").isEqualTo("RUNNING");
    }

    @Test
    void equalPriorityIsServedInArrivalOrder() {
        enqueue("job-second", QueueTier.FAST_PROCESSING, 60, NOW.minusSeconds(10), NOW.minusSeconds(10));
        enqueue("job-first", QueueTier.FAST_PROCESSING, 60, NOW.minusSeconds(20), NOW.minusSeconds(20));

        client.post().uri("/api/v1/queues/fast_processing/dequeue")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.jobId").isEqualTo("job-first");
    }

    @Test
    void emptyQueueHasNoContent() {
        client.post().uri("/api/v1/queues/heavy_processing/dequeue")
            .exchange()
            .expectStatus().isNoContent();
    }

    @Test
    void unknownQueueIsNotFound() {
        client.post().uri("/api/v1/queues/mystery/dequeue")
            .exchange()
            .expectStatus().isNotFound();
    }

    @Test
    void completionIsRecordedOnce() {
        enqueue("job-1", QueueTier.INSTANT_PROCESSING, 60, NOW.minusSeconds(5), NOW.minusSeconds(5));

        client.post().uri("/api/v1/jobs/job-1/complete")
            .exchange()
            .expectStatus().isNoContent();
        assertThat(jobStore.jobsOn(QueueTier.INSTANT_PROCESSING).get(0).getState()).isEqualTo(JobState.COMPLETED);

        client.post().uri("/api/v1/jobs/job-1/complete")
            .exchange()
            .expectStatus().isEqualTo(409);
    }

    @Test
    void failureWithMessage() {
        enqueue("job-2", QueueTier.INSTANT_PROCESSING, 60, NOW.minusSeconds(5), NOW.minusSeconds(5));

        client.post().uri("/api/v1/jobs/job-2/fail")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"errorMessage\":\"Corrupted workbook\"}")
            .exchange()
            .expectStatus().isNoContent();

        assertThat(jobStore.jobsOn(QueueTier.INSTANT_PROCESSING).get(0).getState()).isEqualTo(JobState.FAILED);
    }

    @Test
    void outcomeForUnknownJobIsNotFound() {
        client.post().uri("/api/v1/jobs/ghost/complete")
            .exchange()
            .expectStatus().isNotFound();
    }

    private void enqueue(String jobId, QueueTier queue, int priority, Instant enqueuedAt, Instant availableAt) {
        jobStore.enqueue(QueuedJob.builder()
            .jobId(jobId)
            .queue(queue)
            .priority(priority)
            .enqueuedAt(enqueuedAt)
            .availableAt(availableAt)
            .build()).block();
    }
}
