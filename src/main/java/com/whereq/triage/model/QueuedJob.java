package com.whereq.triage.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Analysis job payload handed to the job store
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueuedJob {
    /**
     * Unique job identifier
     */
    private String jobId;

    /**
     * Uploaded file to analyse
     */
    private String fileId;

    /**
     * User who submitted the file
     */
    private String userId;

    private QueueTier queue;

    private int priority;

    private long delaySeconds;

    /**
     * Tier timeout passed on to the worker; null means unbounded
     */
    private Duration timeout;

    /**
     * When the job was enqueued
     */
    private Instant enqueuedAt;

    /**
     * Earliest time a worker may claim the job
     */
    private Instant availableAt;

    @Builder.Default
    private JobState state = JobState.PENDING;
}
