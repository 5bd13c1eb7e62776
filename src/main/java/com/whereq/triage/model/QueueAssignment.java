package com.whereq.triage.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Result of one classification pass, returned to the caller after the job was enqueued
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueAssignment {
    /**
     * Handle returned by the job store
     */
    private String jobId;

    /**
     * Final queue, after any overload redirect
     */
    private QueueTier queue;

    /**
     * Priority score, 0..200
     */
    private int priority;

    private long delaySeconds;

    /**
     * Human readable estimate, e.g. "45초" or "2분"
     */
    private String estimatedProcessingTime;

    private double estimatedComplexity;

    /**
     * Time spent deciding and enqueueing
     */
    private Duration assignmentTime;

    private QueueAdjustment queueAdjustment;
}
