package com.whereq.triage.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Point-in-time aggregate of one queue, read from the job store on every call
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueStatistics {

    private long totalJobs;

    /**
     * Jobs waiting for a worker
     */
    private long pendingJobs;

    /**
     * Jobs currently held by a worker; used as the busy worker count
     */
    private long runningJobs;

    private long failedJobs;

    private long completedJobs;

    /**
     * Mean created-to-finished time in seconds over the last hour
     */
    private double avgProcessingTime;

    /**
     * Age in seconds of the oldest pending job
     */
    private double queueLatency;
}
