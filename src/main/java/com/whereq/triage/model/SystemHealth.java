package com.whereq.triage.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * System-wide health aggregated over all queues
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SystemHealth {
    private double overallScore;
    private HealthStatus status;
    private QueueTier worstPerformingQueue;
    private QueueTier bestPerformingQueue;
}
