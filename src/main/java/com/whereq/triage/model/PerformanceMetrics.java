package com.whereq.triage.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Derived performance of one queue
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceMetrics {

    /**
     * Jobs completed during the last hour
     */
    private double throughput;

    private double successRate;

    private double failureRate;

    /**
     * Age in seconds of the oldest pending job
     */
    private double avgLatency;

    private double workerEfficiency;

    private ResponseTimePercentiles responseTimePercentiles;

    /**
     * Metrics reported for a queue that has never seen a job
     */
    public static PerformanceMetrics defaults() {
        return PerformanceMetrics.builder()
            .throughput(0)
            .successRate(1.0)
            .failureRate(0.0)
            .avgLatency(0)
            .workerEfficiency(0.8)
            .responseTimePercentiles(ResponseTimePercentiles.ZERO)
            .build();
    }
}
