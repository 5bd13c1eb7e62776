package com.whereq.triage.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Health of a single queue as computed by one analysis cycle
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueHealthReport {
    private QueueTier queue;
    private QueueStatistics stats;
    private PerformanceMetrics performance;

    /**
     * Composite score in [0,1]
     */
    private double healthScore;

    private List<String> recommendations;
}
