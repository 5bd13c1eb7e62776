package com.whereq.triage.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Full report of one performance analysis cycle
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceAnalysis {
    private Map<QueueTier, QueueHealthReport> individualQueues;
    private SystemHealth overallHealth;
    private List<String> systemRecommendations;
    private Instant analysisTimestamp;
}
