package com.whereq.triage.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Combined output of one periodic analysis and optimisation cycle
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OptimizationCycleReport {
    private PerformanceAnalysis performanceAnalysis;
    private OptimizationResult optimizationResults;
    private Instant timestamp;
}
