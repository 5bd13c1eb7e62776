package com.whereq.triage.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.List;

/**
 * Result of one optimisation pass
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OptimizationResult {
    private List<OptimizationAction> optimizationsApplied;
    private Duration optimizationTime;
    private String performanceImprovement;
}
