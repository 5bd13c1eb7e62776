package com.whereq.triage.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response time percentiles in seconds
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResponseTimePercentiles {
    public static final ResponseTimePercentiles ZERO = new ResponseTimePercentiles(0.0, 0.0, 0.0);

    private double p50;
    private double p95;
    private double p99;
}
