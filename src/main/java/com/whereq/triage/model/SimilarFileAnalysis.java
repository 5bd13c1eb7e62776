package com.whereq.triage.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A past analysis of a file, used to estimate the complexity of a new one
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SimilarFileAnalysis {
    /**
     * Size of the analysed file in bytes
     */
    private long fileSize;

    /**
     * AI tier the analysis ended up using (1 = cheapest)
     */
    private double aiTierUsed;
}
