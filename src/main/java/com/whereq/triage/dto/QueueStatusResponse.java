package com.whereq.triage.dto;

import com.whereq.triage.model.QueueStatistics;
import com.whereq.triage.model.QueueTier;
import com.whereq.triage.model.TierLimits;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Current statistics and load of one queue
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueStatusResponse {
    private QueueTier queue;
    private QueueStatistics stats;
    private double loadFactor;
    private TierLimits limits;
}
