package com.whereq.triage.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of the overload check on a classified queue
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueueAdjustment {
    /**
     * Queue the job will actually be enqueued on
     */
    private QueueTier queue;

    private AdjustmentReason reason;

    /**
     * Classified queue, present only when the job was redirected
     */
    private QueueTier originalQueue;

    /**
     * Load of the classified queue at decision time
     */
    private double loadFactor;

    public static QueueAdjustment keep(QueueTier queue, double loadFactor) {
        return QueueAdjustment.builder()
            .queue(queue)
            .reason(AdjustmentReason.OPTIMAL_ASSIGNMENT)
            .loadFactor(loadFactor)
            .build();
    }

    public static QueueAdjustment redirect(QueueTier original, QueueTier alternative, double loadFactor) {
        return QueueAdjustment.builder()
            .queue(alternative)
            .reason(AdjustmentReason.ORIGINAL_QUEUE_OVERLOADED)
            .originalQueue(original)
            .loadFactor(loadFactor)
            .build();
    }

    public boolean isRedirected() {
        return reason == AdjustmentReason.ORIGINAL_QUEUE_OVERLOADED;
    }
}
