package com.whereq.triage.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Locale;

/**
 * One advisory action produced by the optimisation pass. Nothing here is applied automatically.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OptimizationAction {

    private ActionType action;

    /**
     * Congested queue, for congestion alerts
     */
    private QueueTier queue;

    private Long pendingJobs;

    /**
     * Idle queues, for idle worker detection
     */
    private List<QueueTier> idleQueues;

    private String reason;

    private String recommendation;

    public enum ActionType {
        CONGESTION_ALERT,
        IDLE_WORKERS_DETECTED,
        PREDICTIVE_SCALING;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
