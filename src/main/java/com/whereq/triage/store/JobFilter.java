package com.whereq.triage.store;

import com.whereq.triage.model.JobState;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Selects the jobs of one queue to count
 */
@Value
@Builder
public class JobFilter {

    /**
     * State to match; null matches every state
     */
    JobState state;

    /**
     * Only count finished jobs whose finish time is at or after this instant
     */
    Instant finishedSince;

    public static JobFilter any() {
        return JobFilter.builder().build();
    }

    public static JobFilter inState(JobState state) {
        return JobFilter.builder().state(state).build();
    }

    public static JobFilter finishedSince(JobState state, Instant since) {
        return JobFilter.builder().state(state).finishedSince(since).build();
    }
}
