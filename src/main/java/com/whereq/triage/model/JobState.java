package com.whereq.triage.model;

/**
 * Lifecycle of a job inside the job store
 *
 * State transitions:
 * PENDING → RUNNING → {COMPLETED, FAILED}
 */
public enum JobState {
    /**
     * Enqueued, waiting for its delay to elapse and a worker to claim it
     */
    PENDING,

    /**
     * Claimed by a worker
     */
    RUNNING,

    /**
     * Finished successfully
     */
    COMPLETED,

    /**
     * Finished with an error
     */
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
