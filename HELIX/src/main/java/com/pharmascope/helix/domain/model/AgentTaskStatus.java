package com.pharmascope.helix.domain.model;

/**
 * Sub-status of a single (job, agent) execution record.
 */
public enum AgentTaskStatus {
    QUEUED,         // Created with the job, not yet dispatched
    RUNNING,        // Live or fallback call in flight
    SUCCEEDED,      // Live result recorded
    FAILED,         // No usable result
    FALLBACK_USED,  // Degraded result recorded
    TIMED_OUT;      // Still outstanding when the job deadline elapsed

    public boolean isTerminal() {
        return this != QUEUED && this != RUNNING;
    }

    /**
     * Whether the task contributes a result to the report coverage.
     */
    public boolean isUsable() {
        return this == SUCCEEDED || this == FALLBACK_USED;
    }
}
