package com.pharmascope.helix.domain.model;

/**
 * Overall job lifecycle: {@code PENDING -> RUNNING -> COMPLETED | PARTIAL | FAILED}.
 */
public enum JobStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    PARTIAL,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == PARTIAL || this == FAILED;
    }

    /**
     * Transitions only move forward; terminal states accept nothing.
     */
    public boolean canTransitionTo(JobStatus next) {
        return switch (this) {
            case PENDING -> next == RUNNING || next.isTerminal();
            case RUNNING -> next.isTerminal();
            case COMPLETED, PARTIAL, FAILED -> false;
        };
    }

    public static JobStatus fromComposite(CompositeStatus compositeStatus) {
        return switch (compositeStatus) {
            case COMPLETE -> COMPLETED;
            case PARTIAL -> PARTIAL;
            case FAILED -> FAILED;
        };
    }
}
