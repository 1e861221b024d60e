package com.pharmascope.helix.domain.model;

/**
 * Result of writing a task update to the job state store.
 */
public enum TaskUpdateOutcome {
    ACCEPTED,
    LATE_UPDATE     // Task or job already terminal, update discarded
}
