package com.pharmascope.helix.domain.model;

/**
 * Job-level outcome derived from the per-agent outcomes.
 */
public enum CompositeStatus {
    COMPLETE,
    PARTIAL,
    FAILED;

    /**
     * Classifies a coverage ratio: FAILED only at zero, COMPLETE only at one.
     */
    public static CompositeStatus fromCoverage(double coverageRatio) {
        if (coverageRatio <= 0.0) {
            return FAILED;
        }
        return coverageRatio >= 1.0 ? COMPLETE : PARTIAL;
    }
}
