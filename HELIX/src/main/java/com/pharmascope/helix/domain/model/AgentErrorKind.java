package com.pharmascope.helix.domain.model;

import com.pharmascope.helix.exception.ErrorCode;

/**
 * Failure categories an agent may report.
 */
public enum AgentErrorKind {
    TIMEOUT(ErrorCode.AGENT_TIMEOUT),
    UPSTREAM_ERROR(ErrorCode.AGENT_UPSTREAM_ERROR),
    INVALID_INPUT(ErrorCode.AGENT_INTERNAL_ERROR),
    INTERNAL(ErrorCode.AGENT_INTERNAL_ERROR);

    private final ErrorCode errorCode;

    AgentErrorKind(ErrorCode errorCode) {
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * Whether the failure says something about the upstream source and should move its breaker.
     */
    public boolean countsAgainstBreaker() {
        return this != INVALID_INPUT;
    }

    /**
     * Whether the dispatcher should retry on the fallback path.
     */
    public boolean isFallbackEligible() {
        return this == TIMEOUT || this == UPSTREAM_ERROR;
    }
}
