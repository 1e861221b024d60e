package com.pharmascope.helix.exception;

/**
 * Base class for failures surfaced to callers of the orchestrator.
 */
public class OrchestrationException extends RuntimeException {

    private final ErrorCode errorCode;

    public OrchestrationException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
