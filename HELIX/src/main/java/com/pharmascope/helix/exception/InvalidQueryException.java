package com.pharmascope.helix.exception;

/**
 * Submission rejected before any job was created.
 */
public class InvalidQueryException extends OrchestrationException {

    public InvalidQueryException(String message) {
        super(ErrorCode.INVALID_QUERY, message);
    }
}
