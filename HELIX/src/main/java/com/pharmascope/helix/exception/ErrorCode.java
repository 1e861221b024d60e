package com.pharmascope.helix.exception;

import org.springframework.http.HttpStatus;

/**
 * Error taxonomy for the orchestration engine.
 * Agent codes are recorded on tasks and never reach a caller as a response code.
 */
public enum ErrorCode {
    INVALID_QUERY(HttpStatus.BAD_REQUEST),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    NOT_READY(HttpStatus.CONFLICT),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR),
    AGENT_TIMEOUT(HttpStatus.GATEWAY_TIMEOUT),
    AGENT_UPSTREAM_ERROR(HttpStatus.BAD_GATEWAY),
    AGENT_INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR),
    LATE_UPDATE(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus httpStatus;

    ErrorCode(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
