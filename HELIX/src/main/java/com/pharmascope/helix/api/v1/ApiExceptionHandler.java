package com.pharmascope.helix.api.v1;

import com.pharmascope.helix.api.dto.ErrorResponse;
import com.pharmascope.helix.exception.ErrorCode;
import com.pharmascope.helix.exception.OrchestrationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Maps orchestration failures to the API error body.
 */
@RestControllerAdvice(basePackages = "com.pharmascope.helix.api")
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(OrchestrationException.class)
    public ResponseEntity<ErrorResponse> handleOrchestrationException(OrchestrationException ex,
                                                                      ServerHttpRequest request) {
        log.debug("{} on {}: {}", ex.getErrorCode(), request.getPath(), ex.getMessage());
        return respond(ex.getErrorCode(), ex.getMessage(), request);
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> handleValidation(WebExchangeBindException ex, ServerHttpRequest request) {
        String message = ex.getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        return respond(ErrorCode.INVALID_QUERY, message, request);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(ServerWebInputException ex, ServerHttpRequest request) {
        return respond(ErrorCode.INVALID_QUERY, "Malformed request body", request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, ServerHttpRequest request) {
        log.error("Unexpected error on {}: {}", request.getPath(), ex.getMessage(), ex);
        return respond(ErrorCode.INTERNAL_ERROR, "Internal error", request);
    }

    private ResponseEntity<ErrorResponse> respond(ErrorCode code, String message, ServerHttpRequest request) {
        ErrorResponse body = ErrorResponse.builder()
                .code(code)
                .message(message)
                .path(request.getPath().value())
                .timestamp(Instant.now())
                .build();
        return ResponseEntity.status(code.getHttpStatus()).body(body);
    }
}
