package com.pharmascope.helix.domain.model;

import com.pharmascope.helix.exception.ErrorCode;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Structured explanation for an agent that contributed no result.
 */
@Value
@Builder
@Jacksonized
public class FailureNote {
    AgentTaskStatus status;
    AgentErrorKind kind;
    ErrorCode code;
    String message;
}
