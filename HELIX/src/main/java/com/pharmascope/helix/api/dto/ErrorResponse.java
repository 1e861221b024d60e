package com.pharmascope.helix.api.dto;

import com.pharmascope.helix.exception.ErrorCode;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class ErrorResponse {
    ErrorCode code;
    String message;
    String path;
    Instant timestamp;
}
