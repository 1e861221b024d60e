package com.pharmascope.helix.resilience;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Point-in-time view of one agent's breaker.
 */
@Value
@Builder
public class BreakerSnapshot {
    String agentName;
    CircuitState state;
    int consecutiveFailures;
    Instant lastTransitionAt;
    Instant openUntil;          // Set while OPEN
    float failureRate;
}
