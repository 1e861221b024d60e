package com.pharmascope.helix.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;

/**
 * Breaker state as reported by diagnostics.
 */
public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN;

    static CircuitState of(CircuitBreaker.State state) {
        return switch (state) {
            case CLOSED, DISABLED, METRICS_ONLY -> CLOSED;
            case HALF_OPEN -> HALF_OPEN;
            case OPEN, FORCED_OPEN -> OPEN;
        };
    }
}
