package com.pharmascope.helix.agent;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Arguments of a single agent call.
 */
@Value
@Builder
public class AgentInvocation {

    String jobId;

    String agentName;

    String query;

    /**
     * Agent-specific options, never null.
     */
    @Builder.Default
    Map<String, Object> options = Map.of();

    /**
     * Absolute instant the agent must settle by.
     */
    Instant deadline;

    /**
     * Time left before the deadline, never negative.
     */
    public Duration remaining() {
        Duration left = Duration.between(Instant.now(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public Object option(String key, Object defaultValue) {
        Object value = options.get(key);
        return value != null ? value : defaultValue;
    }
}
