package com.pharmascope.helix.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * Envelope around one agent's analysis output.
 * The payload schema belongs to the agent; orchestration only copies it.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class AgentResult {

    /**
     * Name of the agent that produced the result.
     */
    String agentName;

    /**
     * Coarse quality marker.
     */
    QualityFlag quality;

    /**
     * Confidence in [0, 1].
     */
    double confidence;

    /**
     * Where the data came from.
     */
    DataSource source;

    /**
     * When the result was generated.
     */
    Instant generatedAt;

    /**
     * Agent-specific key/value bag.
     */
    @Singular("payloadEntry")
    Map<String, Object> payload;

    public AgentResult withSource(DataSource newSource) {
        return toBuilder().source(newSource).build();
    }
}
