package com.pharmascope.helix.orchestration;

import com.pharmascope.helix.resilience.CircuitState;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Catalog entry for one registered agent.
 */
@Value
@Builder
public class AgentDescriptor {
    String name;
    String displayName;
    boolean enabled;
    boolean supportsFallback;
    Duration timeout;
    CircuitState circuitState;
}
