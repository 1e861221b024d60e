package com.pharmascope.helix.orchestration;

import com.pharmascope.helix.domain.model.JobStatus;
import com.pharmascope.helix.resilience.BreakerSnapshot;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of breaker states and job counts.
 */
@Value
@Builder
public class EngineDiagnostics {
    List<BreakerSnapshot> circuitBreakers;
    Map<JobStatus, Long> jobsByStatus;
    Instant generatedAt;
}
