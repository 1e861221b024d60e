package com.pharmascope.helix.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregated outcome of a settled job.
 */
@Value
@Builder
@Jacksonized
public class Report {

    String jobId;

    String query;

    /**
     * Agent name to settled entry, in request order.
     */
    Map<String, ReportEntry> entries;

    /**
     * Usable agents over requested agents, in [0, 1].
     */
    double coverageRatio;

    CompositeStatus compositeStatus;

    int requested;

    int succeeded;

    int fallbackUsed;

    int failed;

    Instant generatedAt;
}
