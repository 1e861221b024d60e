package com.pharmascope.helix.orchestration;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * A research request as accepted by the orchestrator.
 */
@Value
@Builder
public class AnalysisCommand {

    String query;

    /**
     * Explicit agent subset; null or empty to use the analysis type or the default subset.
     */
    List<String> agents;

    /**
     * Preset name, e.g. {@code patent_focus}. Unknown values mean comprehensive.
     */
    String analysisType;

    /**
     * Options per agent name.
     */
    Map<String, Map<String, Object>> agentOptions;
}
