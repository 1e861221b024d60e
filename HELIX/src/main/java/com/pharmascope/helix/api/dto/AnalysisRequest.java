package com.pharmascope.helix.api.dto;

import com.pharmascope.helix.orchestration.AnalysisCommand;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Request DTO for submitting a research analysis.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisRequest {

    @NotBlank(message = "Query is required")
    private String query;

    /**
     * Explicit agent subset. Takes precedence over {@link #analysisType}.
     */
    private List<String> agents;

    private String analysisType;

    private Map<String, Map<String, Object>> agentOptions;

    public AnalysisCommand toCommand() {
        return AnalysisCommand.builder()
                .query(query)
                .agents(agents)
                .analysisType(analysisType)
                .agentOptions(agentOptions)
                .build();
    }
}
