package com.pharmascope.helix.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One agent's slot in a report: exactly one of {@code result} or {@code failure} is set.
 */
@Value
@Builder
@Jacksonized
public class ReportEntry {
    String agentName;
    AgentTaskStatus status;
    DataSource source;
    AgentResult result;
    FailureNote failure;

    @JsonIgnore
    public boolean isUsable() {
        return result != null;
    }
}
