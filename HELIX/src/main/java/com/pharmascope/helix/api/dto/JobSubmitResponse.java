package com.pharmascope.helix.api.dto;

import com.pharmascope.helix.domain.model.AnalysisType;
import com.pharmascope.helix.domain.model.Job;
import com.pharmascope.helix.domain.model.JobStatus;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

@Value
@Builder
@Jacksonized
public class JobSubmitResponse {
    String jobId;
    JobStatus status;
    AnalysisType analysisType;
    List<String> requestedAgents;
    Instant createdAt;
    Instant deadline;
    String statusUrl;
    String reportUrl;

    public static JobSubmitResponse from(Job job, String basePath) {
        String statusUrl = basePath + "/" + job.getId();
        return JobSubmitResponse.builder()
                .jobId(job.getId())
                .status(job.getStatus())
                .analysisType(job.getAnalysisType())
                .requestedAgents(job.getRequestedAgents())
                .createdAt(job.getCreatedAt())
                .deadline(job.getDeadline())
                .statusUrl(statusUrl)
                .reportUrl(statusUrl + "/report")
                .build();
    }
}
