package com.pharmascope.helix.api.dto;

import com.pharmascope.helix.domain.model.AgentTask;
import com.pharmascope.helix.domain.model.AgentTaskStatus;
import com.pharmascope.helix.domain.model.DataSource;
import com.pharmascope.helix.domain.model.Job;
import com.pharmascope.helix.domain.model.JobStatus;
import com.pharmascope.helix.exception.ErrorCode;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Polling view of a job: overall status plus one entry per requested agent.
 */
@Value
@Builder
public class JobStatusResponse {
    String jobId;
    String query;
    JobStatus status;
    double progressFraction;
    List<AgentStatus> perAgent;
    List<String> errors;
    Instant createdAt;
    Instant updatedAt;
    Instant deadline;
    boolean reportAvailable;

    @Value
    @Builder
    public static class AgentStatus {
        String name;
        AgentTaskStatus subStatus;
        DataSource source;
        Instant startedAt;
        Instant finishedAt;
        ErrorCode errorCode;
        String errorMessage;

        static AgentStatus from(AgentTask task) {
            return AgentStatus.builder()
                    .name(task.getAgentName())
                    .subStatus(task.getStatus())
                    .source(task.getSource())
                    .startedAt(task.getStartedAt())
                    .finishedAt(task.getFinishedAt())
                    .errorCode(task.getErrorCode())
                    .errorMessage(task.getErrorMessage())
                    .build();
        }
    }

    public static JobStatusResponse from(Job job) {
        return JobStatusResponse.builder()
                .jobId(job.getId())
                .query(job.getQuery())
                .status(job.getStatus())
                .progressFraction(job.progressFraction())
                .perAgent(job.getTasks().values().stream()
                        .map(AgentStatus::from)
                        .collect(Collectors.toList()))
                .errors(job.getErrors())
                .createdAt(job.getCreatedAt())
                .updatedAt(job.getUpdatedAt())
                .deadline(job.getDeadline())
                .reportAvailable(job.getReport() != null)
                .build();
    }
}
