package com.pharmascope.helix.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pharmascope.helix.domain.model.AgentTask;
import com.pharmascope.helix.domain.model.Job;
import com.pharmascope.helix.domain.model.Report;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Machine-parseable lifecycle events for research jobs.
 */
@Component
@Slf4j
public class StructuredLogger {

    public static final String MDC_JOB_ID = "jobId";
    public static final String MDC_AGENT_NAME = "agentName";

    private final ObjectMapper objectMapper;

    public StructuredLogger(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void logJobSubmitted(Job job) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("jobId", job.getId());
        data.put("analysisType", job.getAnalysisType());
        data.put("agents", job.getRequestedAgents());
        data.put("deadline", job.getDeadline().toString());
        logEvent("job.submitted", data);
    }

    public void logAgentSettled(String jobId, AgentTask task) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("jobId", jobId);
        data.put("agentName", task.getAgentName());
        data.put("status", task.getStatus());
        data.put("source", task.getSource());
        if (task.getStartedAt() != null && task.getFinishedAt() != null) {
            data.put("durationMs", Duration.between(task.getStartedAt(), task.getFinishedAt()).toMillis());
        }
        if (task.getErrorCode() != null) {
            data.put("errorCode", task.getErrorCode());
        }
        MDC.put(MDC_AGENT_NAME, task.getAgentName());
        try {
            logEvent("agent.settled", data);
        } finally {
            MDC.remove(MDC_AGENT_NAME);
        }
    }

    public void logJobSettled(Job job, Report report) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("jobId", job.getId());
        data.put("compositeStatus", report.getCompositeStatus());
        data.put("coverageRatio", report.getCoverageRatio());
        data.put("succeeded", report.getSucceeded());
        data.put("fallbackUsed", report.getFallbackUsed());
        data.put("failed", report.getFailed());
        data.put("durationMs", Duration.between(job.getCreatedAt(), report.getGeneratedAt()).toMillis());
        logEvent("job.settled", data);
    }

    private void logEvent(String eventType, Map<String, Object> data) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("event", eventType);
        event.put("timestamp", Instant.now().toString());
        event.put("service", "helix");
        event.putAll(data);

        Object jobId = data.get("jobId");
        if (jobId != null) {
            MDC.put(MDC_JOB_ID, jobId.toString());
        }
        try {
            log.info(objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            log.info("event={} data={}", eventType, data);
        } finally {
            MDC.remove(MDC_JOB_ID);
        }
    }
}
