package com.pharmascope.helix.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of one research job.
 * Stores replace whole snapshots, so readers never see a half-applied update.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Job {

    /**
     * Opaque job identifier.
     */
    String id;

    /**
     * Research query as submitted (trimmed).
     */
    String query;

    /**
     * Preset the agent subset was resolved from.
     */
    AnalysisType analysisType;

    /**
     * Requested agents in dispatch order, without duplicates.
     */
    List<String> requestedAgents;

    /**
     * Overall lifecycle status.
     */
    JobStatus status;

    /**
     * One task per requested agent, keyed by agent name, in request order.
     */
    Map<String, AgentTask> tasks;

    /**
     * Per-agent options passed through to the agents.
     */
    Map<String, Map<String, Object>> agentOptions;

    Instant createdAt;

    Instant updatedAt;

    /**
     * Absolute job-level deadline.
     */
    Instant deadline;

    /**
     * Final report, null until aggregation.
     */
    Report report;

    /**
     * Error summary lines, one per failed agent or job-level fault.
     */
    List<String> errors;

    public AgentTask getTask(String agentName) {
        return tasks.get(agentName);
    }

    public boolean allTasksTerminal() {
        return tasks.values().stream().allMatch(AgentTask::isTerminal);
    }

    public double progressFraction() {
        if (tasks.isEmpty()) {
            return 1.0;
        }
        long settled = tasks.values().stream().filter(AgentTask::isTerminal).count();
        return (double) settled / tasks.size();
    }

    /**
     * Copy with one task replaced. Task order is preserved.
     */
    public Job withTask(AgentTask task, Instant now) {
        Map<String, AgentTask> updated = new LinkedHashMap<>(tasks);
        updated.put(task.getAgentName(), task);
        return toBuilder()
                .tasks(Collections.unmodifiableMap(updated))
                .updatedAt(now)
                .build();
    }
}
