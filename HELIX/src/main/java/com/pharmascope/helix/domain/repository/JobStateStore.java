package com.pharmascope.helix.domain.repository;

import com.pharmascope.helix.domain.model.AgentTask;
import com.pharmascope.helix.domain.model.AnalysisType;
import com.pharmascope.helix.domain.model.Job;
import com.pharmascope.helix.domain.model.JobStatus;
import com.pharmascope.helix.domain.model.Report;
import com.pharmascope.helix.domain.model.TaskUpdateOutcome;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Job records and their per-agent tasks.
 * <p>
 * Writes to one (job, agent) key are linearizable and jobs never lock each other. Every read
 * returns a whole snapshot: a terminal job always has all of its tasks terminal.
 */
public interface JobStateStore {

    /**
     * Create a PENDING job with one QUEUED task per agent.
     */
    Mono<Job> create(String query,
                     AnalysisType analysisType,
                     List<String> agents,
                     Map<String, Map<String, Object>> agentOptions,
                     Duration deadline);

    /**
     * Move a PENDING job to RUNNING. No-op for any other status.
     */
    Mono<Job> markRunning(String jobId);

    /**
     * Replace one task. Updates to a terminal task or a terminal job are discarded and
     * reported as {@link TaskUpdateOutcome#LATE_UPDATE}; they never error.
     */
    Mono<TaskUpdateOutcome> recordTaskUpdate(String jobId, AgentTask task);

    /**
     * Current snapshot, empty for an unknown id.
     */
    Mono<Job> get(String jobId);

    /**
     * Store the report and move the job to the matching terminal status.
     * Fails with {@link IllegalStateException} while a task is outstanding or once the job is terminal.
     */
    Mono<Job> setFinalReport(String jobId, Report report);

    Flux<Job> listByStatus(JobStatus status);

    Mono<Map<JobStatus, Long>> countByStatus();

    Mono<Long> count();

    /**
     * Terminal jobs last updated before the cutoff, oldest first.
     */
    Flux<Job> findGcEligible(Instant cutoff);

    Mono<Boolean> isGcEligible(String jobId, Instant cutoff);

    /**
     * Delete a job. Only the retention policy calls this.
     */
    Mono<Boolean> remove(String jobId);
}
