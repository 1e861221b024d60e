package com.pharmascope.helix.orchestration;

import com.pharmascope.helix.domain.model.Job;
import com.pharmascope.helix.domain.model.Report;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Public entry point of the orchestration engine.
 * <p>
 * Job lifecycle: {@code PENDING -> RUNNING -> COMPLETED | PARTIAL | FAILED}. A job-level
 * failure is reported through the report's composite status, never thrown.
 */
public interface ResearchOrchestrator {

    // --------------------------------------------------------------------------------------------
    // Jobs
    // --------------------------------------------------------------------------------------------

    /**
     * Validate the request, create a PENDING job and start it in the background.
     *
     * @param command the research request
     * @return the created job; errors with {@code InvalidQueryException} before any job exists
     */
    Mono<Job> submit(AnalysisCommand command);

    /**
     * Current job snapshot.
     *
     * @param jobId the job ID
     * @return the job; errors with {@code JobNotFoundException}
     */
    Mono<Job> status(String jobId);

    /**
     * Final report of a settled job. Repeated calls return the same report.
     *
     * @param jobId the job ID
     * @return the report; errors with {@code JobNotReadyException} while PENDING or RUNNING
     */
    Mono<Report> result(String jobId);

    // --------------------------------------------------------------------------------------------
    // Diagnostics
    // --------------------------------------------------------------------------------------------

    /**
     * Breaker state per agent and job counts by status.
     */
    Mono<EngineDiagnostics> diagnostics();

    /**
     * Registered agents with their effective configuration.
     */
    Flux<AgentDescriptor> agents();
}
