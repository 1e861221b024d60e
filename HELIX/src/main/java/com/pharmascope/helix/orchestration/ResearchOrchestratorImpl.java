package com.pharmascope.helix.orchestration;

import com.pharmascope.helix.agent.AgentRegistry;
import com.pharmascope.helix.archive.ReportArchive;
import com.pharmascope.helix.config.HelixProperties;
import com.pharmascope.helix.domain.model.AnalysisType;
import com.pharmascope.helix.domain.model.Job;
import com.pharmascope.helix.domain.model.Report;
import com.pharmascope.helix.domain.repository.JobStateStore;
import com.pharmascope.helix.exception.InvalidQueryException;
import com.pharmascope.helix.exception.JobNotFoundException;
import com.pharmascope.helix.exception.JobNotReadyException;
import com.pharmascope.helix.observability.HelixMetrics;
import com.pharmascope.helix.observability.StructuredLogger;
import com.pharmascope.helix.resilience.AgentCircuitBreakers;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default orchestrator: validates submissions, runs each job in the background through the
 * dispatcher and aggregator, and serves status and report lookups from the job state store.
 */
@Slf4j
@Service
public class ResearchOrchestratorImpl implements ResearchOrchestrator {

    private final AgentRegistry agentRegistry;
    private final AgentDispatcher dispatcher;
    private final ReportAggregator aggregator;
    private final JobStateStore jobStateStore;
    private final ReportArchive reportArchive;
    private final AgentCircuitBreakers circuitBreakers;
    private final HelixProperties helixProperties;
    private final HelixMetrics metrics;
    private final StructuredLogger structuredLogger;

    private final Map<String, Disposable> inFlight = new ConcurrentHashMap<>();

    public ResearchOrchestratorImpl(AgentRegistry agentRegistry,
                                    AgentDispatcher dispatcher,
                                    ReportAggregator aggregator,
                                    JobStateStore jobStateStore,
                                    ReportArchive reportArchive,
                                    AgentCircuitBreakers circuitBreakers,
                                    HelixProperties helixProperties,
                                    HelixMetrics metrics,
                                    StructuredLogger structuredLogger) {
        this.agentRegistry = agentRegistry;
        this.dispatcher = dispatcher;
        this.aggregator = aggregator;
        this.jobStateStore = jobStateStore;
        this.reportArchive = reportArchive;
        this.circuitBreakers = circuitBreakers;
        this.helixProperties = helixProperties;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
    }

    // --------------------------------------------------------------------------------------------
    // Jobs
    // --------------------------------------------------------------------------------------------

    @Override
    public Mono<Job> submit(AnalysisCommand command) {
        return Mono.defer(() -> {
                    String query = validateQuery(command.getQuery());
                    AnalysisType analysisType = AnalysisType.fromValue(command.getAnalysisType());
                    List<String> agents = resolveAgents(command, analysisType);
                    Map<String, Map<String, Object>> options = optionsFor(agents, command.getAgentOptions());
                    Duration deadline = helixProperties.getOrchestration().getJobDeadline();

                    return jobStateStore.create(query, analysisType, agents, options, deadline);
                })
                .doOnError(InvalidQueryException.class, e -> {
                    metrics.getJobsRejected().increment();
                    log.info("Rejected submission: {}", e.getMessage());
                })
                .doOnNext(job -> {
                    metrics.getJobsSubmitted().increment();
                    structuredLogger.logJobSubmitted(job);
                    launch(job);
                });
    }

    @Override
    public Mono<Job> status(String jobId) {
        return jobStateStore.get(jobId)
                .switchIfEmpty(Mono.error(() -> new JobNotFoundException(jobId)));
    }

    @Override
    public Mono<Report> result(String jobId) {
        return jobStateStore.get(jobId)
                .flatMap(job -> job.getStatus().isTerminal()
                        ? Mono.justOrEmpty(job.getReport())
                        : Mono.<Report>error(new JobNotReadyException(jobId, job.getStatus())))
                .switchIfEmpty(Mono.defer(() -> reportArchive.find(jobId)))
                .switchIfEmpty(Mono.error(() -> new JobNotFoundException(jobId)));
    }

    // --------------------------------------------------------------------------------------------
    // Diagnostics
    // --------------------------------------------------------------------------------------------

    @Override
    public Mono<EngineDiagnostics> diagnostics() {
        return jobStateStore.countByStatus()
                .map(counts -> EngineDiagnostics.builder()
                        .circuitBreakers(circuitBreakers.snapshots(agentRegistry.names()))
                        .jobsByStatus(counts)
                        .generatedAt(Instant.now())
                        .build());
    }

    @Override
    public Flux<AgentDescriptor> agents() {
        HelixProperties.AgentProperties config = helixProperties.getAgents();
        return Flux.fromIterable(agentRegistry.all())
                .map(agent -> AgentDescriptor.builder()
                        .name(agent.getName())
                        .displayName(agent.getDisplayName())
                        .enabled(config.isEnabled(agent.getName()))
                        .supportsFallback(agent.supportsFallback())
                        .timeout(config.timeoutFor(agent.getName()))
                        .circuitState(circuitBreakers.currentState(agent.getName()))
                        .build());
    }

    @PreDestroy
    public void shutdown() {
        if (!inFlight.isEmpty()) {
            log.info("Cancelling {} in-flight research jobs", inFlight.size());
        }
        inFlight.values().forEach(Disposable::dispose);
        inFlight.clear();
    }

    int inFlightCount() {
        return inFlight.size();
    }

    // --------------------------------------------------------------------------------------------
    // Execution
    // --------------------------------------------------------------------------------------------

    private void launch(Job job) {
        Disposable.Swap slot = Disposables.swap();
        inFlight.put(job.getId(), slot);
        slot.update(run(job)
                .doFinally(signal -> inFlight.remove(job.getId(), slot))
                .subscribeOn(Schedulers.boundedElastic())
                .subscribe(
                        settled -> log.info("Job {} settled as {} (coverage {})", settled.getId(),
                                settled.getStatus(), settled.getReport().getCoverageRatio()),
                        error -> log.error("Job {} could not be finalized", job.getId(), error)));
    }

    private Mono<Job> run(Job job) {
        String jobId = job.getId();
        return jobStateStore.markRunning(jobId)
                .flatMap(dispatcher::dispatch)
                .flatMap(this::finalizeJob)
                .onErrorResume(error -> {
                    log.error("Job {} hit an unexpected fault, settling outstanding agents", jobId, error);
                    return dispatcher.abandonOutstanding(jobId, "Job aborted: " + error.getMessage())
                            .flatMap(this::finalizeJob);
                });
    }

    private Mono<Job> finalizeJob(Job settled) {
        if (settled.getStatus().isTerminal()) {
            return Mono.just(settled);
        }
        Report report = aggregator.aggregate(settled);
        return jobStateStore.setFinalReport(settled.getId(), report)
                .doOnNext(finalized -> {
                    metrics.recordJobSettled(report.getCompositeStatus(), report.getCoverageRatio(),
                            Duration.between(finalized.getCreatedAt(), report.getGeneratedAt()));
                    structuredLogger.logJobSettled(finalized, report);
                })
                .flatMap(finalized -> reportArchive.archive(report).thenReturn(finalized));
    }

    // --------------------------------------------------------------------------------------------
    // Validation
    // --------------------------------------------------------------------------------------------

    private String validateQuery(String query) {
        if (query == null || query.isBlank()) {
            throw new InvalidQueryException("Query must not be empty");
        }
        String trimmed = query.trim();
        int maxLength = helixProperties.getOrchestration().getMaxQueryLength();
        if (trimmed.length() > maxLength) {
            throw new InvalidQueryException("Query exceeds " + maxLength + " characters");
        }
        return trimmed;
    }

    /**
     * Explicit list first, then the requested preset, then the configured default subset.
     */
    private List<String> resolveAgents(AnalysisCommand command, AnalysisType analysisType) {
        Set<String> selected = new LinkedHashSet<>();

        if (command.getAgents() != null && !command.getAgents().isEmpty()) {
            List<String> unknown = new ArrayList<>();
            for (String name : command.getAgents()) {
                String agentName = name == null ? "" : name.trim();
                if (agentRegistry.contains(agentName)) {
                    selected.add(agentName);
                } else {
                    unknown.add(name);
                }
            }
            if (!unknown.isEmpty()) {
                throw new InvalidQueryException("Unknown agent(s): " + unknown
                        + "; available: " + agentRegistry.names());
            }
        } else if (command.getAnalysisType() != null && !command.getAnalysisType().isBlank()) {
            analysisType.getAgents().stream()
                    .filter(agentRegistry::contains)
                    .forEach(selected::add);
        } else {
            for (String agentName : helixProperties.getOrchestration().getDefaultAgents()) {
                if (agentRegistry.contains(agentName)) {
                    selected.add(agentName);
                } else {
                    log.warn("Ignoring unknown agent {} in default agent subset", agentName);
                }
            }
        }

        if (selected.isEmpty()) {
            throw new InvalidQueryException("No agents selected");
        }
        return List.copyOf(selected);
    }

    private Map<String, Map<String, Object>> optionsFor(List<String> agents,
                                                        Map<String, Map<String, Object>> requested) {
        Map<String, Map<String, Object>> options = new LinkedHashMap<>();
        if (requested != null) {
            requested.forEach((agentName, agentOptions) -> {
                if (agents.contains(agentName) && agentOptions != null) {
                    Map<String, Object> copy = new LinkedHashMap<>();
                    agentOptions.forEach((key, value) -> {
                        if (key != null && value != null) {
                            copy.put(key, value);
                        }
                    });
                    options.put(agentName, copy);
                }
            });
        }
        return options;
    }
}
