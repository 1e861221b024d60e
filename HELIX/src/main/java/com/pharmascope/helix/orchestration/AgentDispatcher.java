package com.pharmascope.helix.orchestration;

import com.pharmascope.helix.agent.AgentException;
import com.pharmascope.helix.agent.AgentInvocation;
import com.pharmascope.helix.agent.AgentRegistry;
import com.pharmascope.helix.agent.ResearchAgent;
import com.pharmascope.helix.config.HelixProperties;
import com.pharmascope.helix.domain.model.AgentErrorKind;
import com.pharmascope.helix.domain.model.AgentResult;
import com.pharmascope.helix.domain.model.AgentTask;
import com.pharmascope.helix.domain.model.DataSource;
import com.pharmascope.helix.domain.model.Job;
import com.pharmascope.helix.domain.model.TaskUpdateOutcome;
import com.pharmascope.helix.domain.repository.JobStateStore;
import com.pharmascope.helix.observability.HelixMetrics;
import com.pharmascope.helix.observability.StructuredLogger;
import com.pharmascope.helix.resilience.AgentCircuitBreakers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fans a job out to its agents and drives every task to a terminal sub-status.
 * <p>
 * Per agent:
 * <ol>
 *     <li>disabled agent or breaker refusing the call: fallback path</li>
 *     <li>live call bounded by the agent timeout, with an external backstop</li>
 *     <li>TIMEOUT / UPSTREAM_ERROR: one retry on the fallback path when the agent has one</li>
 *     <li>anything else: FAILED</li>
 * </ol>
 * Every settle is written to the store as it happens. When the job deadline elapses the
 * outstanding invocations are cancelled and their tasks are force-marked TIMED_OUT.
 */
@Slf4j
@Component
public class AgentDispatcher {

    static final Duration BACKSTOP_GRACE = Duration.ofMillis(250);

    private final AgentRegistry agentRegistry;
    private final AgentCircuitBreakers circuitBreakers;
    private final JobStateStore jobStateStore;
    private final HelixProperties helixProperties;
    private final HelixMetrics metrics;
    private final StructuredLogger structuredLogger;

    public AgentDispatcher(AgentRegistry agentRegistry,
                           AgentCircuitBreakers circuitBreakers,
                           JobStateStore jobStateStore,
                           HelixProperties helixProperties,
                           HelixMetrics metrics,
                           StructuredLogger structuredLogger) {
        this.agentRegistry = agentRegistry;
        this.circuitBreakers = circuitBreakers;
        this.jobStateStore = jobStateStore;
        this.helixProperties = helixProperties;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
    }

    /**
     * Runs all agents of the job concurrently and emits the job snapshot once every task is
     * terminal or the job deadline has passed.
     */
    public Mono<Job> dispatch(Job job) {
        Duration untilDeadline = remaining(job.getDeadline());
        // every requested agent gets its own slot
        int concurrency = Math.max(1, job.getRequestedAgents().size());

        log.debug("Dispatching job {} to {} agents, deadline in {}ms",
                job.getId(), job.getRequestedAgents().size(), untilDeadline.toMillis());

        return Flux.fromIterable(job.getRequestedAgents())
                .flatMap(agentName -> runAgent(job, agentName), concurrency)
                .take(untilDeadline)
                .then(Mono.defer(() -> forceTimeoutOutstanding(job.getId())));
    }

    // -------------------------------------------------------------------------
    // Per-agent pipeline
    // -------------------------------------------------------------------------

    private Mono<AgentTask> runAgent(Job job, String agentName) {
        return Mono.defer(() -> {
                    ResearchAgent agent = agentRegistry.get(agentName);
                    AgentTask queued = job.getTask(agentName);

                    if (!helixProperties.getAgents().isEnabled(agentName)) {
                        log.debug("Agent {} disabled, serving fallback for job {}", agentName, job.getId());
                        return fallbackPath(job, agent, queued, null, "Agent disabled", "disabled");
                    }
                    if (!circuitBreakers.tryAcquire(agentName)) {
                        log.info("Circuit open for agent {}, short-circuiting job {} to fallback",
                                agentName, job.getId());
                        return fallbackPath(job, agent, queued, null, "Circuit breaker open", "circuit_open");
                    }
                    return livePath(job, agent, queued);
                })
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(e -> settleUnexpected(job, agentName, e));
    }

    private Mono<AgentTask> livePath(Job job, ResearchAgent agent, AgentTask queued) {
        String agentName = agent.getName();
        Duration agentTimeout = helixProperties.getAgents().timeoutFor(agentName);
        Instant liveDeadline = earliest(job.getDeadline(), Instant.now().plus(agentTimeout));
        AgentInvocation invocation = invocation(job, agentName, liveDeadline);
        AgentTask running = queued.running(DataSource.LIVE, Instant.now());
        AtomicBoolean outcomeRecorded = new AtomicBoolean(false);
        long startNanos = System.nanoTime();

        Mono<AgentResult> live = Mono.defer(() -> agent.invoke(invocation))
                .switchIfEmpty(Mono.error(() -> AgentException.internal(agentName,
                        agentName + " returned no result", null)))
                .timeout(invocation.remaining().plus(BACKSTOP_GRACE))
                .onErrorMap(e -> !(e instanceof AgentException), e -> classify(agentName, e));

        return jobStateStore.recordTaskUpdate(job.getId(), running)
                .then(live)
                .flatMap(result -> {
                    if (outcomeRecorded.compareAndSet(false, true)) {
                        circuitBreakers.onSuccess(agentName, elapsed(startNanos));
                    }
                    return settle(job.getId(), running.succeeded(result, Instant.now()));
                })
                .onErrorResume(AgentException.class, error -> {
                    AgentErrorKind kind = error.getKind();
                    if (outcomeRecorded.compareAndSet(false, true)) {
                        if (kind.countsAgainstBreaker()) {
                            circuitBreakers.onFailure(agentName, elapsed(startNanos), error);
                        } else {
                            circuitBreakers.release(agentName);
                        }
                    }
                    if (kind.isFallbackEligible() && agent.supportsFallback()) {
                        log.warn("Live call for agent {} failed with {} in job {}, retrying on fallback: {}",
                                agentName, kind, job.getId(), error.getMessage());
                        return fallbackPath(job, agent, running, kind, error.getMessage(),
                                kind.name().toLowerCase(Locale.ROOT));
                    }
                    return settle(job.getId(),
                            running.failed(kind, error.getMessage(), DataSource.LIVE, Instant.now()));
                })
                .doOnCancel(() -> {
                    // Cut off by the job deadline: counts as a timeout against the breaker
                    if (outcomeRecorded.compareAndSet(false, true)) {
                        circuitBreakers.onFailure(agentName, elapsed(startNanos),
                                new TimeoutException("Cancelled at job deadline"));
                    }
                })
                .doOnTerminate(() -> {
                    // permit taken but no outcome recorded, e.g. the RUNNING write failed
                    if (outcomeRecorded.compareAndSet(false, true)) {
                        circuitBreakers.release(agentName);
                    }
                });
    }

    /**
     * Degraded path. {@code liveKind} is null when no live call was attempted.
     */
    private Mono<AgentTask> fallbackPath(Job job, ResearchAgent agent, AgentTask current,
                                         AgentErrorKind liveKind, String liveMessage, String reason) {
        String agentName = agent.getName();
        AgentTask onFallback = current.running(DataSource.FALLBACK, Instant.now());

        if (!agent.supportsFallback()) {
            AgentErrorKind kind = liveKind != null ? liveKind : AgentErrorKind.UPSTREAM_ERROR;
            return jobStateStore.recordTaskUpdate(job.getId(), onFallback)
                    .then(settle(job.getId(), onFallback.failed(kind,
                            liveMessage + "; no fallback available", DataSource.FALLBACK, Instant.now())));
        }

        metrics.recordFallback(agentName, reason);
        AgentInvocation invocation = invocation(job, agentName, job.getDeadline());

        return jobStateStore.recordTaskUpdate(job.getId(), onFallback)
                .then(Mono.defer(() -> agent.fallback(invocation)))
                .flatMap(result -> settle(job.getId(),
                        onFallback.fallbackUsed(result, liveKind, liveMessage, Instant.now())))
                .onErrorResume(error -> {
                    AgentErrorKind fallbackKind = error instanceof AgentException agentError
                            ? agentError.getKind() : AgentErrorKind.INTERNAL;
                    AgentErrorKind kind = liveKind != null ? liveKind : fallbackKind;
                    String message = (liveKind != null ? "Live call failed: " : "") + liveMessage
                            + "; fallback failed: " + error.getMessage();
                    log.warn("Fallback failed for agent {} in job {}: {}", agentName, job.getId(), error.getMessage());
                    return settle(job.getId(), onFallback.failed(kind, message, DataSource.FALLBACK, Instant.now()));
                });
    }

    // -------------------------------------------------------------------------
    // Settlement
    // -------------------------------------------------------------------------

    private Mono<AgentTask> settle(String jobId, AgentTask task) {
        return jobStateStore.recordTaskUpdate(jobId, task)
                .doOnNext(outcome -> {
                    if (outcome == TaskUpdateOutcome.ACCEPTED) {
                        metrics.recordAgentOutcome(task.getAgentName(), task.getStatus(), latency(task));
                        structuredLogger.logAgentSettled(jobId, task);
                    }
                })
                .thenReturn(task);
    }

    private Mono<AgentTask> settleUnexpected(Job job, String agentName, Throwable error) {
        log.error("Unexpected failure dispatching agent {} for job {}", agentName, job.getId(), error);
        AgentTask failed = job.getTask(agentName).failed(AgentErrorKind.INTERNAL,
                "Dispatch failed: " + error.getMessage(), DataSource.LIVE, Instant.now());
        return settle(job.getId(), failed)
                .onErrorResume(storeError -> {
                    log.error("Could not record failure of agent {} for job {}: {}",
                            agentName, job.getId(), storeError.getMessage());
                    return Mono.empty();
                });
    }

    /**
     * Marks every task still outstanding as TIMED_OUT and returns the settled snapshot.
     */
    Mono<Job> forceTimeoutOutstanding(String jobId) {
        return jobStateStore.get(jobId)
                .flatMapMany(job -> Flux.fromIterable(job.getTasks().values()))
                .filter(task -> !task.isTerminal())
                .concatMap(task -> {
                    log.warn("Agent {} still outstanding at deadline of job {}, marking TIMED_OUT",
                            task.getAgentName(), jobId);
                    return settle(jobId, task.timedOut("Job deadline elapsed before the agent settled", Instant.now()));
                })
                .then(jobStateStore.get(jobId));
    }

    /**
     * Marks every task still outstanding as FAILED after a job-level fault and returns the snapshot.
     */
    Mono<Job> abandonOutstanding(String jobId, String reason) {
        return jobStateStore.get(jobId)
                .flatMapMany(job -> Flux.fromIterable(job.getTasks().values()))
                .filter(task -> !task.isTerminal())
                .concatMap(task -> settle(jobId, task.failed(AgentErrorKind.INTERNAL, reason,
                        task.getSource(), Instant.now())))
                .then(jobStateStore.get(jobId));
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private AgentInvocation invocation(Job job, String agentName, Instant deadline) {
        Map<String, Object> options = job.getAgentOptions().getOrDefault(agentName, Map.of());
        return AgentInvocation.builder()
                .jobId(job.getId())
                .agentName(agentName)
                .query(job.getQuery())
                .options(options)
                .deadline(deadline)
                .build();
    }

    private static AgentException classify(String agentName, Throwable error) {
        if (error instanceof TimeoutException) {
            return new AgentException(agentName, AgentErrorKind.TIMEOUT,
                    agentName + " exceeded its timeout", error);
        }
        return AgentException.internal(agentName, agentName + " failed: " + error.getMessage(), error);
    }

    private static Duration remaining(Instant deadline) {
        Duration left = Duration.between(Instant.now(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    private static Instant earliest(Instant a, Instant b) {
        return a.isBefore(b) ? a : b;
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static Duration latency(AgentTask task) {
        if (task.getStartedAt() == null || task.getFinishedAt() == null) {
            return null;
        }
        return Duration.between(task.getStartedAt(), task.getFinishedAt());
    }
}
