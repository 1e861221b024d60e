package com.pharmascope.helix.domain.repository.impl;

import com.pharmascope.helix.domain.model.AgentTask;
import com.pharmascope.helix.domain.model.AnalysisType;
import com.pharmascope.helix.domain.model.Job;
import com.pharmascope.helix.domain.model.JobStatus;
import com.pharmascope.helix.domain.model.Report;
import com.pharmascope.helix.domain.model.TaskUpdateOutcome;
import com.pharmascope.helix.domain.repository.JobStateStore;
import com.pharmascope.helix.exception.JobNotFoundException;
import com.pharmascope.helix.observability.HelixMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory job store. Each job lives in its own {@link AtomicReference} and is updated by
 * compare-and-set of immutable snapshots.
 */
@Slf4j
@Repository
public class InMemoryJobStateStore implements JobStateStore {

    private final Map<String, AtomicReference<Job>> jobs = new ConcurrentHashMap<>();
    private final HelixMetrics metrics;

    public InMemoryJobStateStore(HelixMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public Mono<Job> create(String query,
                            AnalysisType analysisType,
                            List<String> agents,
                            Map<String, Map<String, Object>> agentOptions,
                            Duration deadline) {
        return Mono.fromCallable(() -> {
            Instant now = Instant.now();
            Map<String, AgentTask> tasks = new LinkedHashMap<>();
            agents.forEach(agent -> tasks.put(agent, AgentTask.queued(agent)));

            Job job = Job.builder()
                    .id(UUID.randomUUID().toString())
                    .query(query)
                    .analysisType(analysisType)
                    .requestedAgents(List.copyOf(agents))
                    .status(JobStatus.PENDING)
                    .tasks(Collections.unmodifiableMap(tasks))
                    .agentOptions(agentOptions != null ? Map.copyOf(agentOptions) : Map.of())
                    .createdAt(now)
                    .updatedAt(now)
                    .deadline(now.plus(deadline))
                    .errors(List.of())
                    .build();

            jobs.put(job.getId(), new AtomicReference<>(job));
            log.debug("Created job {} with {} agents", job.getId(), agents.size());
            return job;
        });
    }

    @Override
    public Mono<Job> markRunning(String jobId) {
        return Mono.fromCallable(() -> {
            AtomicReference<Job> ref = reference(jobId);
            while (true) {
                Job current = ref.get();
                if (current.getStatus() != JobStatus.PENDING) {
                    return current;
                }
                Job next = current.toBuilder()
                        .status(JobStatus.RUNNING)
                        .updatedAt(Instant.now())
                        .build();
                if (ref.compareAndSet(current, next)) {
                    return next;
                }
            }
        });
    }

    @Override
    public Mono<TaskUpdateOutcome> recordTaskUpdate(String jobId, AgentTask task) {
        return Mono.fromCallable(() -> {
            AtomicReference<Job> ref = reference(jobId);
            while (true) {
                Job current = ref.get();
                AgentTask existing = current.getTask(task.getAgentName());
                if (existing == null) {
                    throw new IllegalArgumentException(
                            "Agent " + task.getAgentName() + " is not part of job " + jobId);
                }
                if (existing.isTerminal() || current.getStatus().isTerminal()) {
                    log.warn("LATE_UPDATE discarded for job {} agent {}: task already {}, job {}, update {}",
                            jobId, task.getAgentName(), existing.getStatus(), current.getStatus(), task.getStatus());
                    metrics.getLateUpdates().increment();
                    return TaskUpdateOutcome.LATE_UPDATE;
                }

                Job next = current.withTask(task, Instant.now());
                if (task.isTerminal() && !task.getStatus().isUsable()) {
                    List<String> errors = new ArrayList<>(current.getErrors());
                    errors.add(task.getAgentName() + ": " + task.getErrorCode() + " - " + task.getErrorMessage());
                    next = next.toBuilder().errors(List.copyOf(errors)).build();
                }
                if (ref.compareAndSet(current, next)) {
                    return TaskUpdateOutcome.ACCEPTED;
                }
            }
        });
    }

    @Override
    public Mono<Job> get(String jobId) {
        return Mono.fromSupplier(() -> {
            AtomicReference<Job> ref = jobs.get(jobId);
            return ref != null ? ref.get() : null;
        });
    }

    @Override
    public Mono<Job> setFinalReport(String jobId, Report report) {
        return Mono.fromCallable(() -> {
            AtomicReference<Job> ref = reference(jobId);
            while (true) {
                Job current = ref.get();
                if (current.getStatus().isTerminal()) {
                    throw new IllegalStateException("Job " + jobId + " already finalized as " + current.getStatus());
                }
                if (!current.allTasksTerminal()) {
                    throw new IllegalStateException("Job " + jobId + " still has outstanding tasks");
                }
                JobStatus terminal = JobStatus.fromComposite(report.getCompositeStatus());
                Job next = current.toBuilder()
                        .report(report)
                        .status(terminal)
                        .updatedAt(Instant.now())
                        .build();
                if (ref.compareAndSet(current, next)) {
                    log.debug("Job {} finalized as {}", jobId, terminal);
                    return next;
                }
            }
        });
    }

    @Override
    public Flux<Job> listByStatus(JobStatus status) {
        return Flux.defer(() -> Flux.fromStream(snapshots().stream()
                .filter(job -> job.getStatus() == status)));
    }

    @Override
    public Mono<Map<JobStatus, Long>> countByStatus() {
        return Mono.fromSupplier(() -> {
            Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
            for (JobStatus status : JobStatus.values()) {
                counts.put(status, 0L);
            }
            snapshots().forEach(job -> counts.merge(job.getStatus(), 1L, Long::sum));
            return counts;
        });
    }

    @Override
    public Mono<Long> count() {
        return Mono.fromSupplier(() -> (long) jobs.size());
    }

    @Override
    public Flux<Job> findGcEligible(Instant cutoff) {
        return Flux.defer(() -> Flux.fromStream(snapshots().stream()
                .filter(job -> isEligible(job, cutoff))
                .sorted(Comparator.comparing(Job::getUpdatedAt))));
    }

    @Override
    public Mono<Boolean> isGcEligible(String jobId, Instant cutoff) {
        return get(jobId).map(job -> isEligible(job, cutoff));
    }

    @Override
    public Mono<Boolean> remove(String jobId) {
        return Mono.fromSupplier(() -> {
            AtomicReference<Job> ref = jobs.get(jobId);
            if (ref == null || !ref.get().getStatus().isTerminal()) {
                return false;
            }
            return jobs.remove(jobId, ref);
        });
    }

    private static boolean isEligible(Job job, Instant cutoff) {
        return job.getStatus().isTerminal() && job.getUpdatedAt().isBefore(cutoff);
    }

    private List<Job> snapshots() {
        List<Job> result = new ArrayList<>(jobs.size());
        jobs.values().forEach(ref -> result.add(ref.get()));
        return result;
    }

    private AtomicReference<Job> reference(String jobId) {
        AtomicReference<Job> ref = jobs.get(jobId);
        if (ref == null) {
            throw new JobNotFoundException(jobId);
        }
        return ref;
    }
}
