package com.pharmascope.helix.observability;

import com.pharmascope.helix.domain.model.AgentTaskStatus;
import com.pharmascope.helix.domain.model.CompositeStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralized metrics for HELIX.
 * <p>
 * Covers:
 * <ul>
 *     <li>Job lifecycle (submitted, rejected, settled by composite status, duration)</li>
 *     <li>Agent outcomes (by agent and sub-status, latency, fallbacks)</li>
 *     <li>Store anomalies (late updates)</li>
 * </ul>
 */
@Component
public class HelixMetrics {

    private final MeterRegistry meterRegistry;

    @Getter
    private final Counter jobsSubmitted;
    @Getter
    private final Counter jobsRejected;
    @Getter
    private final Counter lateUpdates;
    @Getter
    private final Counter jobsEvicted;
    private final Timer jobDuration;
    private final DistributionSummary jobCoverage;

    public HelixMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.jobsSubmitted = Counter.builder("helix.jobs.submitted")
                .description("Total research jobs accepted")
                .register(meterRegistry);
        this.jobsRejected = Counter.builder("helix.jobs.rejected")
                .description("Submissions rejected as invalid")
                .register(meterRegistry);
        this.lateUpdates = Counter.builder("helix.store.late.updates")
                .description("Task updates discarded because the task or job was already terminal")
                .register(meterRegistry);
        this.jobsEvicted = Counter.builder("helix.jobs.evicted")
                .description("Settled jobs removed by retention")
                .register(meterRegistry);
        this.jobDuration = Timer.builder("helix.job.duration")
                .description("Time from submission to settlement")
                .register(meterRegistry);
        this.jobCoverage = DistributionSummary.builder("helix.job.coverage")
                .description("Coverage ratio of settled jobs")
                .register(meterRegistry);
    }

    public void recordJobSettled(CompositeStatus status, double coverageRatio, Duration duration) {
        Counter.builder("helix.jobs.settled")
                .description("Settled jobs by composite status")
                .tag("status", status.name().toLowerCase(Locale.ROOT))
                .register(meterRegistry)
                .increment();
        jobCoverage.record(coverageRatio);
        jobDuration.record(duration);
    }

    public void recordAgentOutcome(String agentName, AgentTaskStatus status, Duration latency) {
        Counter.builder("helix.agent.outcomes")
                .description("Agent task outcomes")
                .tag("agent", agentName)
                .tag("status", status.name().toLowerCase(Locale.ROOT))
                .register(meterRegistry)
                .increment();
        if (latency != null) {
            Timer.builder("helix.agent.latency")
                    .description("Agent task latency")
                    .tag("agent", agentName)
                    .register(meterRegistry)
                    .record(latency);
        }
    }

    public void recordFallback(String agentName, String reason) {
        Counter.builder("helix.agent.fallbacks")
                .description("Fallback path activations")
                .tag("agent", agentName)
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }
}
