package com.pharmascope.helix.retention;

import com.pharmascope.helix.config.HelixProperties;
import com.pharmascope.helix.domain.model.AgentResult;
import com.pharmascope.helix.domain.model.AgentTask;
import com.pharmascope.helix.domain.model.AnalysisType;
import com.pharmascope.helix.domain.model.CompositeStatus;
import com.pharmascope.helix.domain.model.DataSource;
import com.pharmascope.helix.domain.model.Job;
import com.pharmascope.helix.domain.model.QualityFlag;
import com.pharmascope.helix.domain.model.Report;
import com.pharmascope.helix.domain.repository.impl.InMemoryJobStateStore;
import com.pharmascope.helix.observability.HelixMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JobRetentionSweeperTest {

    private HelixProperties properties;
    private HelixMetrics metrics;
    private InMemoryJobStateStore store;

    @BeforeEach
    void setUp() {
        properties = new HelixProperties();
        metrics = new HelixMetrics(new SimpleMeterRegistry());
        store = new InMemoryJobStateStore(metrics);
    }

    private Job pending() {
        return store.create("imatinib", AnalysisType.COMPREHENSIVE, List.of("market"), Map.of(), Duration.ofSeconds(30))
                .block();
    }

    private Job settled() {
        Job job = pending();
        Instant now = Instant.now();
        AgentResult result = AgentResult.builder()
                .agentName("market")
                .quality(QualityFlag.HIGH)
                .source(DataSource.LIVE)
                .generatedAt(now)
                .build();
        store.recordTaskUpdate(job.getId(), AgentTask.queued("market").succeeded(result, now)).block();
        Report report = Report.builder()
                .jobId(job.getId())
                .query(job.getQuery())
                .entries(Map.of())
                .coverageRatio(1.0)
                .compositeStatus(CompositeStatus.COMPLETE)
                .requested(1)
                .succeeded(1)
                .generatedAt(now)
                .build();
        return store.setFinalReport(job.getId(), report).block();
    }

    @Test
    @DisplayName("should remove settled jobs older than the retention age and keep running ones")
    void removesExpiredJobs() throws InterruptedException {
        properties.getRetention().setMaxAge(Duration.ofMillis(20));
        Job expired = settled();
        Job running = pending();
        Thread.sleep(50);

        StepVerifier.create(new JobRetentionSweeper(store, properties, metrics).sweepOnce())
                .expectNext(1L)
                .verifyComplete();

        assertThat(store.get(expired.getId()).block()).isNull();
        assertThat(store.get(running.getId()).block()).isNotNull();
        assertThat(metrics.getJobsEvicted().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should evict the oldest settled jobs beyond the job cap")
    void evictsOldestBeyondCap() throws InterruptedException {
        properties.getRetention().setMaxAge(Duration.ofHours(1));
        properties.getRetention().setMaxJobs(2);
        Job oldest = settled();
        Thread.sleep(5);
        Job middle = settled();
        Thread.sleep(5);
        Job newest = settled();
        Thread.sleep(5);

        StepVerifier.create(new JobRetentionSweeper(store, properties, metrics).sweepOnce())
                .expectNext(1L)
                .verifyComplete();

        assertThat(store.get(oldest.getId()).block()).isNull();
        assertThat(store.get(middle.getId()).block()).isNotNull();
        assertThat(store.get(newest.getId()).block()).isNotNull();
    }
}
