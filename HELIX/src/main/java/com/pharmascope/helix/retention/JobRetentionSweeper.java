package com.pharmascope.helix.retention;

import com.pharmascope.helix.config.HelixProperties;
import com.pharmascope.helix.domain.model.Job;
import com.pharmascope.helix.domain.repository.JobStateStore;
import com.pharmascope.helix.observability.HelixMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Retention policy for settled jobs: drops those older than the max age, then the oldest
 * settled ones while the store holds more than the job cap. Running jobs are never touched.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "helix.retention", name = "enabled", havingValue = "true", matchIfMissing = true)
public class JobRetentionSweeper {

    private final JobStateStore jobStateStore;
    private final HelixProperties.RetentionProperties config;
    private final HelixMetrics metrics;

    public JobRetentionSweeper(JobStateStore jobStateStore, HelixProperties helixProperties, HelixMetrics metrics) {
        this.jobStateStore = jobStateStore;
        this.config = helixProperties.getRetention();
        this.metrics = metrics;
    }

    @Scheduled(fixedDelayString = "${helix.retention.sweep-interval:PT5M}")
    public void sweep() {
        Long removed = sweepOnce().block();
        if (removed != null && removed > 0) {
            log.info("Retention sweep removed {} settled jobs", removed);
        }
    }

    /**
     * One retention pass.
     *
     * @return number of jobs removed
     */
    public Mono<Long> sweepOnce() {
        Instant cutoff = Instant.now().minus(config.getMaxAge());
        return removeAll(jobStateStore.findGcEligible(cutoff))
                .flatMap(expired -> jobStateStore.count()
                        .flatMap(remaining -> {
                            long excess = remaining - config.getMaxJobs();
                            if (excess <= 0) {
                                return Mono.just(expired);
                            }
                            return removeAll(jobStateStore.findGcEligible(Instant.now()).take(excess))
                                    .map(evicted -> expired + evicted);
                        }))
                .onErrorResume(e -> {
                    log.warn("Retention sweep failed: {}", e.getMessage());
                    return Mono.just(0L);
                });
    }

    private Mono<Long> removeAll(Flux<Job> candidates) {
        return candidates
                .concatMap(job -> jobStateStore.remove(job.getId()))
                .filter(Boolean::booleanValue)
                .count()
                .doOnNext(count -> metrics.getJobsEvicted().increment(count));
    }
}
