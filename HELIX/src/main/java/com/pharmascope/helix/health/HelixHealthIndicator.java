package com.pharmascope.helix.health;

import com.pharmascope.helix.agent.AgentRegistry;
import com.pharmascope.helix.domain.repository.JobStateStore;
import com.pharmascope.helix.resilience.AgentCircuitBreakers;
import com.pharmascope.helix.resilience.BreakerSnapshot;
import com.pharmascope.helix.resilience.CircuitState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Health indicator for HELIX.
 * An open breaker degrades one agent's data, not the service, so it is reported as detail only.
 */
@Component
@Slf4j
public class HelixHealthIndicator implements ReactiveHealthIndicator {

    private final JobStateStore jobStateStore;
    private final AgentCircuitBreakers circuitBreakers;
    private final AgentRegistry agentRegistry;

    public HelixHealthIndicator(JobStateStore jobStateStore,
                                AgentCircuitBreakers circuitBreakers,
                                AgentRegistry agentRegistry) {
        this.jobStateStore = jobStateStore;
        this.circuitBreakers = circuitBreakers;
        this.agentRegistry = agentRegistry;
    }

    @Override
    public Mono<Health> health() {
        return jobStateStore.countByStatus()
                .map(counts -> {
                    List<BreakerSnapshot> snapshots = circuitBreakers.snapshots(agentRegistry.names());
                    Map<String, CircuitState> breakers = new LinkedHashMap<>();
                    snapshots.forEach(s -> breakers.put(s.getAgentName(), s.getState()));
                    long open = snapshots.stream().filter(s -> s.getState() == CircuitState.OPEN).count();

                    return Health.up()
                            .withDetail("agents", agentRegistry.names().size())
                            .withDetail("openCircuits", open)
                            .withDetail("circuitBreakers", breakers)
                            .withDetail("jobsByStatus", counts)
                            .build();
                })
                .onErrorResume(e -> {
                    log.error("Health check failed", e);
                    return Mono.just(Health.down()
                            .withDetail("error", e.getMessage())
                            .build());
                });
    }
}
