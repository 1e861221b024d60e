package com.pharmascope.helix.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * One process-wide circuit breaker per agent, shared by all jobs.
 * <p>
 * State changes for an agent are serialized by its resilience4j state machine; only that
 * agent's own outcomes are ever recorded against it. Callers follow the permission protocol:
 * {@link #tryAcquire} before a live call, then exactly one of {@link #onSuccess},
 * {@link #onFailure} or {@link #release}.
 */
@Slf4j
@Component
public class AgentCircuitBreakers {

    private final CircuitBreakerRegistry registry;
    private final Map<String, BreakerState> states = new ConcurrentHashMap<>();

    public AgentCircuitBreakers(CircuitBreakerRegistry registry) {
        this.registry = registry;
    }

    /**
     * Whether a live call may be attempted now. An OPEN breaker whose wait has elapsed moves to
     * HALF_OPEN here and grants the single trial permission.
     */
    public boolean tryAcquire(String agentName) {
        return state(agentName).breaker.tryAcquirePermission();
    }

    public void onSuccess(String agentName, Duration elapsed) {
        BreakerState state = state(agentName);
        state.consecutiveFailures.set(0);
        state.breaker.onSuccess(elapsed.toNanos(), TimeUnit.NANOSECONDS);
    }

    public void onFailure(String agentName, Duration elapsed, Throwable error) {
        BreakerState state = state(agentName);
        state.consecutiveFailures.incrementAndGet();
        state.breaker.onError(elapsed.toNanos(), TimeUnit.NANOSECONDS, error);
    }

    /**
     * Returns a permission without recording an outcome.
     */
    public void release(String agentName) {
        state(agentName).breaker.releasePermission();
    }

    public CircuitState currentState(String agentName) {
        return CircuitState.of(state(agentName).breaker.getState());
    }

    public BreakerSnapshot snapshot(String agentName) {
        BreakerState state = state(agentName);
        CircuitState circuitState = CircuitState.of(state.breaker.getState());
        return BreakerSnapshot.builder()
                .agentName(agentName)
                .state(circuitState)
                .consecutiveFailures(state.consecutiveFailures.get())
                .lastTransitionAt(state.lastTransitionAt.get())
                .openUntil(circuitState == CircuitState.OPEN ? state.openUntil.get() : null)
                .failureRate(state.breaker.getMetrics().getFailureRate())
                .build();
    }

    public List<BreakerSnapshot> snapshots(List<String> agentNames) {
        return agentNames.stream()
                .map(this::snapshot)
                .collect(Collectors.toList());
    }

    public void reset(String agentName) {
        BreakerState state = state(agentName);
        state.breaker.reset();
        state.consecutiveFailures.set(0);
        state.openStreak.set(0);
        log.info("Circuit breaker for agent {} reset", agentName);
    }

    private BreakerState state(String agentName) {
        return states.computeIfAbsent(agentName, this::create);
    }

    private BreakerState create(String agentName) {
        CircuitBreaker breaker = registry.circuitBreaker(agentName);
        BreakerState state = new BreakerState(breaker);
        IntervalFunction waitInterval = breaker.getCircuitBreakerConfig().getWaitIntervalFunctionInOpenState();

        breaker.getEventPublisher().onStateTransition(event -> {
            Instant now = event.getCreationTime().toInstant();
            state.lastTransitionAt.set(now);
            CircuitBreaker.State target = event.getStateTransition().getToState();
            if (target == CircuitBreaker.State.OPEN) {
                int streak = state.openStreak.incrementAndGet();
                state.openUntil.set(now.plusMillis(waitInterval.apply(streak)));
                log.warn("Circuit breaker for agent {} opened ({}), live calls suspended until {}",
                        agentName, event.getStateTransition(), state.openUntil.get());
            } else if (target == CircuitBreaker.State.CLOSED) {
                state.openStreak.set(0);
                log.info("Circuit breaker for agent {} closed ({})", agentName, event.getStateTransition());
            } else {
                log.info("Circuit breaker for agent {} transitioned: {}", agentName, event.getStateTransition());
            }
        });
        return state;
    }

    private static final class BreakerState {
        private final CircuitBreaker breaker;
        private final AtomicInteger consecutiveFailures = new AtomicInteger();
        private final AtomicInteger openStreak = new AtomicInteger();
        private final AtomicReference<Instant> lastTransitionAt = new AtomicReference<>(Instant.now());
        private final AtomicReference<Instant> openUntil = new AtomicReference<>();

        private BreakerState(CircuitBreaker breaker) {
            this.breaker = breaker;
        }
    }
}
