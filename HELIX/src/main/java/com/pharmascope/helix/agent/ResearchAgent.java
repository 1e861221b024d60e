package com.pharmascope.helix.agent;

import com.pharmascope.helix.domain.model.AgentResult;
import reactor.core.publisher.Mono;

/**
 * Uniform contract for every research agent.
 * <p>
 * An agent exposes two data paths:
 * <ul>
 *     <li><b>live</b>: {@link #invoke}, backed by the agent's upstream source</li>
 *     <li><b>fallback</b>: {@link #fallback}, degraded data used when the live path is
 *     unavailable or circuit-broken</li>
 * </ul>
 * Both paths signal failure with {@link AgentException}. An agent must settle before
 * {@link AgentInvocation#getDeadline()}, failing with a TIMEOUT kind if it cannot.
 */
public interface ResearchAgent {

    /**
     * Stable key used in requests, configuration and reports.
     */
    String getName();

    /**
     * Human-readable name.
     */
    String getDisplayName();

    /**
     * Live call against the upstream source.
     */
    Mono<AgentResult> invoke(AgentInvocation invocation);

    /**
     * Whether {@link #fallback} can produce a result.
     */
    boolean supportsFallback();

    /**
     * Degraded call. Never touches the upstream source.
     */
    Mono<AgentResult> fallback(AgentInvocation invocation);
}
