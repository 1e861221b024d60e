package com.pharmascope.helix.agent;

import com.pharmascope.helix.config.HelixProperties;
import com.pharmascope.helix.domain.model.AgentErrorKind;
import com.pharmascope.helix.domain.model.AgentResult;
import com.pharmascope.helix.domain.model.DataSource;
import com.pharmascope.helix.domain.model.QualityFlag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.TimeoutException;

/**
 * Shared live/fallback machinery for research agents.
 * <p>
 * The live path calls {@code GET {baseUrl}?query=..&type={name}} when a base URL is configured
 * and runs the local analysis otherwise (stub mode). Live successes are remembered in the
 * {@link AgentResultCache}; the fallback path serves that cached result, or a low-quality
 * local estimate when nothing is cached.
 */
@Slf4j
public abstract class AbstractResearchAgent implements ResearchAgent {

    private static final ParameterizedTypeReference<Map<String, Object>> PAYLOAD_TYPE =
            new ParameterizedTypeReference<>() {};

    private final String name;
    private final String displayName;
    private final AgentResultCache resultCache;
    private final WebClient webClient;
    private final boolean stubMode;

    protected AbstractResearchAgent(String name,
                                    String displayName,
                                    HelixProperties helixProperties,
                                    WebClient.Builder webClientBuilder,
                                    AgentResultCache resultCache) {
        this.name = name;
        this.displayName = displayName;
        this.resultCache = resultCache;

        HelixProperties.SourceProperties source = helixProperties.getAgents().source(name);
        this.stubMode = source.getBaseUrl() == null || source.getBaseUrl().isBlank();

        if (!stubMode) {
            WebClient.Builder builder = webClientBuilder.clone()
                    .baseUrl(source.getBaseUrl())
                    .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
            if (source.getApiKey() != null && !source.getApiKey().isBlank()) {
                builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + source.getApiKey());
            }
            this.webClient = builder.build();
        } else {
            this.webClient = null;
            log.info("Agent {} running in stub mode - results computed locally", name);
        }
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getDisplayName() {
        return displayName;
    }

    @Override
    public boolean supportsFallback() {
        return true;
    }

    public boolean isStubMode() {
        return stubMode;
    }

    // -------------------------------------------------------------------------
    // Live path
    // -------------------------------------------------------------------------

    @Override
    public Mono<AgentResult> invoke(AgentInvocation invocation) {
        Duration budget = invocation.remaining();
        if (budget.isZero()) {
            return Mono.error(AgentException.timeout(name, budget));
        }

        Mono<Map<String, Object>> payload = stubMode
                ? Mono.fromCallable(() -> analyze(invocation.getQuery(), invocation.getOptions()))
                : fetchRemote(invocation);

        return payload
                .map(body -> envelope(body, DataSource.LIVE, liveQuality(), liveConfidence(body)))
                .timeout(budget, Mono.defer(() -> Mono.error(AgentException.timeout(name, budget))))
                .onErrorMap(e -> !(e instanceof AgentException), this::translate)
                .doOnNext(result -> resultCache.put(name, invocation.getQuery(), result))
                .doOnError(e -> log.debug("Live call failed for agent {}: {}", name, e.getMessage()));
    }

    private Mono<Map<String, Object>> fetchRemote(AgentInvocation invocation) {
        return webClient.get()
                .uri(builder -> builder
                        .queryParam("query", invocation.getQuery())
                        .queryParam("type", name)
                        .build())
                .retrieve()
                .bodyToMono(PAYLOAD_TYPE)
                .filter(body -> !body.isEmpty())
                .switchIfEmpty(Mono.error(() -> AgentException.upstream(name,
                        "Empty response from " + name + " source", null)))
                .map(this::normalizeRemote);
    }

    /**
     * Maps transport failures onto the agent error taxonomy.
     */
    protected AgentException translate(Throwable error) {
        if (error instanceof WebClientResponseException responseError) {
            if (responseError.getStatusCode().is4xxClientError()) {
                return AgentException.invalidInput(name,
                        name + " source rejected the request: " + responseError.getStatusCode(), error);
            }
            return AgentException.upstream(name,
                    name + " source returned " + responseError.getStatusCode(), error);
        }
        if (error instanceof WebClientException) {
            return AgentException.upstream(name, name + " source unreachable: " + error.getMessage(), error);
        }
        if (error instanceof TimeoutException) {
            return new AgentException(name, AgentErrorKind.TIMEOUT,
                    error.getMessage(), error);
        }
        return AgentException.internal(name, name + " analysis failed: " + error.getMessage(), error);
    }

    // -------------------------------------------------------------------------
    // Fallback path
    // -------------------------------------------------------------------------

    @Override
    public Mono<AgentResult> fallback(AgentInvocation invocation) {
        return Mono.fromCallable(() -> resultCache.get(name, invocation.getQuery())
                        .map(cached -> cached.withSource(DataSource.CACHED))
                        .orElseGet(() -> estimate(invocation)))
                .onErrorMap(e -> !(e instanceof AgentException),
                        e -> AgentException.internal(name, name + " fallback failed: " + e.getMessage(), e));
    }

    private AgentResult estimate(AgentInvocation invocation) {
        Map<String, Object> body = new LinkedHashMap<>(analyze(invocation.getQuery(), invocation.getOptions()));
        body.put("estimated", true);
        body.put("note", "Estimated locally; live " + displayName + " data unavailable");
        log.warn("Fallback activated for agent {}: serving local estimate", name);
        return envelope(body, DataSource.FALLBACK, QualityFlag.LOW, fallbackConfidence());
    }

    // -------------------------------------------------------------------------
    // Agent hooks
    // -------------------------------------------------------------------------

    /**
     * Local analysis of the query. Deterministic for a given query, so stub runs
     * and estimates are reproducible.
     */
    protected abstract Map<String, Object> analyze(String query, Map<String, Object> options);

    /**
     * Adapts an upstream body to the agent's payload shape.
     */
    protected Map<String, Object> normalizeRemote(Map<String, Object> body) {
        return body;
    }

    protected QualityFlag liveQuality() {
        return stubMode ? QualityFlag.MEDIUM : QualityFlag.HIGH;
    }

    protected double liveConfidence(Map<String, Object> body) {
        return stubMode ? 0.7 : 0.9;
    }

    protected double fallbackConfidence() {
        return 0.3;
    }

    /**
     * Random source seeded from the normalized query.
     */
    protected static Random seeded(String query) {
        return new Random(AgentResultCache.key("", query).hashCode());
    }

    protected static double round(double value, int places) {
        double scale = Math.pow(10, places);
        return Math.round(value * scale) / scale;
    }

    private AgentResult envelope(Map<String, Object> body, DataSource source, QualityFlag quality, double confidence) {
        return AgentResult.builder()
                .agentName(name)
                .source(source)
                .quality(quality)
                .confidence(confidence)
                .generatedAt(Instant.now())
                .payload(body)
                .build();
    }
}
