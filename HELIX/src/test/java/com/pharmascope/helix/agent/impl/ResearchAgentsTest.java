package com.pharmascope.helix.agent.impl;

import com.pharmascope.helix.agent.AbstractResearchAgent;
import com.pharmascope.helix.agent.AgentInvocation;
import com.pharmascope.helix.agent.AgentResultCache;
import com.pharmascope.helix.config.HelixProperties;
import com.pharmascope.helix.domain.model.AgentResult;
import com.pharmascope.helix.domain.model.AnalysisType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Stub-mode behavior of the built-in research agents.
 */
class ResearchAgentsTest {

    private static final HelixProperties PROPERTIES = new HelixProperties();

    static Stream<AbstractResearchAgent> agents() {
        AgentResultCache cache = new AgentResultCache(PROPERTIES);
        WebClient.Builder builder = WebClient.builder();
        return Stream.of(
                new MarketIntelligenceAgent(PROPERTIES, builder, cache),
                new EximTradeAgent(PROPERTIES, builder, cache),
                new PatentLandscapeAgent(PROPERTIES, builder, cache),
                new ClinicalTrialsAgent(PROPERTIES, builder, cache),
                new InternalDocumentsAgent(PROPERTIES, builder, cache),
                new WebIntelligenceAgent(PROPERTIES, builder, cache),
                new LiteratureAgent(PROPERTIES, builder, cache),
                new PropertyPredictionAgent(PROPERTIES, builder, cache),
                new GenerativeDesignAgent(PROPERTIES, builder, cache),
                new NlpSynthesisAgent(PROPERTIES, builder, cache));
    }

    private static AgentInvocation invocation(AbstractResearchAgent agent, String query) {
        return AgentInvocation.builder()
                .jobId("job-1")
                .agentName(agent.getName())
                .query(query)
                .deadline(Instant.now().plusSeconds(5))
                .build();
    }

    @Test
    @DisplayName("should cover every agent of the comprehensive preset exactly once")
    void namesMatchPreset() {
        List<String> names = agents().map(AbstractResearchAgent::getName).collect(Collectors.toList());

        assertThat(names).containsExactlyElementsOf(AnalysisType.COMPREHENSIVE.getAgents());
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("agents")
    @DisplayName("should produce insights deterministically for the same query")
    void deterministicInsights(AbstractResearchAgent agent) {
        AgentResult first = agent.invoke(invocation(agent, "imatinib")).block(Duration.ofSeconds(5));
        AgentResult second = agent.invoke(invocation(agent, "imatinib")).block(Duration.ofSeconds(5));

        assertThat(first.getPayload()).containsKey("insights");
        assertThat(first.getConfidence()).isBetween(0.0, 1.0);
        assertThat(second.getPayload()).isEqualTo(first.getPayload());
    }
}
