package com.pharmascope.helix.agent.impl;

import com.pharmascope.helix.agent.AbstractResearchAgent;
import com.pharmascope.helix.agent.AgentResultCache;
import com.pharmascope.helix.config.HelixProperties;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;

/**
 * Public web signals: news, guidelines and regulator announcements.
 */
@Component
public class WebIntelligenceAgent extends AbstractResearchAgent {

    private static final List<String> SOURCES = List.of(
            "FDA", "EMA", "WHO", "FiercePharma", "Reuters Health", "STAT News", "Medscape");

    public WebIntelligenceAgent(HelixProperties helixProperties,
                                WebClient.Builder webClientBuilder,
                                AgentResultCache resultCache) {
        super("web", "Web Intelligence", helixProperties, webClientBuilder, resultCache);
    }

    @Override
    protected Map<String, Object> analyze(String query, Map<String, Object> options) {
        Random random = seeded(query);
        int limit = Math.min(((Number) options.getOrDefault("maxSources", 5)).intValue(), SOURCES.size());

        List<Map<String, Object>> sources = new ArrayList<>();
        for (int i = 0; i < limit; i++) {
            sources.add(Map.of(
                    "source", SOURCES.get(i),
                    "title", String.format(Locale.ROOT, "%s: update on %s", SOURCES.get(i), query),
                    "relevance", round(0.5 + random.nextDouble() * 0.5, 2)));
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sourcesFound", sources.size());
        payload.put("sources", sources);
        payload.put("insights", String.format(Locale.ROOT,
                "Web intelligence for '%s': %d relevant public sources", query, sources.size()));
        return payload;
    }
}
