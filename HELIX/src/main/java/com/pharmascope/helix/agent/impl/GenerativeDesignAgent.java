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
 * Suggests analogue candidates for the query molecule.
 */
@Component
public class GenerativeDesignAgent extends AbstractResearchAgent {

    private static final List<String> SUFFIXES = List.of("-analog", "-derivative", "-prodrug", "-conjugate", "-isomer");

    public GenerativeDesignAgent(HelixProperties helixProperties,
                                 WebClient.Builder webClientBuilder,
                                 AgentResultCache resultCache) {
        super("generative_ai", "Generative Design", helixProperties, webClientBuilder, resultCache);
    }

    @Override
    protected Map<String, Object> analyze(String query, Map<String, Object> options) {
        Random random = seeded(query);
        int count = Math.min(((Number) options.getOrDefault("candidates", 5)).intValue(), SUFFIXES.size());
        String base = query.length() > 40 ? query.substring(0, 40) : query;

        List<Map<String, Object>> candidates = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            candidates.add(Map.of(
                    "candidateId", String.format(Locale.ROOT, "CAND-%03d", i + 1),
                    "name", base + SUFFIXES.get(i),
                    "structure", String.format(Locale.ROOT, "C%dH%dN%dO%d",
                            10 + random.nextInt(21), 15 + random.nextInt(36), random.nextInt(6), 1 + random.nextInt(8)),
                    "predictedActivity", String.format(Locale.ROOT, "IC50: %.2f uM", 0.1 + random.nextDouble() * 9.9),
                    "confidence", round(0.7 + random.nextDouble() * 0.25, 3)));
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("candidates", candidates);
        payload.put("insights", String.format(Locale.ROOT,
                "%d candidate structures generated from '%s'", candidates.size(), query));
        return payload;
    }
}
