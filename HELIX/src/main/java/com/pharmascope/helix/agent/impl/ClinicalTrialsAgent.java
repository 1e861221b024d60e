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
import java.util.TreeMap;

/**
 * Registered trials, phase distribution and enrolment for a molecule or indication.
 */
@Component
public class ClinicalTrialsAgent extends AbstractResearchAgent {

    private static final List<String> PHASES = List.of("Phase 1", "Phase 2", "Phase 3", "Phase 4");
    private static final List<String> STATUSES = List.of("Completed", "Recruiting", "Active, not recruiting");

    public ClinicalTrialsAgent(HelixProperties helixProperties,
                               WebClient.Builder webClientBuilder,
                               AgentResultCache resultCache) {
        super("clinical", "Clinical Trials", helixProperties, webClientBuilder, resultCache);
    }

    @Override
    protected Map<String, Object> analyze(String query, Map<String, Object> options) {
        Random random = seeded(query);
        int count = 2 + random.nextInt(6);

        List<Map<String, Object>> trials = new ArrayList<>();
        Map<String, Integer> phases = new TreeMap<>();
        int participants = 0;
        int completed = 0;
        for (int i = 0; i < count; i++) {
            String phase = PHASES.get(random.nextInt(PHASES.size()));
            String status = STATUSES.get(random.nextInt(STATUSES.size()));
            int enrolment = 50 + random.nextInt(951);
            phases.merge(phase, 1, Integer::sum);
            participants += enrolment;
            if ("Completed".equals(status)) {
                completed++;
            }
            trials.add(Map.of(
                    "nctId", String.format(Locale.ROOT, "NCT%08d", random.nextInt(100_000_000)),
                    "phase", phase,
                    "status", status,
                    "participants", enrolment));
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("therapyArea", TherapyArea.infer(query).label());
        payload.put("totalTrials", count);
        payload.put("completedTrials", completed);
        payload.put("ongoingTrials", count - completed);
        payload.put("totalParticipants", participants);
        payload.put("phases", phases);
        payload.put("trials", trials);
        payload.put("insights", String.format(Locale.ROOT,
                "Clinical trials for '%s': %d trials (%d completed, %d ongoing), %d participants",
                query, count, completed, count - completed, participants));
        return payload;
    }
}
