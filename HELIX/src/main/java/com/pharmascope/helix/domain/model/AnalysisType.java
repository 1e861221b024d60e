package com.pharmascope.helix.domain.model;

import java.util.List;
import java.util.Locale;

/**
 * Named agent presets a caller can request instead of an explicit agent list.
 */
public enum AnalysisType {

    COMPREHENSIVE(List.of(
            "market", "exim", "patent", "clinical", "internal",
            "web", "literature", "ml_prediction", "generative_ai", "nlp_analysis")),

    PATENT_FOCUS(List.of("patent", "clinical", "internal", "literature", "nlp_analysis")),

    CLINICAL_FOCUS(List.of("clinical", "market", "internal", "literature", "ml_prediction", "nlp_analysis")),

    MARKET_FOCUS(List.of("market", "exim", "web", "literature", "ml_prediction"));

    private final List<String> agents;

    AnalysisType(List<String> agents) {
        this.agents = agents;
    }

    public List<String> getAgents() {
        return agents;
    }

    /**
     * Lenient lookup. Unknown or blank values resolve to {@link #COMPREHENSIVE}.
     */
    public static AnalysisType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return COMPREHENSIVE;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (AnalysisType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        return COMPREHENSIVE;
    }
}
