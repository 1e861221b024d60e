package com.pharmascope.helix.agent.impl;

import java.util.List;
import java.util.Locale;

/**
 * Keyword-based therapy area inference shared by the estimating agents.
 */
enum TherapyArea {

    ONCOLOGY("Oncology", List.of("cancer", "tumor", "carcinoma", "oncology", "leukemia", "imatinib")),
    ENDOCRINOLOGY("Diabetes/Endocrinology", List.of("diabetes", "insulin", "blood sugar", "metformin")),
    PAIN("Pain Management", List.of("pain", "analgesic", "headache", "ibuprofen")),
    CARDIOVASCULAR("Cardiovascular", List.of("heart", "cardiovascular", "cholesterol", "statin")),
    INFECTIOUS("Antiviral/Infectious Diseases", List.of("virus", "viral", "infection", "antibiotic")),
    PSYCHIATRY("Psychiatry", List.of("depression", "anxiety", "mental")),
    RHEUMATOLOGY("Rheumatology", List.of("arthritis", "joint", "rheumatoid")),
    GENERAL("General Medicine", List.of());

    private final String label;
    private final List<String> keywords;

    TherapyArea(String label, List<String> keywords) {
        this.label = label;
        this.keywords = keywords;
    }

    String label() {
        return label;
    }

    static TherapyArea infer(String query) {
        String lower = query.toLowerCase(Locale.ROOT);
        for (TherapyArea area : values()) {
            if (area.keywords.stream().anyMatch(lower::contains)) {
                return area;
            }
        }
        return GENERAL;
    }
}
