package com.pharmascope.helix.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AnalysisTypeTest {

    @Test
    @DisplayName("should resolve preset names case-insensitively")
    void resolvesPresets() {
        assertThat(AnalysisType.fromValue("patent_focus")).isEqualTo(AnalysisType.PATENT_FOCUS);
        assertThat(AnalysisType.fromValue(" Clinical-Focus ")).isEqualTo(AnalysisType.CLINICAL_FOCUS);
    }

    @Test
    @DisplayName("should fall back to comprehensive for blank or unknown values")
    void unknownIsComprehensive() {
        assertThat(AnalysisType.fromValue(null)).isEqualTo(AnalysisType.COMPREHENSIVE);
        assertThat(AnalysisType.fromValue("astrology")).isEqualTo(AnalysisType.COMPREHENSIVE);
        assertThat(AnalysisType.COMPREHENSIVE.getAgents()).hasSize(10).doesNotHaveDuplicates();
    }
}
