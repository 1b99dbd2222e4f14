package com.laborjustice.casechain.service.impl;

import com.laborjustice.casechain.configuration.ReconciliationProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("Case Number Similarity Scorer Tests")
class CaseNumberSimilarityScorerTest {

    private final ReconciliationProperties properties = new ReconciliationProperties();
    private final CaseNumberSimilarityScorer scorer =
            new CaseNumberSimilarityScorer(new CnjIdentifierNormalizer(properties), properties);

    @ParameterizedTest(name = "{0} vs {1} = {2}")
    @CsvSource({
            "0012345-67.2020.5.02.0001, 0012345-67.2020.5.15.0000, 1.0",
            "0012345-67.2020.5.02.0001, 0012345-67.2020.8.02.0001, 0.8889",
            "0012345-67.2020.5.02.0001, 0012345-67.2021.5.02.0001, 0.6667",
            "0012345-67.2020.5.02.0001, 0099999-67.2020.5.02.0001, 0.4444",
            "0012345-67.2020.5.02.0001, 0099999-67.2019.8.02.0001, 0.0"
    })
    @DisplayName("Structured numbers are scored by weighted segments")
    void testWeightedScore(String a, String b, double expected) {
        assertThat(scorer.score(a, b)).isCloseTo(expected, within(0.0001));
    }

    @Test
    @DisplayName("Score is symmetric and reflexive")
    void testSymmetry() {
        String a = "0012345-67.2020.5.02.0001";
        String b = "12345/2019";

        assertThat(scorer.score(a, b)).isEqualTo(scorer.score(b, a));
        assertThat(scorer.score(a, a)).isEqualTo(1.0);
        assertThat(scorer.score(b, b)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Unparseable numbers fall back to longest common substring")
    void testLongestCommonSubstringFallback() {
        assertThat(scorer.score("12345678", "912345678")).isEqualTo(1.0);
        assertThat(scorer.score("1234", "9934")).isEqualTo(0.5);
        assertThat(scorer.score("", "1234")).isEqualTo(0.0);
        assertThat(scorer.score(null, "1234")).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Candidate threshold is inclusive")
    void testThreshold() {
        assertThat(scorer.isCandidate(0.8)).isTrue();
        assertThat(scorer.isCandidate(0.79)).isFalse();
    }

    @Test
    @DisplayName("All-zero weights are rejected")
    void testZeroWeights() {
        ReconciliationProperties zero = new ReconciliationProperties();
        zero.getSimilarity().setSequentialWeight(0);
        zero.getSimilarity().setYearWeight(0);
        zero.getSimilarity().setBranchWeight(0);

        assertThatThrownBy(() -> new CaseNumberSimilarityScorer(new CnjIdentifierNormalizer(zero), zero))
                .isInstanceOf(IllegalStateException.class);
    }
}
