package com.laborjustice.casechain.service.impl;

import com.laborjustice.casechain.configuration.ReconciliationProperties;
import com.laborjustice.casechain.configuration.SimilarityProperties;
import com.laborjustice.casechain.model.chain.CnjCaseNumber;
import com.laborjustice.casechain.service.IdentifierNormalizer;
import com.laborjustice.casechain.service.SimilarityScorer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Case-number similarity.
 *
 * <p>Structured numbers are compared segment by segment with configurable
 * weights (sequential number, filing year, branch digit). Numbers that do not
 * parse fall back to the longest common substring of their digits, normalized
 * by the shorter string.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class CaseNumberSimilarityScorer implements SimilarityScorer {

    private final IdentifierNormalizer normalizer;
    private final double threshold;
    private final int sequentialWeight;
    private final int yearWeight;
    private final int branchWeight;

    public CaseNumberSimilarityScorer(IdentifierNormalizer normalizer, ReconciliationProperties properties) {
        SimilarityProperties similarity = properties.getSimilarity();
        this.normalizer = normalizer;
        this.threshold = similarity.getThreshold();
        this.sequentialWeight = similarity.getSequentialWeight();
        this.yearWeight = similarity.getYearWeight();
        this.branchWeight = similarity.getBranchWeight();

        if (sequentialWeight + yearWeight + branchWeight == 0) {
            throw new IllegalStateException("At least one similarity weight must be positive");
        }
    }

    @Override
    public double score(String numberA, String numberB) {
        Optional<CnjCaseNumber> parsedA = normalizer.parse(numberA);
        Optional<CnjCaseNumber> parsedB = normalizer.parse(numberB);

        if (parsedA.isPresent() && parsedB.isPresent()) {
            return weightedScore(parsedA.get(), parsedB.get());
        }
        return longestCommonSubstringScore(
                IdentifierNormalizer.digitsOf(numberA),
                IdentifierNormalizer.digitsOf(numberB));
    }

    @Override
    public boolean isCandidate(double score) {
        return score >= threshold;
    }

    private double weightedScore(CnjCaseNumber a, CnjCaseNumber b) {
        int matched = 0;
        if (a.getSequential().equals(b.getSequential())) {
            matched += sequentialWeight;
        }
        if (a.getYear().equals(b.getYear())) {
            matched += yearWeight;
        }
        if (a.getBranch().equals(b.getBranch())) {
            matched += branchWeight;
        }
        return (double) matched / (sequentialWeight + yearWeight + branchWeight);
    }

    /**
     * Classic O(n·m) dynamic programming; only the previous row is kept.
     */
    static double longestCommonSubstringScore(String a, String b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }

        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        int longest = 0;

        for (int i = 1; i <= a.length(); i++) {
            for (int j = 1; j <= b.length(); j++) {
                if (a.charAt(i - 1) == b.charAt(j - 1)) {
                    current[j] = previous[j - 1] + 1;
                    longest = Math.max(longest, current[j]);
                } else {
                    current[j] = 0;
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }

        return (double) longest / Math.min(a.length(), b.length());
    }
}
