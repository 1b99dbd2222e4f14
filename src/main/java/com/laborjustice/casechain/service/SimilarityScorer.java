package com.laborjustice.casechain.service;

/**
 * Bounded similarity between two case numbers, used when exact keys fail.
 *
 * @since 1.0.0
 */
public interface SimilarityScorer {

    /**
     * @return score in [0, 1]
     */
    double score(String numberA, String numberB);

    /**
     * @return true when the score reaches the configured match threshold
     */
    boolean isCandidate(double score);
}
