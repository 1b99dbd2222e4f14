package com.laborjustice.casechain.model.chain;

/**
 * How the records of a chain were linked together.
 */
public enum ChainLinkage {
    /** Identical primary keys. */
    EXACT_KEY,
    /** Identical alternate key (a secondary windowing of the case number). */
    ALTERNATE_KEY,
    /** Similarity score at or above the threshold. */
    SIMILARITY,
    /** Single record that matched nothing. */
    UNLINKED
}
