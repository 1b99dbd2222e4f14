package com.laborjustice.casechain.model.outcome;

/**
 * Confidence in a resolved outcome, ordered from weakest to strongest.
 */
public enum Confidence {
    LOW,
    MEDIUM,
    HIGH;

    public Confidence min(Confidence other) {
        return other == null || compareTo(other) <= 0 ? this : other;
    }
}
