package com.laborjustice.casechain.model.outcome;

/**
 * Evidence behind one evaluated tier transition.
 */
public enum TransitionEvidence {
    DIRECT(Confidence.HIGH),
    HEURISTIC(Confidence.MEDIUM),
    /** Heuristic whose employee and employer scores tied. */
    HEURISTIC_TIE(Confidence.LOW),
    UNRESOLVED(Confidence.LOW),
    REFORMED(Confidence.LOW);

    private final Confidence confidence;

    TransitionEvidence(Confidence confidence) {
        this.confidence = confidence;
    }

    public Confidence getConfidence() {
        return confidence;
    }

    public boolean isEvaluated() {
        return this == DIRECT || this == HEURISTIC || this == HEURISTIC_TIE;
    }
}
