package com.laborjustice.casechain.model.outcome;

public enum ResolutionStatus {
    /** A final value was produced, directly or by heuristic. */
    RESOLVED,
    /** The last observed event reforms a prior decision; no verdict is confirmed. */
    REFORMED_UNCONFIRMED,
    /** Nothing usable was observed. */
    UNKNOWN
}
