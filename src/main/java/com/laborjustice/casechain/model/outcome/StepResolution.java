package com.laborjustice.casechain.model.outcome;

import com.laborjustice.casechain.model.record.Tier;
import lombok.Builder;
import lombok.Value;

/**
 * One tier transition of a chain and how it was interpreted.
 *
 * <p>{@code lowerTier} is null when the step comes from a single appellate
 * record whose lower tier was never observed.
 */
@Value
@Builder
public class StepResolution {
    Tier lowerTier;
    Tier higherTier;
    Verdict lowerVerdict;
    Verdict higherVerdict;
    Appellant appellant;

    /** Null when the step could not be evaluated. */
    Boolean favorableToEmployee;

    TransitionKind kind;
    TransitionEvidence evidence;

    public String getDescription() {
        return kind.getDescription();
    }
}
