package com.laborjustice.casechain.model.outcome;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Final interpretation of a chain for the employee.
 *
 * <p>{@code finalFavorableToEmployee} is null when unknown, which is never the
 * same as "lost".
 *
 * @since 1.0.0
 */
@Value
@Builder
public class ResolvedOutcome {

    Boolean finalFavorableToEmployee;

    @Singular
    List<StepResolution> steps;

    Confidence confidence;
    ResolutionStatus status;

    /** Some record of the chain carries a "decision reformed" event. */
    boolean reformObserved;

    String flowSummary;

    public List<Appellant> getWhoAppealedPerStep() {
        return steps.stream().map(StepResolution::getAppellant).collect(Collectors.toList());
    }

    public boolean isFinalKnown() {
        return finalFavorableToEmployee != null;
    }
}
