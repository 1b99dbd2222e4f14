package com.laborjustice.casechain.model.outcome;

import lombok.Value;

/**
 * Appellant inferred from subject codes, with the scores that produced it.
 */
@Value
public class AppellantGuess {
    Appellant appellant;
    int employeeScore;
    int employerScore;

    public boolean isTie() {
        return employeeScore == employerScore;
    }
}
