package com.laborjustice.casechain.model.outcome;

public enum Appellant {
    EMPLOYEE,
    EMPLOYER,
    UNKNOWN
}
