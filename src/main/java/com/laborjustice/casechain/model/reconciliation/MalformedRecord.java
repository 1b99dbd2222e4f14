package com.laborjustice.casechain.model.reconciliation;

import lombok.Value;

/**
 * Input record skipped before reconciliation.
 *
 * @see com.laborjustice.casechain.service.ReconciliationService
 */
@Value(staticConstructor = "of")
public class MalformedRecord {
    /** Position in the submitted batch. */
    int index;
    String rawNumber;
    String reason;
}
