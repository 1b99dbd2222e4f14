package com.laborjustice.casechain.service;

import com.laborjustice.casechain.model.reconciliation.ReconciliationResult;
import com.laborjustice.casechain.model.record.CaseRecord;

import java.util.List;

/**
 * Runs the four stages (normalize, group, interpret, resolve) over a batch.
 *
 * <p>Records missing a case number or tier are skipped and reported. Only a
 * missing batch aborts the run.
 *
 * @since 1.0.0
 */
public interface ReconciliationService {

    /**
     * @param records batch of records; null elements are reported as malformed
     * @return chains with outcomes, residuals and malformed records
     * @throws com.laborjustice.casechain.exception.ReconciliationException if {@code records} is null
     */
    ReconciliationResult reconcile(List<CaseRecord> records);
}
