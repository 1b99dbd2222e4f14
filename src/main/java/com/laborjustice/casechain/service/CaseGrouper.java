package com.laborjustice.casechain.service;

import com.laborjustice.casechain.model.reconciliation.GroupingResult;
import com.laborjustice.casechain.model.record.CaseRecord;

import java.util.List;

/**
 * Partitions records into chains believed to be the same lawsuit.
 *
 * <p>Chains are disjoint and, for a fixed input order, deterministic.
 *
 * @since 1.0.0
 */
public interface CaseGrouper {

    /**
     * @param records well-formed records (non-null number and tier)
     * @return multi-tier chains and the single-record residuals
     */
    GroupingResult buildChains(List<CaseRecord> records);
}
