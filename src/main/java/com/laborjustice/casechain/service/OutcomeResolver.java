package com.laborjustice.casechain.service;

import com.laborjustice.casechain.model.chain.CaseChain;
import com.laborjustice.casechain.model.outcome.Outcome;
import com.laborjustice.casechain.model.outcome.ResolvedOutcome;
import com.laborjustice.casechain.model.record.CaseRecord;

import java.util.Map;

/**
 * Determines who appealed at each tier transition and the final result for
 * the employee.
 *
 * @since 1.0.0
 */
public interface OutcomeResolver {

    /**
     * Resolves a chain, interpreting its records on the fly.
     */
    ResolvedOutcome resolve(CaseChain chain);

    /**
     * Resolves a chain from outcomes computed by an earlier interpretation stage.
     *
     * @param outcomesByRecord identity map; records missing from it have an unknown outcome
     */
    ResolvedOutcome resolve(CaseChain chain, Map<CaseRecord, Outcome> outcomesByRecord);
}
