package com.laborjustice.casechain.model.reconciliation;

import com.laborjustice.casechain.model.chain.ChainLinkage;
import com.laborjustice.casechain.model.outcome.Confidence;
import com.laborjustice.casechain.model.outcome.ResolutionStatus;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Completeness accounting for one reconciliation run.
 */
@Value
@Builder
public class ReconciliationSummary {
    int totalRecords;
    int malformedRecords;
    int chainedRecords;
    int supersededRecords;
    int residualRecords;
    int chains;
    Map<ChainLinkage, Integer> chainsByLinkage;
    Map<Integer, Integer> chainsByLength;
    Map<ResolutionStatus, Integer> chainsByStatus;
    Map<Confidence, Integer> chainsByConfidence;
}
