package com.laborjustice.casechain.model.reconciliation;

import com.laborjustice.casechain.model.chain.CaseChain;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Output of the grouping stage: multi-tier chains plus single-record residuals.
 */
@Value
@Builder
public class GroupingResult {

    @Singular
    List<CaseChain> chains;

    @Singular
    List<CaseChain> residuals;
}
