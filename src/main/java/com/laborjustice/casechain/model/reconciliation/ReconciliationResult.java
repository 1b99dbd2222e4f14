package com.laborjustice.casechain.model.reconciliation;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Everything a reconciliation run hands to downstream collaborators.
 *
 * <p>{@code residuals} are single-record chains: they are resolved like any
 * other chain but kept apart so outcome statistics can exclude them.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class ReconciliationResult {

    String rulesVersion;

    @Singular
    List<ChainResolution> chains;

    @Singular
    List<ChainResolution> residuals;

    @Singular
    List<MalformedRecord> malformedRecords;

    ReconciliationSummary summary;
}
