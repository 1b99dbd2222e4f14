package com.laborjustice.casechain.model.chain;

import com.laborjustice.casechain.model.record.CaseRecord;
import com.laborjustice.casechain.model.record.Tier;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Records believed to be the same lawsuit, ordered by tier rank.
 *
 * <p>{@code records} holds at most one authoritative record per tier.
 * Same-tier records that lost the authority rule are kept in
 * {@code supersededRecords}: they belong to this chain and to no other.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class CaseChain {

    String chainId;

    @Singular
    List<CaseRecord> records;

    @Singular
    List<CaseRecord> supersededRecords;

    ChainLinkage linkage;

    /** Shared key for key-based linkage, null otherwise. */
    String linkKey;

    /** Lowest similarity score along the chain for similarity linkage, null otherwise. */
    Double linkScore;

    public int size() {
        return records.size();
    }

    public boolean isMultiTier() {
        return records.size() >= 2;
    }

    public Optional<CaseRecord> recordAt(Tier tier) {
        return records.stream().filter(r -> r.getTier() == tier).findFirst();
    }

    public List<Tier> tiers() {
        return records.stream().map(CaseRecord::getTier).collect(Collectors.toList());
    }
}
