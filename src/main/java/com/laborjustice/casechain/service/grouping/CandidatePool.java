package com.laborjustice.casechain.service.grouping;

import com.laborjustice.casechain.model.record.CaseRecord;
import com.laborjustice.casechain.model.record.Tier;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * Ungrouped record indices of one grouping run.
 *
 * <p>Owned by a single writer and threaded through every pass. A record
 * leaves the pool exactly once; claiming it twice is a programming error, so
 * chain disjointness holds by construction.
 */
public final class CandidatePool {

    private final List<CaseRecord> records;
    private final BitSet available;

    public CandidatePool(List<CaseRecord> records) {
        this.records = records;
        this.available = new BitSet(records.size());
        this.available.set(0, records.size());
    }

    public CaseRecord record(int index) {
        return records.get(index);
    }

    public boolean isAvailable(int index) {
        return available.get(index);
    }

    /**
     * Removes a record from the pool.
     *
     * @throws IllegalStateException if the record was already claimed
     */
    public void claim(int index) {
        if (!available.get(index)) {
            throw new IllegalStateException("Record " + index + " already belongs to a chain");
        }
        available.clear(index);
    }

    /**
     * @return available indices of the tier, in input order
     */
    public List<Integer> available(Tier tier) {
        List<Integer> indices = new ArrayList<>();
        for (int i = available.nextSetBit(0); i >= 0; i = available.nextSetBit(i + 1)) {
            if (records.get(i).getTier() == tier) {
                indices.add(i);
            }
        }
        return indices;
    }

    /**
     * @return all available indices, in input order
     */
    public List<Integer> remaining() {
        List<Integer> indices = new ArrayList<>(available.cardinality());
        for (int i = available.nextSetBit(0); i >= 0; i = available.nextSetBit(i + 1)) {
            indices.add(i);
        }
        return indices;
    }

    public int size() {
        return available.cardinality();
    }
}
