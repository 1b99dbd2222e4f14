package com.laborjustice.casechain.service;

import com.laborjustice.casechain.model.outcome.Outcome;
import com.laborjustice.casechain.model.record.CaseRecord;

import java.util.List;
import java.util.Map;

/**
 * Maps procedural movements to semantic outcomes.
 *
 * @since 1.0.0
 */
public interface MovementInterpreter {

    /**
     * Extracts the authoritative outcome of one record.
     *
     * <p>The last recognized event of each category wins. A null result
     * means "outcome unknown", never "claim denied".
     *
     * @param record record to interpret
     * @return outcome, or null when no recognized code is present
     */
    Outcome interpretRecord(CaseRecord record);

    /**
     * Interprets a batch of records.
     *
     * @param records records to interpret
     * @return identity map from record to outcome; records without outcome are absent
     */
    Map<CaseRecord, Outcome> interpretAll(List<CaseRecord> records);
}
