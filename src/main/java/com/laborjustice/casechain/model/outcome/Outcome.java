package com.laborjustice.casechain.model.outcome;

import com.laborjustice.casechain.model.record.Tier;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Outcome extracted from one record's movements.
 *
 * <p>Keeps the last verdict seen per category. Higher-tier dockets frequently
 * repeat the first-instance verdict of the case, so both categories may be
 * filled on an appellate record.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class Outcome {

    Tier tier;

    Verdict firstInstanceVerdict;
    Integer firstInstanceCode;

    Verdict appealVerdict;
    Integer appealCode;

    /** Code of the last "prior decision reformed" event, null when none. */
    Integer reformCode;
    Map<String, String> reformAttachments;
    String priorDecisionType;

    /** A reform event exists but the record's own-tier verdict is missing. */
    boolean reformOnly;

    /** The reform event came after the record's own-tier verdict. */
    boolean reformAfterVerdict;

    /**
     * Verdict of the record's own tier: the first-instance verdict for
     * first-instance records, the appeal verdict otherwise.
     */
    public Verdict ownVerdict() {
        return tier == Tier.FIRST_INSTANCE ? firstInstanceVerdict : appealVerdict;
    }

    public boolean hasReform() {
        return reformCode != null;
    }

    /**
     * The reform is the last word on this record: either no own-tier verdict
     * exists or the reform came after it. The verdict is then not reported.
     */
    public boolean isReformAuthoritative() {
        return reformOnly || reformAfterVerdict;
    }
}
