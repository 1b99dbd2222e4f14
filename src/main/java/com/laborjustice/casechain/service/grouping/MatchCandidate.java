package com.laborjustice.casechain.service.grouping;

import com.laborjustice.casechain.model.record.CaseRecord;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.Comparator;

/**
 * A record scored against a search source during the similarity passes.
 */
@Value
public class MatchCandidate {

    /**
     * Best first: highest score, then most recent filing date (missing dates
     * last), then earliest input position.
     */
    public static final Comparator<MatchCandidate> BEST_FIRST = Comparator
            .comparingDouble(MatchCandidate::getScore).reversed()
            .thenComparing(MatchCandidate::getFiledDate, Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder()))
            .thenComparingInt(MatchCandidate::getIndex);

    int index;
    CaseRecord record;
    double score;

    public LocalDateTime getFiledDate() {
        return record.getFiledDate();
    }
}
