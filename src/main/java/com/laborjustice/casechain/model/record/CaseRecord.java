package com.laborjustice.casechain.model.record;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

/**
 * One tier's filing of a lawsuit, as produced by an ingestion collaborator.
 *
 * <p>Immutable. The engine only derives data from it; movements keep the
 * order in which the source supplied them, which is taken as chronological.
 *
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
public class CaseRecord {

    /** Case number as recorded, separators included. */
    String rawNumber;

    Tier tier;

    /** Deciding body, e.g. "TRT2" or "TST". */
    String court;

    @Singular
    List<MovementEvent> movements;

    /** Filing date; null when the source did not carry a parseable one. */
    LocalDateTime filedDate;

    @Singular
    List<SubjectCode> subjectCodes;

    /** Identifier of the source document, when the collaborator has one. */
    String sourceId;
}
