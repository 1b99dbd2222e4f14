package com.laborjustice.casechain.model.chain;

import lombok.Builder;
import lombok.Value;

/**
 * A case number decomposed into the national (CNJ) segments.
 *
 * <p>Format: {@code NNNNNNN-DD.AAAA.J.TR.OOOO}.
 */
@Value
@Builder
public class CnjCaseNumber {
    String sequential;
    String checkDigits;
    String year;
    String branch;
    String court;
    String origin;
    String digits;
}
