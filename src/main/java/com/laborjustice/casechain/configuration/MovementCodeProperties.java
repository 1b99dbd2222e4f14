package com.laborjustice.casechain.configuration;

import com.laborjustice.casechain.model.outcome.Verdict;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Movement codes of the unified procedural table (TPU) that the interpreter
 * recognizes. Any other code is ignored.
 */
@Data
public class MovementCodeProperties {

    @NotEmpty
    private Map<Integer, Verdict> verdictCodes = defaultVerdictCodes();

    /** "Prior decision reformed" codes. */
    private List<Integer> reformCodes = new ArrayList<>(List.of(190));

    /**
     * Substrings of an attachment key that identify the type of the reformed
     * decision. Compared without case or accents.
     */
    private List<String> priorDecisionMarkers = new ArrayList<>(List.of("decisao", "tipo"));

    private static Map<Integer, Verdict> defaultVerdictCodes() {
        Map<Integer, Verdict> codes = new LinkedHashMap<>();
        codes.put(219, Verdict.CLAIM_GRANTED);
        codes.put(220, Verdict.CLAIM_DENIED);
        codes.put(221, Verdict.CLAIM_PARTIALLY_GRANTED);
        codes.put(237, Verdict.APPEAL_GRANTED);
        codes.put(238, Verdict.APPEAL_PARTIALLY_GRANTED);
        codes.put(242, Verdict.APPEAL_DENIED);
        codes.put(236, Verdict.APPEAL_NOT_ADMITTED);
        return codes;
    }
}
