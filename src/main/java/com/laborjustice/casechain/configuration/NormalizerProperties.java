package com.laborjustice.casechain.configuration;

import com.laborjustice.casechain.model.chain.KeyWindowing;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Alternate key windowings, tried by the grouper in list order after the
 * primary key.
 */
@Data
public class NormalizerProperties {

    private List<KeyWindowing> alternateWindowings = new ArrayList<>(List.of(
            KeyWindowing.YEAR_SEQUENTIAL,
            KeyWindowing.SEQUENTIAL_BRANCH_COURT));

    /** Run the alternate-key pass between the exact and similarity passes. */
    private boolean alternateKeyPassEnabled = true;
}
