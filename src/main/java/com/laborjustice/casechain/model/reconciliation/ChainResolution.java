package com.laborjustice.casechain.model.reconciliation;

import com.laborjustice.casechain.model.chain.CaseChain;
import com.laborjustice.casechain.model.outcome.ResolvedOutcome;
import lombok.Value;

@Value(staticConstructor = "of")
public class ChainResolution {
    CaseChain chain;
    ResolvedOutcome outcome;
}
