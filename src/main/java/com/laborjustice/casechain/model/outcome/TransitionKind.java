package com.laborjustice.casechain.model.outcome;

/**
 * Effect of an appeal on the employee's position.
 */
public enum TransitionKind {
    REVERSAL_FAVORABLE("reversed in favor of the employee"),
    REVERSAL_UNFAVORABLE("reversed against the employee"),
    UPHELD_FAVORABLE("upheld"),
    UPHELD_UNFAVORABLE("upheld denial"),
    NOT_DETERMINED("not determined");

    private final String description;

    TransitionKind(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public static TransitionKind of(boolean favorableBefore, boolean appealUpheld) {
        if (favorableBefore) {
            return appealUpheld ? REVERSAL_UNFAVORABLE : UPHELD_FAVORABLE;
        }
        return appealUpheld ? REVERSAL_FAVORABLE : UPHELD_UNFAVORABLE;
    }
}
