package com.laborjustice.casechain.model.outcome;

/**
 * Semantic verdicts recognized in movement codes.
 *
 * <p>First-instance verdicts say whether the employee's claim was granted;
 * appeal verdicts say whether the appeal was upheld, whoever filed it.
 */
public enum Verdict {
    CLAIM_GRANTED(Category.FIRST_INSTANCE, true),
    CLAIM_PARTIALLY_GRANTED(Category.FIRST_INSTANCE, true),
    CLAIM_DENIED(Category.FIRST_INSTANCE, false),
    APPEAL_GRANTED(Category.APPEAL, true),
    APPEAL_PARTIALLY_GRANTED(Category.APPEAL, true),
    APPEAL_DENIED(Category.APPEAL, false),
    APPEAL_NOT_ADMITTED(Category.APPEAL, false);

    public enum Category {
        FIRST_INSTANCE,
        APPEAL
    }

    private final Category category;
    private final boolean positive;

    Verdict(Category category, boolean positive) {
        this.category = category;
        this.positive = positive;
    }

    public Category getCategory() {
        return category;
    }

    public boolean isFirstInstance() {
        return category == Category.FIRST_INSTANCE;
    }

    /**
     * For first-instance verdicts: the claim was (at least partially) granted.
     * For appeal verdicts: the appeal was (at least partially) upheld.
     */
    public boolean isPositive() {
        return positive;
    }
}
