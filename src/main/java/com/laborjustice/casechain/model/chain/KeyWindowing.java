package com.laborjustice.casechain.model.chain;

/**
 * Windowings of a 20-digit CNJ case number used to derive comparable keys.
 *
 * <p>Layout of the digit string: {@code NNNNNNN DD AAAA J TR OOOO}
 * (sequential, check digits, filing year, judicial branch, court, originating unit).
 * The court and originating-unit segments legitimately change between tiers,
 * so no windowing relies on the trailing four digits. Every windowing keeps
 * the sequential segment.
 */
public enum KeyWindowing {

    /** Sequential + year + branch. The primary key. */
    ROOT {
        @Override
        public String apply(String digits) {
            return digits.substring(0, 7) + digits.substring(9, 13) + digits.charAt(13);
        }
    },

    /** Year + sequential. */
    YEAR_SEQUENTIAL {
        @Override
        public String apply(String digits) {
            return digits.substring(9, 13) + digits.substring(0, 7);
        }
    },

    /** Sequential + branch + court. */
    SEQUENTIAL_BRANCH_COURT {
        @Override
        public String apply(String digits) {
            return digits.substring(0, 7) + digits.substring(13, 16);
        }
    };

    /**
     * @param digits digit-only case number with at least 20 digits
     */
    public abstract String apply(String digits);
}
