package com.laborjustice.casechain.service;

import com.laborjustice.casechain.model.chain.CaseNumberKeys;
import com.laborjustice.casechain.model.chain.CnjCaseNumber;

import java.util.Optional;

/**
 * Canonicalizes raw case numbers into comparable keys.
 *
 * <p>Implementations are pure: the same input always yields the same keys.
 *
 * @since 1.0.0
 */
public interface IdentifierNormalizer {

    /**
     * Derives the primary key and the alternate keys of a case number.
     *
     * <p>For numbers with at least 20 digits the primary key is the root
     * (sequential + year + branch), stable across tiers. Shorter numbers yield
     * their full digit string as the only key.
     *
     * @param rawNumber case number as recorded, separators allowed; may be null
     * @return keys, empty when the input has no digits
     */
    CaseNumberKeys normalize(String rawNumber);

    /**
     * Decomposes a case number into CNJ segments.
     *
     * @param rawNumber case number as recorded
     * @return the segments, or empty when fewer than 20 digits are present
     */
    Optional<CnjCaseNumber> parse(String rawNumber);

    /**
     * Strips every non-digit character.
     */
    static String digitsOf(String rawNumber) {
        if (rawNumber == null) {
            return "";
        }
        StringBuilder digits = new StringBuilder(rawNumber.length());
        for (int i = 0; i < rawNumber.length(); i++) {
            char c = rawNumber.charAt(i);
            if (c >= '0' && c <= '9') {
                digits.append(c);
            }
        }
        return digits.toString();
    }
}
