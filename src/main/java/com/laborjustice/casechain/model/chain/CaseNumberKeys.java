package com.laborjustice.casechain.model.chain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.Optional;

/**
 * Comparable keys derived from a raw case number.
 *
 * <p>{@code alternateKeys} keeps the configured priority order of the windowings.
 */
@Value
@Builder
public class CaseNumberKeys {

    private static final CaseNumberKeys EMPTY = CaseNumberKeys.builder()
            .digits("")
            .primaryKey("")
            .structured(false)
            .build();

    String digits;
    String primaryKey;

    /** True when the digit string was long enough for the CNJ windowings. */
    boolean structured;

    @Singular
    Map<KeyWindowing, String> alternateKeys;

    public static CaseNumberKeys empty() {
        return EMPTY;
    }

    public boolean hasPrimaryKey() {
        return primaryKey != null && !primaryKey.isEmpty();
    }

    public Optional<String> alternateKey(KeyWindowing windowing) {
        return Optional.ofNullable(alternateKeys.get(windowing));
    }
}
