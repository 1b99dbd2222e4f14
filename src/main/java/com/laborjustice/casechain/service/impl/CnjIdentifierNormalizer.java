package com.laborjustice.casechain.service.impl;

import com.laborjustice.casechain.configuration.ReconciliationProperties;
import com.laborjustice.casechain.model.chain.CaseNumberKeys;
import com.laborjustice.casechain.model.chain.CnjCaseNumber;
import com.laborjustice.casechain.model.chain.KeyWindowing;
import com.laborjustice.casechain.service.IdentifierNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Normalizer for national (CNJ) case numbers.
 *
 * <p>The trailing court and originating-unit segments differ between the
 * first-instance, appellate and superior filings of the same lawsuit, so the
 * primary key keeps only sequential number, filing year and branch digit.
 * Alternate keys come from the configured windowings, in priority order.
 *
 * <p><b>Thread Safety:</b> stateless after construction.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class CnjIdentifierNormalizer implements IdentifierNormalizer {

    static final int CNJ_DIGITS = 20;

    private final List<KeyWindowing> alternateWindowings;

    public CnjIdentifierNormalizer(ReconciliationProperties properties) {
        this.alternateWindowings = List.copyOf(properties.getNormalizer().getAlternateWindowings());
    }

    @Override
    public CaseNumberKeys normalize(String rawNumber) {
        String digits = IdentifierNormalizer.digitsOf(rawNumber);
        if (digits.isEmpty()) {
            return CaseNumberKeys.empty();
        }

        if (digits.length() < CNJ_DIGITS) {
            return CaseNumberKeys.builder()
                    .digits(digits)
                    .primaryKey(digits)
                    .structured(false)
                    .build();
        }

        CaseNumberKeys.CaseNumberKeysBuilder keys = CaseNumberKeys.builder()
                .digits(digits)
                .primaryKey(KeyWindowing.ROOT.apply(digits))
                .structured(true);

        for (KeyWindowing windowing : alternateWindowings) {
            if (windowing != KeyWindowing.ROOT) {
                keys.alternateKey(windowing, windowing.apply(digits));
            }
        }
        return keys.build();
    }

    @Override
    public Optional<CnjCaseNumber> parse(String rawNumber) {
        String digits = IdentifierNormalizer.digitsOf(rawNumber);
        if (digits.length() < CNJ_DIGITS) {
            return Optional.empty();
        }
        return Optional.of(CnjCaseNumber.builder()
                .sequential(digits.substring(0, 7))
                .checkDigits(digits.substring(7, 9))
                .year(digits.substring(9, 13))
                .branch(digits.substring(13, 14))
                .court(digits.substring(14, 16))
                .origin(digits.substring(16, 20))
                .digits(digits)
                .build());
    }
}
