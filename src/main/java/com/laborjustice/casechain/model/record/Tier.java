package com.laborjustice.casechain.model.record;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Judicial level at which a lawsuit record was filed.
 *
 * <p>The rank orders records inside a chain: first-instance court, regional
 * appellate court, superior labor court.
 *
 * @since 1.0.0
 */
public enum Tier {
    FIRST_INSTANCE(1, Set.of("G1", "GRAU_1", "1")),
    APPELLATE(2, Set.of("G2", "GRAU_2", "2")),
    SUPERIOR(3, Set.of("GS", "SUP", "TST", "3"));

    private final int rank;
    private final Set<String> gradeCodes;

    Tier(int rank, Set<String> gradeCodes) {
        this.rank = rank;
        this.gradeCodes = gradeCodes;
    }

    public int getRank() {
        return rank;
    }

    /**
     * Maps a registry grade code ("G1", "G2", "GS", ...) to a tier.
     *
     * @param gradeCode raw grade as exported by the court registry, case-insensitive
     * @return the tier, or empty when the code is blank or unknown
     */
    public static Optional<Tier> fromGradeCode(String gradeCode) {
        if (gradeCode == null || gradeCode.isBlank()) {
            return Optional.empty();
        }
        String normalized = gradeCode.trim().toUpperCase(Locale.ROOT);
        for (Tier tier : values()) {
            if (tier.name().equals(normalized) || tier.gradeCodes.contains(normalized)) {
                return Optional.of(tier);
            }
        }
        return Optional.empty();
    }
}
