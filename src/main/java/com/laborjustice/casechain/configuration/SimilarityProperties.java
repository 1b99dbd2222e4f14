package com.laborjustice.casechain.configuration;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;

/**
 * Thresholds and segment weights for case-number similarity.
 *
 * <p>Example configuration:
 * <pre>
 * casechain:
 *   similarity:
 *     threshold: 0.8
 *     sequential-weight: 5
 *     year-weight: 3
 *     branch-weight: 1
 * </pre>
 */
@Data
public class SimilarityProperties {

    /** Minimum score (0.0-1.0) for two numbers to be candidate matches. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double threshold = 0.8;

    @Min(0)
    private int sequentialWeight = 5;

    @Min(0)
    private int yearWeight = 3;

    /** Court and originating unit carry no weight: they change between tiers. */
    @Min(0)
    private int branchWeight = 1;
}
