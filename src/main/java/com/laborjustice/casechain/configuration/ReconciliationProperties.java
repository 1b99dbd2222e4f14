package com.laborjustice.casechain.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

/**
 * Root of the reconciliation rule set, bound from {@code casechain.*}.
 *
 * <p>Code tables, thresholds and keyword lists are domain assumptions, not
 * constants: they are versioned through {@code rules-version} and every
 * result carries the version it was produced with.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "casechain")
public class ReconciliationProperties {

    @NotBlank(message = "Rules version is required")
    private String rulesVersion = "2024.06";

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private NormalizerProperties normalizer = new NormalizerProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private MovementCodeProperties movements = new MovementCodeProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private SimilarityProperties similarity = new SimilarityProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private AppellantHeuristicProperties heuristics = new AppellantHeuristicProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private EngineProperties engine = new EngineProperties();
}
