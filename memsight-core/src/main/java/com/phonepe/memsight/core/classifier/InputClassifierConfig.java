package com.phonepe.memsight.core.classifier;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Tunables for {@link InputClassifier}
 */
@Value
@Builder
@Jacksonized
public class InputClassifierConfig {
    public static final InputClassifierConfig DEFAULT = InputClassifierConfig.builder().build();

    /**
     * Rule confidence below which the model classifier is consulted. With the defaults a single matching rule
     * already clears it, so the model only sees text no rule matched.
     */
    @Builder.Default
    double modelFallbackThreshold = 0.55;

    @Builder.Default
    double baseRuleConfidence = 0.5;

    @Builder.Default
    double confidencePerMatch = 0.1;

    @Builder.Default
    double maxRuleConfidence = 0.9;

    /**
     * Confidence reported for GENERAL / GENERAL_SEARCH when nothing matched
     */
    @Builder.Default
    double fallbackConfidence = 0.3;

    @Builder.Default
    int cacheSize = 500;
}
