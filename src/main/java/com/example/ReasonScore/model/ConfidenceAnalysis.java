package com.example.ReasonScore.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Multi-dimensional confidence result, one per assessment call.
 *
 * Consumers should act on {@code overall}; the other fields explain it.
 * overall and reasoningConfidence lie in the configured confidence range,
 * the remaining scores are raw [0,1] diagnostics.
 */
public record ConfidenceAnalysis(
        @JsonProperty("overall") double overall,
        @JsonProperty("reasoning_confidence") double reasoningConfidence,
        @JsonProperty("evidence_confidence") double evidenceConfidence,
        @JsonProperty("source_reliability") double sourceReliability,
        @JsonProperty("assumption_certainty") double assumptionCertainty,
        @JsonProperty("reasoning_coherence") double reasoningCoherence
) {
    private static final ConfidenceAnalysis SAFE_DEFAULT =
            new ConfidenceAnalysis(0.70, 0.70, 0.50, 0.50, 0.50, 0.50);

    /**
     * Fixed analysis returned when an assessment cannot be completed.
     */
    public static ConfidenceAnalysis safeDefault() {
        return SAFE_DEFAULT;
    }
}
