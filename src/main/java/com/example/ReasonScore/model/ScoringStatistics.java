package com.example.ReasonScore.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Snapshot of the scoring engine's configuration and calibration state.
 */
public record ScoringStatistics(
        @JsonProperty("min_confidence") double minConfidence,
        @JsonProperty("max_confidence") double maxConfidence,
        @JsonProperty("target_confidence") double targetConfidence,
        @JsonProperty("dimension_weights") Map<ConfidenceDimension, Double> dimensionWeights,
        @JsonProperty("calibration_offset") double calibrationOffset,
        @JsonProperty("ready") boolean ready
) {
}
