package com.example.ReasonScore.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One feedback event kept by the calibration tracker.
 *
 * @param predictedConfidence overall confidence produced earlier for the chain
 * @param actualOutcome       whether the conclusion proved correct
 * @param userRating          rating on the configured scale
 * @param adjustment          signed correction computed when the record was made
 * @param timestamp           creation time
 * @param query               query of the scored chain, null when only the prediction was reported
 * @param reasoningMethod     method of the scored chain, null when only the prediction was reported
 */
public record CalibrationRecord(
        @JsonProperty("predicted_confidence") double predictedConfidence,
        @JsonProperty("actual_outcome") boolean actualOutcome,
        @JsonProperty("user_rating") double userRating,
        @JsonProperty("adjustment") double adjustment,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("query") String query,
        @JsonProperty("reasoning_method") ReasoningMethod reasoningMethod
) {
}
