package com.example.ReasonScore.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Rolling calibration metrics over the most recent feedback records.
 *
 * @param sampleSize          number of records the metrics were computed from
 * @param historySize         number of records currently retained
 * @param calibrationAccuracy fraction of records whose prediction agreed with the outcome
 * @param averageAdjustment   mean absolute adjustment
 * @param averageUserRating   mean user rating
 * @param successRate         fraction of records with a successful outcome
 * @param recentAdjustments   newest raw adjustments, oldest first
 * @param message             human-readable status
 */
public record CalibrationMetrics(
        @JsonProperty("sample_size") int sampleSize,
        @JsonProperty("history_size") int historySize,
        @JsonProperty("calibration_accuracy") double calibrationAccuracy,
        @JsonProperty("average_adjustment") double averageAdjustment,
        @JsonProperty("average_user_rating") double averageUserRating,
        @JsonProperty("success_rate") double successRate,
        @JsonProperty("recent_adjustments") List<Double> recentAdjustments,
        @JsonProperty("message") String message
) {
    public static final String NO_DATA_MESSAGE = "No calibration data recorded yet";

    public static CalibrationMetrics noData() {
        return new CalibrationMetrics(0, 0, 0.0, 0.0, 0.0, 0.0, List.of(), NO_DATA_MESSAGE);
    }

    public boolean hasData() {
        return sampleSize > 0;
    }
}
