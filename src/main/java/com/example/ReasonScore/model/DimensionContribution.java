package com.example.ReasonScore.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * How much one dimension contributed to the overall confidence.
 */
public record DimensionContribution(
        @JsonProperty("dimension") ConfidenceDimension dimension,
        @JsonProperty("value") double value,
        @JsonProperty("weight") double weight,
        @JsonProperty("contribution") double contribution
) {
    public static DimensionContribution of(ConfidenceDimension dimension, double value) {
        return new DimensionContribution(dimension, value, dimension.weight(), value * dimension.weight());
    }
}
