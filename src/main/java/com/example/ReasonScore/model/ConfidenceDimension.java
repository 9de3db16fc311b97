package com.example.ReasonScore.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Dimensions combined into the overall confidence, with their fixed weights.
 * Weights sum to 1.0.
 */
public enum ConfidenceDimension {
    REASONING(0.35),
    EVIDENCE(0.25),
    COHERENCE(0.20),
    ASSUMPTION_CERTAINTY(0.20);

    private final double weight;

    ConfidenceDimension(double weight) {
        this.weight = weight;
    }

    public double weight() {
        return weight;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
