package com.example.ReasonScore.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Reasoning method used by the upstream producer, with the chain-level bonus
 * it earns in reasoning scoring.
 */
public enum ReasoningMethod {
    DEDUCTIVE(0.05),
    INDUCTIVE(0.03),
    ABDUCTIVE(0.02),
    COMPARATIVE(0.04),
    CAUSAL(0.04);

    public static final ReasoningMethod DEFAULT = DEDUCTIVE;

    private final double bonus;

    ReasoningMethod(double bonus) {
        this.bonus = bonus;
    }

    public double bonus() {
        return bonus;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Accepts "deductive", "DEDUCTIVE", " Deductive " etc.
     * Unknown or blank values fall back to {@link #DEFAULT}.
     */
    @JsonCreator
    public static ReasoningMethod fromWire(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT;
        }
        try {
            return ReasoningMethod.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return DEFAULT;
        }
    }
}
