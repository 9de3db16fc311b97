package com.example.ReasonScore.config;

/**
 * Allowed interval for reported confidence values.
 */
public record ConfidenceRange(double min, double max, double target) {

    public static final ConfidenceRange DEFAULT = new ConfidenceRange(0.70, 0.95, 0.85);

    public ConfidenceRange {
        if (min < 0.0 || max > 1.0 || min > max) {
            throw new IllegalArgumentException(
                    "Confidence range must satisfy 0 <= min <= max <= 1, got [" + min + ", " + max + "]");
        }
    }

    public static ConfidenceRange from(ReasonScoreProperties.Confidence confidence) {
        return new ConfidenceRange(confidence.getMin(), confidence.getMax(), confidence.getTarget());
    }

    public double clamp(double value) {
        return Math.max(min, Math.min(max, value));
    }

    public boolean contains(double value) {
        return value >= min && value <= max;
    }
}
