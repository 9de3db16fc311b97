package com.example.ReasonScore.util;

import java.util.Collection;

public final class Scores {

    private Scores() {
    }

    /**
     * Clamp to [0,1].
     */
    public static double unit(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    public static double mean(Collection<Double> values) {
        if (values == null || values.isEmpty()) {
            return 0.0;
        }
        return values.stream()
                .mapToDouble(Double::doubleValue)
                .average()
                .orElse(0.0);
    }

    /**
     * Population standard deviation (divides by n, not n - 1).
     * Returns 0 for fewer than two values.
     */
    public static double populationStdDev(Collection<Double> values) {
        if (values == null || values.size() < 2) {
            return 0.0;
        }
        double mean = mean(values);
        double squares = 0.0;
        for (double value : values) {
            double delta = value - mean;
            squares += delta * delta;
        }
        return Math.sqrt(squares / values.size());
    }
}
