package com.example.ReasonScore.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings bound from {@code reasonscore.*}.
 */
@Data
@ConfigurationProperties(prefix = "reasonscore")
public class ReasonScoreProperties {

    /** Lowest confidence the engine may report. */
    public static final double COMPLIANCE_FLOOR = 0.70;

    /** Highest confidence the engine may report. */
    public static final double COMPLIANCE_CEILING = 0.95;

    private final Confidence confidence = new Confidence();
    private final Calibration calibration = new Calibration();

    @Data
    public static class Confidence {
        private double min = 0.70;
        private double max = 0.95;
        private double target = 0.85;
    }

    @Data
    public static class Calibration {
        /** Max number of feedback records kept; oldest are evicted first. */
        private int historySize = 100;

        /** Number of newest records the metrics are computed over. */
        private int metricsWindow = 20;

        private double minRating = 1.0;
        private double maxRating = 5.0;

        /** Add the mean recent adjustment to every overall score. */
        private boolean applyOffset = false;
    }

    /**
     * Check the bound values and collect every problem found.
     *
     * @return error messages, empty when the configuration is usable
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();

        if (!withinCompliance(confidence.min)) {
            errors.add("reasonscore.confidence.min must be between "
                    + COMPLIANCE_FLOOR + " and " + COMPLIANCE_CEILING);
        }
        if (!withinCompliance(confidence.max)) {
            errors.add("reasonscore.confidence.max must be between "
                    + COMPLIANCE_FLOOR + " and " + COMPLIANCE_CEILING);
        }
        if (confidence.min > confidence.max) {
            errors.add("reasonscore.confidence.min cannot be greater than reasonscore.confidence.max");
        }
        if (confidence.target < confidence.min || confidence.target > confidence.max) {
            errors.add("reasonscore.confidence.target must lie between min and max");
        }

        if (calibration.historySize <= 0) {
            errors.add("reasonscore.calibration.history-size must be positive");
        }
        if (calibration.metricsWindow <= 0) {
            errors.add("reasonscore.calibration.metrics-window must be positive");
        }
        if (calibration.minRating >= calibration.maxRating) {
            errors.add("reasonscore.calibration.min-rating must be lower than max-rating");
        }
        return errors;
    }

    private static boolean withinCompliance(double value) {
        return value >= COMPLIANCE_FLOOR && value <= COMPLIANCE_CEILING;
    }
}
