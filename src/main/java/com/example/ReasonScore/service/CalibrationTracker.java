package com.example.ReasonScore.service;

import com.example.ReasonScore.config.ReasonScoreProperties;
import com.example.ReasonScore.model.CalibrationMetrics;
import com.example.ReasonScore.model.CalibrationRecord;
import com.example.ReasonScore.model.ReasoningChain;
import com.example.ReasonScore.model.ReasoningMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Records how earlier confidence predictions turned out and reports rolling
 * calibration metrics.
 *
 * History is a sliding window: at most historySize records are kept and the
 * oldest is evicted first. A single lock serializes writers and snapshot reads,
 * so concurrent feedback neither loses nor duplicates records.
 * Calibration is best-effort: invalid feedback is logged and dropped, never thrown.
 */
public class CalibrationTracker {

    private static final Logger log = LoggerFactory.getLogger(CalibrationTracker.class);

    // --- Adjustment rule ---

    /** Successes predicted below this were under-trusted. */
    private static final double SUCCESS_CEILING = 0.90;

    /** Failures predicted above this were over-trusted. */
    private static final double FAILURE_FLOOR = 0.75;

    private static final double ADJUSTMENT_RATE = 0.1;
    private static final double MAX_ADJUSTMENT = 0.02;

    // --- Metrics ---

    /** Predictions above this count as "confident" when judging calibration accuracy. */
    private static final double CONFIDENT_THRESHOLD = 0.8;

    private static final int RECENT_ADJUSTMENTS = 5;

    private final int historySize;
    private final int metricsWindow;
    private final double minRating;
    private final double maxRating;
    private final Clock clock;

    private final Object lock = new Object();
    private final Deque<CalibrationRecord> history = new ArrayDeque<>();

    public CalibrationTracker(ReasonScoreProperties.Calibration settings, Clock clock) {
        if (settings.getHistorySize() <= 0 || settings.getMetricsWindow() <= 0) {
            throw new IllegalArgumentException("History size and metrics window must be positive");
        }
        this.historySize = settings.getHistorySize();
        this.metricsWindow = settings.getMetricsWindow();
        this.minRating = settings.getMinRating();
        this.maxRating = settings.getMaxRating();
        this.clock = clock;
    }

    /**
     * Record feedback for a chain that was scored earlier.
     *
     * @param chain            the scored chain, may be null when only the prediction is known
     * @param predictedOverall overall confidence produced for the chain
     * @param actualOutcome    whether the conclusion proved correct
     * @param userRating       rating on the configured scale
     * @return the stored record, or empty when the feedback was rejected
     */
    public Optional<CalibrationRecord> recordFeedback(ReasoningChain chain,
                                                      double predictedOverall,
                                                      boolean actualOutcome,
                                                      double userRating) {
        if (!Double.isFinite(predictedOverall) || predictedOverall < 0.0 || predictedOverall > 1.0) {
            log.warn("Ignoring calibration feedback: predicted confidence {} is outside [0, 1]", predictedOverall);
            return Optional.empty();
        }
        if (!Double.isFinite(userRating) || userRating < minRating || userRating > maxRating) {
            log.warn("Ignoring calibration feedback: rating {} is outside [{}, {}]", userRating, minRating, maxRating);
            return Optional.empty();
        }

        String query = chain == null ? null : chain.query();
        ReasoningMethod method = chain == null ? null : chain.reasoningMethod();
        CalibrationRecord record = new CalibrationRecord(
                predictedOverall,
                actualOutcome,
                userRating,
                adjustmentFor(predictedOverall, actualOutcome),
                Instant.now(clock),
                query,
                method
        );

        synchronized (lock) {
            history.addLast(record);
            while (history.size() > historySize) {
                history.removeFirst();
            }
        }

        log.debug("Calibration feedback recorded: predicted={}, outcome={}, adjustment={}",
                predictedOverall, actualOutcome, record.adjustment());
        return Optional.of(record);
    }

    public Optional<CalibrationRecord> recordFeedback(double predictedOverall,
                                                      boolean actualOutcome,
                                                      double userRating) {
        return recordFeedback(null, predictedOverall, actualOutcome, userRating);
    }

    /**
     * Signed correction for one prediction:
     *  - success predicted below 0.90: nudge up
     *  - failure predicted above 0.75: nudge down
     * Magnitude is 10% of the gap, capped at 0.02.
     */
    public static double adjustmentFor(double predicted, boolean actualOutcome) {
        if (actualOutcome && predicted < SUCCESS_CEILING) {
            return Math.min(MAX_ADJUSTMENT, (SUCCESS_CEILING - predicted) * ADJUSTMENT_RATE);
        }
        if (!actualOutcome && predicted > FAILURE_FLOOR) {
            return -Math.min(MAX_ADJUSTMENT, (predicted - FAILURE_FLOOR) * ADJUSTMENT_RATE);
        }
        return 0.0;
    }

    /**
     * Metrics over the newest metricsWindow records.
     */
    public CalibrationMetrics getMetrics() {
        List<CalibrationRecord> all = history();
        if (all.isEmpty()) {
            return CalibrationMetrics.noData();
        }

        List<CalibrationRecord> window = all.subList(Math.max(0, all.size() - metricsWindow), all.size());

        int calibrated = 0;
        int successes = 0;
        double absoluteAdjustments = 0.0;
        double ratings = 0.0;
        for (CalibrationRecord record : window) {
            boolean confident = record.predictedConfidence() > CONFIDENT_THRESHOLD;
            if (record.actualOutcome() == confident) {
                calibrated++;
            }
            if (record.actualOutcome()) {
                successes++;
            }
            absoluteAdjustments += Math.abs(record.adjustment());
            ratings += record.userRating();
        }

        int n = window.size();
        List<Double> recent = window.subList(Math.max(0, n - RECENT_ADJUSTMENTS), n).stream()
                .map(CalibrationRecord::adjustment)
                .toList();

        return new CalibrationMetrics(
                n,
                all.size(),
                (double) calibrated / n,
                absoluteAdjustments / n,
                ratings / n,
                (double) successes / n,
                recent,
                "Calibration metrics over the last " + n + " records"
        );
    }

    /**
     * Mean signed adjustment over the metrics window, 0 when there is no history.
     */
    public double currentOffset() {
        List<CalibrationRecord> all = history();
        if (all.isEmpty()) {
            return 0.0;
        }
        List<CalibrationRecord> window = all.subList(Math.max(0, all.size() - metricsWindow), all.size());
        return window.stream()
                .mapToDouble(CalibrationRecord::adjustment)
                .average()
                .orElse(0.0);
    }

    /**
     * Snapshot of the retained records, oldest first.
     */
    public List<CalibrationRecord> history() {
        synchronized (lock) {
            return List.copyOf(history);
        }
    }

    public int size() {
        synchronized (lock) {
            return history.size();
        }
    }

    public void clear() {
        synchronized (lock) {
            history.clear();
        }
        log.info("Calibration history cleared");
    }
}
