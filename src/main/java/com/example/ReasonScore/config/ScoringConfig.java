package com.example.ReasonScore.config;

import com.example.ReasonScore.lexicon.IndicatorTables;
import com.example.ReasonScore.service.CalibrationOffset;
import com.example.ReasonScore.service.CalibrationTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

@Configuration
@EnableConfigurationProperties(ReasonScoreProperties.class)
public class ScoringConfig {

    private static final Logger log = LoggerFactory.getLogger(ScoringConfig.class);

    /**
     * Built-in keyword vocabulary.
     * Register another IndicatorTables bean to score with a different vocabulary.
     */
    @Bean
    @ConditionalOnMissingBean(IndicatorTables.class)
    public IndicatorTables indicatorTables() {
        return IndicatorTables.defaults();
    }

    /**
     * Validated confidence range. Invalid settings stop the application from starting.
     */
    @Bean
    public ConfidenceRange confidenceRange(ReasonScoreProperties properties) {
        List<String> errors = properties.validate();
        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid reasonscore configuration: " + String.join("; ", errors));
        }
        ConfidenceRange range = ConfidenceRange.from(properties.getConfidence());
        log.info("Confidence range [{}, {}], target {}", range.min(), range.max(), range.target());
        return range;
    }

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CalibrationTracker calibrationTracker(ReasonScoreProperties properties,
                                                 ConfidenceRange confidenceRange,
                                                 Clock clock) {
        // range bean is a parameter so validation runs before the tracker is built
        return new CalibrationTracker(properties.getCalibration(), clock);
    }

    /**
     * The tracker feeds its recent adjustments back into scoring only when
     * reasonscore.calibration.apply-offset is enabled.
     */
    @Bean
    public CalibrationOffset calibrationOffset(ReasonScoreProperties properties, CalibrationTracker tracker) {
        if (properties.getCalibration().isApplyOffset()) {
            log.info("Calibration offset enabled (window={})", properties.getCalibration().getMetricsWindow());
            return tracker::currentOffset;
        }
        return CalibrationOffset.none();
    }
}
