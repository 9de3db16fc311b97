package com.example.ReasonScore;

import com.example.ReasonScore.config.ConfidenceRange;
import com.example.ReasonScore.config.ReasonScoreProperties;
import com.example.ReasonScore.model.ConfidenceAnalysis;
import com.example.ReasonScore.model.ReasoningChain;
import com.example.ReasonScore.model.ReasoningMethod;
import com.example.ReasonScore.model.ReasoningStep;
import com.example.ReasonScore.service.CalibrationTracker;
import com.example.ReasonScore.service.ConfidenceAggregator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = "reasonscore.calibration.metrics-window=10")
@ActiveProfiles("test")
class ReasonScoreApplicationTests {

    @Autowired
    private ConfidenceAggregator aggregator;

    @Autowired
    private CalibrationTracker tracker;

    @Autowired
    private ReasonScoreProperties properties;

    @Autowired
    private ConfidenceRange range;

    @Test
    void contextLoads() {
        assertEquals(10, properties.getCalibration().getMetricsWindow());
        assertEquals(0.70, range.min(), 1e-9);
        assertEquals(0.95, range.max(), 1e-9);
    }

    @Test
    void assessesChainThroughWiredBeans() {
        ReasoningChain chain = ReasoningChain.builder()
                .query("Is the sum of two even numbers even?")
                .reasoningMethod(ReasoningMethod.DEDUCTIVE)
                .steps(List.of(ReasoningStep.builder()
                        .stepNumber(1)
                        .reasoning("Each even number is 2k, therefore the sum is 2(k + m).")
                        .confidence(0.9)
                        .build()))
                .finalConclusion("The sum is even.")
                .build();

        ConfidenceAnalysis analysis = aggregator.assess(chain);

        assertTrue(range.contains(analysis.overall()));
        assertTrue(tracker.recordFeedback(chain, analysis.overall(), true, 5).isPresent());
    }
}
