package com.example.ReasonScore.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ReasonScorePropertiesTest {

    @Test
    void defaultsAreValid() {
        assertTrue(new ReasonScoreProperties().validate().isEmpty());
    }

    @Test
    void rangeOutsideComplianceBandIsRejected() {
        ReasonScoreProperties properties = new ReasonScoreProperties();
        properties.getConfidence().setMin(0.5);
        properties.getConfidence().setMax(0.99);

        assertThat(properties.validate())
                .anyMatch(error -> error.startsWith("reasonscore.confidence.min"))
                .anyMatch(error -> error.startsWith("reasonscore.confidence.max"));
    }

    @Test
    void invertedRangeIsRejected() {
        ReasonScoreProperties properties = new ReasonScoreProperties();
        properties.getConfidence().setMin(0.90);
        properties.getConfidence().setMax(0.80);
        properties.getConfidence().setTarget(0.85);

        assertThat(properties.validate())
                .anyMatch(error -> error.contains("cannot be greater"));
    }

    @Test
    void calibrationSettingsAreChecked() {
        ReasonScoreProperties properties = new ReasonScoreProperties();
        properties.getCalibration().setHistorySize(0);
        properties.getCalibration().setMinRating(5);
        properties.getCalibration().setMaxRating(1);

        assertEquals(2, properties.validate().size());
    }

    @Test
    void rangeClampsIntoBounds() {
        ConfidenceRange range = ConfidenceRange.DEFAULT;

        assertEquals(0.70, range.clamp(0.1), 1e-9);
        assertEquals(0.95, range.clamp(1.3), 1e-9);
        assertEquals(0.81, range.clamp(0.81), 1e-9);
        assertTrue(range.contains(0.70));
        assertFalse(range.contains(0.96));
    }

    @Test
    void invalidRangeCannotBeBuilt() {
        assertThrows(IllegalArgumentException.class, () -> new ConfidenceRange(0.9, 0.8, 0.85));
        assertThrows(IllegalArgumentException.class, () -> new ConfidenceRange(-0.1, 0.8, 0.5));
    }
}
