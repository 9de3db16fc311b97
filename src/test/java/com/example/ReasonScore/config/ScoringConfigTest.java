package com.example.ReasonScore.config;

import com.example.ReasonScore.service.CalibrationOffset;
import com.example.ReasonScore.service.CalibrationTracker;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;

class ScoringConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(ScoringConfig.class);

    @Test
    void invalidRangeFailsStartup() {
        contextRunner
                .withPropertyValues("reasonscore.confidence.min=0.90", "reasonscore.confidence.max=0.80")
                .run(context -> assertThat(context).hasFailed()
                        .getFailure().hasRootCauseInstanceOf(IllegalStateException.class));
    }

    @Test
    void customRangeIsBound() {
        contextRunner
                .withPropertyValues("reasonscore.confidence.min=0.75", "reasonscore.confidence.max=0.90",
                        "reasonscore.confidence.target=0.80")
                .run(context -> {
                    ConfidenceRange range = context.getBean(ConfidenceRange.class);
                    assertThat(range.min()).isEqualTo(0.75);
                    assertThat(range.max()).isEqualTo(0.90);
                });
    }

    @Test
    void offsetIsDisabledByDefault() {
        contextRunner.run(context -> {
            context.getBean(CalibrationTracker.class).recordFeedback(0.5, true, 3);
            assertThat(context.getBean(CalibrationOffset.class).current()).isEqualTo(0.0);
        });
    }

    @Test
    void offsetFollowsTrackerWhenEnabled() {
        contextRunner
                .withPropertyValues("reasonscore.calibration.apply-offset=true")
                .run(context -> {
                    context.getBean(CalibrationTracker.class).recordFeedback(0.5, true, 3);
                    assertThat(context.getBean(CalibrationOffset.class).current()).isEqualTo(0.02);
                });
    }
}
