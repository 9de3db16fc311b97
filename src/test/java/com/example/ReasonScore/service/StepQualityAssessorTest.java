package com.example.ReasonScore.service;

import com.example.ReasonScore.config.ConfidenceRange;
import com.example.ReasonScore.lexicon.IndicatorTables;
import com.example.ReasonScore.model.ReasoningChain;
import com.example.ReasonScore.model.ReasoningMethod;
import com.example.ReasonScore.model.ReasoningStep;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.ReasonScore.service.ReasoningChains.chain;
import static com.example.ReasonScore.service.ReasoningChains.plainChain;
import static com.example.ReasonScore.service.ReasoningChains.plainStep;
import static org.junit.jupiter.api.Assertions.*;

class StepQualityAssessorTest {

    private static final double EPS = 1e-9;

    private final StepQualityAssessor assessor =
            new StepQualityAssessor(IndicatorTables.defaults(), ConfidenceRange.DEFAULT);

    @Test
    void plainStepScoresTheMinimum() {
        assertEquals(0.70, assessor.scoreStep(plainStep(1)), EPS);
    }

    @Test
    void connectorWordsAdjustByStrength() {
        ReasoningStep step = plainStep(1).toBuilder()
                .reasoning("This holds because the rule applies, and it suggests a pattern; perhaps not.")
                .build();

        // +0.03 strong, +0.02 moderate, -0.02 weak
        assertEquals(0.73, assessor.scoreStep(step), EPS);
    }

    @Test
    void repeatedKeywordCountsOnce() {
        ReasoningStep step = plainStep(1).toBuilder()
                .reasoning("Because because BECAUSE.")
                .build();

        assertEquals(0.73, assessor.scoreStep(step), EPS);
    }

    @Test
    void longerJustificationEarnsLengthBonus() {
        ReasoningStep medium = plainStep(1).toBuilder().reasoning("x".repeat(150)).build();
        ReasoningStep longer = plainStep(1).toBuilder().reasoning("x".repeat(250)).build();

        assertEquals(0.72, assessor.scoreStep(medium), EPS);
        assertEquals(0.74, assessor.scoreStep(longer), EPS);
    }

    @Test
    void evidenceBonusIsCapped() {
        ReasoningStep two = plainStep(1).toBuilder().evidence(List.of("a", "b")).build();
        ReasoningStep three = plainStep(1).toBuilder().evidence(List.of("a", "b", "c")).build();

        assertEquals(0.74, assessor.scoreStep(two), EPS);
        assertEquals(0.75, assessor.scoreStep(three), EPS);
    }

    @Test
    void assumptionsAreAcknowledgedThenPenalized() {
        ReasoningStep one = plainStep(1).toBuilder().assumptions(List.of("a")).build();
        ReasoningStep five = plainStep(1).toBuilder()
                .assumptions(List.of("a", "b", "c", "d", "e"))
                .build();

        assertEquals(0.71, assessor.scoreStep(one), EPS);
        // 0.70 + 0.02 - 0.03 falls below the range and is clamped back up
        assertEquals(0.70, assessor.scoreStep(five), EPS);
    }

    @Test
    void positiveSelfReportedConfidenceIsBlended() {
        assertEquals(0.80, assessor.scoreStep(plainStep(1, 0.9)), EPS);
    }

    @Test
    void zeroSelfReportedConfidenceIsIgnored() {
        assertEquals(0.70, assessor.scoreStep(plainStep(1, 0.0)), EPS);
    }

    @Test
    void stepScoreIsClampedToTheMaximum() {
        ReasoningStep step = ReasoningStep.builder()
                .stepNumber(1)
                .reasoning(ReasoningChains.INDUCTIVE_STEP)
                .confidence(1.0)
                .evidence(List.of("a", "b", "c"))
                .build();

        assertEquals(0.95, assessor.scoreStep(step), EPS);
    }

    @Test
    void emptyChainScoresTheMinimum() {
        ReasoningChain empty = chain(ReasoningMethod.CAUSAL);

        assertEquals(0.70, assessor.scoreChain(empty), EPS);
    }

    @Test
    void chainRollupWeightsLaterStepsMore() {
        ReasoningChain chain = chain(ReasoningMethod.ABDUCTIVE, plainStep(1), plainStep(2, 0.9));

        // (0.70 * 1.1 + 0.80 * 1.2) / 2.3 + 0.02
        double expected = (0.70 * 1.1 + 0.80 * 1.2) / 2.3 + 0.02;
        assertEquals(expected, assessor.scoreChain(chain), EPS);
    }

    @Test
    void methodBonusFollowsReasoningMethod() {
        assertEquals(0.75, assessor.scoreChain(plainChain(ReasoningMethod.DEDUCTIVE, 3)), EPS);
        assertEquals(0.73, assessor.scoreChain(plainChain(ReasoningMethod.INDUCTIVE, 3)), EPS);
        assertEquals(0.72, assessor.scoreChain(plainChain(ReasoningMethod.ABDUCTIVE, 3)), EPS);
        assertEquals(0.74, assessor.scoreChain(plainChain(ReasoningMethod.COMPARATIVE, 3)), EPS);
        assertEquals(0.74, assessor.scoreChain(plainChain(ReasoningMethod.CAUSAL, 3)), EPS);
    }

    @Test
    void stepCountBonusesDoNotStack() {
        assertEquals(0.0, StepQualityAssessor.stepCountBonus(3), EPS);
        assertEquals(0.03, StepQualityAssessor.stepCountBonus(4), EPS);
        assertEquals(0.03, StepQualityAssessor.stepCountBonus(5), EPS);
        assertEquals(0.05, StepQualityAssessor.stepCountBonus(6), EPS);
        assertEquals(0.05, StepQualityAssessor.stepCountBonus(12), EPS);

        assertEquals(0.78, assessor.scoreChain(plainChain(ReasoningMethod.DEDUCTIVE, 4)), EPS);
        // 0.70 + 0.05 method + 0.05 six-step bonus, not 0.83
        assertEquals(0.80, assessor.scoreChain(plainChain(ReasoningMethod.DEDUCTIVE, 6)), EPS);
    }

    @Test
    void threeStepDeductiveScenario() {
        double expected = (0.885 * 1.1 + 0.90 * 1.2 + 0.90 * 1.3) / 3.6 + 0.05;

        assertEquals(expected, assessor.scoreChain(ReasoningChains.deductiveThreeStep()), EPS);
    }
}
