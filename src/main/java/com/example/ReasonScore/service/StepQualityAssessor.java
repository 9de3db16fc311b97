package com.example.ReasonScore.service;

import com.example.ReasonScore.config.ConfidenceRange;
import com.example.ReasonScore.lexicon.IndicatorTables;
import com.example.ReasonScore.lexicon.ReasoningStrength;
import com.example.ReasonScore.model.ReasoningChain;
import com.example.ReasonScore.model.ReasoningStep;
import com.example.ReasonScore.util.TextMatcher;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Scores the textual and structural quality of reasoning steps,
 * and rolls the step scores up into the chain's reasoning confidence.
 */
@Service
@RequiredArgsConstructor
public class StepQualityAssessor {

    private static final Logger log = LoggerFactory.getLogger(StepQualityAssessor.class);

    // --- Per-step adjustments ---

    private static final double STRONG_HIT = 0.03;
    private static final double MODERATE_HIT = 0.02;
    private static final double WEAK_HIT = -0.02;

    private static final int LONG_TEXT = 100;
    private static final int VERY_LONG_TEXT = 200;
    private static final double LENGTH_BONUS = 0.02;

    private static final double EVIDENCE_PER_ITEM = 0.02;
    private static final double EVIDENCE_CAP = 0.05;

    private static final double ASSUMPTION_ACKNOWLEDGED = 0.02;
    private static final double ASSUMPTION_PER_ITEM = 0.01;
    private static final double ASSUMPTION_CAP = 0.03;

    // --- Chain rollup ---

    /** Step weight = 1 + STEP_WEIGHT_SLOPE * stepNumber, so later steps matter more. */
    private static final double STEP_WEIGHT_SLOPE = 0.1;

    private static final int MANY_STEPS = 6;
    private static final double MANY_STEPS_BONUS = 0.05;
    private static final int SEVERAL_STEPS = 4;
    private static final double SEVERAL_STEPS_BONUS = 0.03;

    private final IndicatorTables tables;
    private final ConfidenceRange range;

    /**
     * Quality of a single step, clamped to the confidence range.
     */
    public double scoreStep(ReasoningStep step) {
        String text = step.reasoning();
        double score = range.min();

        score += STRONG_HIT * tables.reasoningStrength().count(text, ReasoningStrength.STRONG);
        score += MODERATE_HIT * tables.reasoningStrength().count(text, ReasoningStrength.MODERATE);
        score += WEAK_HIT * tables.reasoningStrength().count(text, ReasoningStrength.WEAK);

        int length = TextMatcher.length(text);
        if (length > LONG_TEXT) {
            score += LENGTH_BONUS;
        }
        if (length > VERY_LONG_TEXT) {
            score += LENGTH_BONUS;
        }

        score += Math.min(EVIDENCE_CAP, EVIDENCE_PER_ITEM * step.evidence().size());

        int assumptions = step.assumptions().size();
        if (assumptions > 0) {
            score += ASSUMPTION_ACKNOWLEDGED;
            score -= Math.min(ASSUMPTION_CAP, ASSUMPTION_PER_ITEM * assumptions);
        }

        if (step.hasReportedConfidence()) {
            score = (score + step.confidence()) / 2;
        }

        return range.clamp(score);
    }

    /**
     * Reasoning confidence of the whole chain:
     * recency-weighted mean of step scores, plus method and step-count bonuses.
     */
    public double scoreChain(ReasoningChain chain) {
        List<ReasoningStep> steps = chain.steps();
        if (steps == null || steps.isEmpty()) {
            return range.min();
        }

        double weightedSum = 0.0;
        double totalWeight = 0.0;
        for (ReasoningStep step : steps) {
            double weight = 1.0 + STEP_WEIGHT_SLOPE * step.stepNumber();
            weightedSum += scoreStep(step) * weight;
            totalWeight += weight;
        }

        double score = weightedSum / totalWeight;
        score += chain.reasoningMethod().bonus();
        score += stepCountBonus(steps.size());

        double result = range.clamp(score);
        log.debug("Reasoning score: steps={}, method={}, raw={}, clamped={}",
                steps.size(), chain.reasoningMethod().wireName(), score, result);
        return result;
    }

    /**
     * Only the largest applicable bonus is granted; the thresholds do not stack.
     */
    static double stepCountBonus(int stepCount) {
        if (stepCount >= MANY_STEPS) {
            return MANY_STEPS_BONUS;
        }
        if (stepCount >= SEVERAL_STEPS) {
            return SEVERAL_STEPS_BONUS;
        }
        return 0.0;
    }
}
