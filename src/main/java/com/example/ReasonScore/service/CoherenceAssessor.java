package com.example.ReasonScore.service;

import com.example.ReasonScore.lexicon.IndicatorTables;
import com.example.ReasonScore.model.ReasoningChain;
import com.example.ReasonScore.model.ReasoningStep;
import com.example.ReasonScore.util.Scores;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Measures internal consistency of a chain:
 *  - low spread of self-reported step confidence
 *  - steps that explicitly build on earlier ones
 *  - no step asserting both sides of an antonym pair
 */
@Service
@RequiredArgsConstructor
public class CoherenceAssessor {

    private static final Logger log = LoggerFactory.getLogger(CoherenceAssessor.class);

    /** A chain with fewer than two steps has nothing to be inconsistent with. */
    public static final double SINGLE_STEP_SCORE = 0.80;

    private static final double SPREAD_FLOOR = 0.5;
    private static final double PROGRESSION_BONUS = 0.02;
    private static final double CONTRADICTION_PENALTY = 0.01;

    private final IndicatorTables tables;

    public double scoreChain(ReasoningChain chain) {
        if (chain.stepCount() < 2) {
            return SINGLE_STEP_SCORE;
        }
        List<ReasoningStep> steps = chain.steps();

        // Steps without a reported confidence do not count towards the spread
        List<Double> confidences = new ArrayList<>();
        for (ReasoningStep step : steps) {
            if (step.confidence() != null) {
                confidences.add(step.confidence());
            }
        }
        double spread = Scores.populationStdDev(confidences);
        double coherence = Math.max(SPREAD_FLOOR, 1.0 - spread);

        int connected = 0;
        for (int i = 1; i < steps.size(); i++) {
            if (tables.hasLogicalConnector(steps.get(i).reasoning())) {
                connected++;
            }
        }
        coherence += PROGRESSION_BONUS * connected;

        int contradictions = 0;
        for (ReasoningStep step : steps) {
            contradictions += tables.contradictionHits(step.reasoning());
        }
        coherence -= CONTRADICTION_PENALTY * contradictions;

        double result = Scores.unit(coherence);
        log.debug("Coherence score: spread={}, connected={}, contradictions={}, result={}",
                spread, connected, contradictions, result);
        return result;
    }
}
