package com.example.ReasonScore.service;

import com.example.ReasonScore.lexicon.AssumptionSignal;
import com.example.ReasonScore.lexicon.IndicatorTables;
import com.example.ReasonScore.model.ReasoningChain;
import com.example.ReasonScore.model.ReasoningStep;
import com.example.ReasonScore.util.Scores;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Certainty of a chain given the assumptions it relies on.
 * Higher means fewer or safer assumptions.
 */
@Service
@RequiredArgsConstructor
public class AssumptionRiskAssessor {

    private static final Logger log = LoggerFactory.getLogger(AssumptionRiskAssessor.class);

    /** Returned when no step states an assumption. */
    public static final double NO_ASSUMPTION_SCORE = 0.80;

    private static final double BASE_RISK = 0.3;
    private static final double HIGH_RISK_HIT = 0.10;
    private static final double LOW_RISK_HIT = -0.10;
    private static final double UNCERTAINTY_HIT = 0.15;

    /** Assumptions per step tolerated before the density penalty applies. */
    private static final double DENSITY_LIMIT = 2.0;
    private static final double DENSITY_PENALTY = 0.05;

    private final IndicatorTables tables;

    public double riskOf(String assumption) {
        double risk = BASE_RISK;
        risk += HIGH_RISK_HIT * tables.assumptionSignals().count(assumption, AssumptionSignal.HIGH_RISK);
        risk += LOW_RISK_HIT * tables.assumptionSignals().count(assumption, AssumptionSignal.LOW_RISK);
        risk += UNCERTAINTY_HIT * tables.assumptionSignals().count(assumption, AssumptionSignal.UNCERTAINTY);
        return Scores.unit(risk);
    }

    public double scoreChain(ReasoningChain chain) {
        if (chain.stepCount() == 0) {
            return NO_ASSUMPTION_SCORE;
        }

        double totalRisk = 0.0;
        int assumptions = 0;
        for (ReasoningStep step : chain.steps()) {
            for (String assumption : step.assumptions()) {
                totalRisk += riskOf(assumption);
                assumptions++;
            }
        }

        if (assumptions == 0) {
            return NO_ASSUMPTION_SCORE;
        }

        double certainty = 1.0 - totalRisk / assumptions;

        double density = (double) assumptions / chain.stepCount();
        if (density > DENSITY_LIMIT) {
            certainty -= DENSITY_PENALTY * (density - DENSITY_LIMIT);
        }

        double result = Scores.unit(certainty);
        log.debug("Assumption certainty: assumptions={}, density={}, result={}", assumptions, density, result);
        return result;
    }
}
