package com.example.ReasonScore.service;

import com.example.ReasonScore.lexicon.EvidenceGrade;
import com.example.ReasonScore.lexicon.IndicatorTables;
import com.example.ReasonScore.model.ReasoningChain;
import com.example.ReasonScore.model.ReasoningStep;
import com.example.ReasonScore.util.Scores;
import com.example.ReasonScore.util.TextMatcher;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Scores how well a chain is backed by evidence.
 *
 * Each evidence item is graded on its wording, then the chain score is the
 * mean item grade plus a bonus for spreading evidence across steps.
 * The result is a [0,1] diagnostic, not clamped to the confidence range.
 */
@Service
@RequiredArgsConstructor
public class EvidenceQualityAssessor {

    private static final Logger log = LoggerFactory.getLogger(EvidenceQualityAssessor.class);

    /** Returned when the chain cites no evidence at all. */
    public static final double NO_EVIDENCE_SCORE = 0.50;

    private static final double BASE = 0.5;
    private static final double HIGH_HIT = 0.15;
    private static final double MEDIUM_HIT = 0.08;
    private static final double LOW_HIT = -0.10;
    private static final double RESEARCH_BONUS = 0.10;
    private static final double CITATION_BONUS = 0.05;

    private static final int DETAILED = 50;
    private static final int VERY_DETAILED = 100;
    private static final double DETAIL_BONUS = 0.05;

    private static final double DISTRIBUTION_CAP = 0.1;

    private final IndicatorTables tables;

    public double scoreEvidence(String evidence) {
        double score = BASE;

        score += HIGH_HIT * tables.evidenceGrade().count(evidence, EvidenceGrade.HIGH);
        score += MEDIUM_HIT * tables.evidenceGrade().count(evidence, EvidenceGrade.MEDIUM);
        score += LOW_HIT * tables.evidenceGrade().count(evidence, EvidenceGrade.LOW);

        if (tables.hasResearchTerm(evidence)) {
            score += RESEARCH_BONUS;
        }
        if (tables.hasCitationTerm(evidence)) {
            score += CITATION_BONUS;
        }

        int length = TextMatcher.length(evidence);
        if (length > DETAILED) {
            score += DETAIL_BONUS;
        }
        if (length > VERY_DETAILED) {
            score += DETAIL_BONUS;
        }

        return Scores.unit(score);
    }

    public double scoreChain(ReasoningChain chain) {
        if (chain.stepCount() == 0) {
            return NO_EVIDENCE_SCORE;
        }

        double total = 0.0;
        int items = 0;
        int stepsWithEvidence = 0;
        for (ReasoningStep step : chain.steps()) {
            if (step.evidence().isEmpty()) {
                continue;
            }
            stepsWithEvidence++;
            for (String evidence : step.evidence()) {
                total += scoreEvidence(evidence);
                items++;
            }
        }

        if (items == 0) {
            return NO_EVIDENCE_SCORE;
        }

        double mean = total / items;
        double spread = (double) stepsWithEvidence / chain.stepCount();
        double distributionBonus = Math.min(DISTRIBUTION_CAP, spread * DISTRIBUTION_CAP);

        double result = Scores.unit(mean + distributionBonus);
        log.debug("Evidence score: items={}, stepsWithEvidence={}, mean={}, result={}",
                items, stepsWithEvidence, mean, result);
        return result;
    }
}
