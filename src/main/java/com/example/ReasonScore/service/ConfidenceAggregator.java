package com.example.ReasonScore.service;

import com.example.ReasonScore.config.ConfidenceRange;
import com.example.ReasonScore.model.AssessmentFault;
import com.example.ReasonScore.model.AssessmentResult;
import com.example.ReasonScore.model.ConfidenceAnalysis;
import com.example.ReasonScore.model.ConfidenceDimension;
import com.example.ReasonScore.model.DimensionContribution;
import com.example.ReasonScore.model.ReasoningChain;
import com.example.ReasonScore.model.ReasoningStep;
import com.example.ReasonScore.model.ScoringStatistics;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point of the scoring engine.
 *
 * Pipeline for one chain:
 *  1. Validate the chain shape
 *  2. Score the four dimensions (reasoning, evidence, coherence, assumption certainty)
 *  3. Combine them with the fixed {@link ConfidenceDimension} weights
 *  4. Clamp overall and reasoning confidence to the configured range
 *
 * {@link #assess(ReasoningChain)} never throws: any fault is logged and the
 * fixed {@link ConfidenceAnalysis#safeDefault()} is returned instead.
 * The aggregator holds no mutable state and can be shared across threads.
 */
@Service
@RequiredArgsConstructor
public class ConfidenceAggregator {

    private static final Logger log = LoggerFactory.getLogger(ConfidenceAggregator.class);

    private static final double SOURCE_RELIABILITY_FACTOR = 1.1;

    private final StepQualityAssessor stepQualityAssessor;
    private final EvidenceQualityAssessor evidenceQualityAssessor;
    private final CoherenceAssessor coherenceAssessor;
    private final AssumptionRiskAssessor assumptionRiskAssessor;
    private final ConfidenceRange range;
    private final CalibrationOffset calibrationOffset;

    /**
     * Assess a chain, degrading to the safe default on any fault.
     */
    public ConfidenceAnalysis assess(ReasoningChain chain) {
        AssessmentResult result = evaluate(chain);
        result.faultIfAny().ifPresent(this::logFault);
        return result.analysisOrDefault();
    }

    /**
     * Assess a chain and report a fault explicitly instead of substituting the default.
     */
    public AssessmentResult evaluate(ReasoningChain chain) {
        try {
            Dimensions dimensions = score(chain);
            return AssessmentResult.success(combine(dimensions));
        } catch (AssessmentFault fault) {
            return AssessmentResult.failure(fault);
        } catch (RuntimeException ex) {
            return AssessmentResult.failure(
                    AssessmentFault.computation("Scoring failed: " + ex.getMessage(), ex));
        }
    }

    /**
     * Per-dimension value, weight and weighted contribution for a chain.
     * Contributions sum to the overall score before offset and clamping.
     *
     * @return contributions in weight order, empty when the chain cannot be assessed
     */
    public List<DimensionContribution> breakdown(ReasoningChain chain) {
        try {
            Dimensions d = score(chain);
            return List.of(
                    DimensionContribution.of(ConfidenceDimension.REASONING, d.reasoning()),
                    DimensionContribution.of(ConfidenceDimension.EVIDENCE, d.evidence()),
                    DimensionContribution.of(ConfidenceDimension.COHERENCE, d.coherence()),
                    DimensionContribution.of(ConfidenceDimension.ASSUMPTION_CERTAINTY, d.assumptionCertainty())
            );
        } catch (AssessmentFault fault) {
            logFault(fault);
            return List.of();
        } catch (RuntimeException ex) {
            logFault(AssessmentFault.computation("Breakdown failed: " + ex.getMessage(), ex));
            return List.of();
        }
    }

    public ScoringStatistics statistics() {
        Map<ConfidenceDimension, Double> weights = new EnumMap<>(ConfidenceDimension.class);
        for (ConfidenceDimension dimension : ConfidenceDimension.values()) {
            weights.put(dimension, dimension.weight());
        }
        return new ScoringStatistics(
                range.min(),
                range.max(),
                range.target(),
                Map.copyOf(weights),
                calibrationOffset.current(),
                true
        );
    }

    private Dimensions score(ReasoningChain chain) {
        validate(chain);

        Dimensions dimensions = new Dimensions(
                stepQualityAssessor.scoreChain(chain),
                evidenceQualityAssessor.scoreChain(chain),
                coherenceAssessor.scoreChain(chain),
                assumptionRiskAssessor.scoreChain(chain)
        );
        if (!dimensions.allFinite()) {
            throw new AssessmentFault(AssessmentFault.Kind.INTERNAL_COMPUTATION,
                    "Non-finite dimension score: " + dimensions);
        }
        return dimensions;
    }

    private ConfidenceAnalysis combine(Dimensions d) {
        double weighted = d.reasoning() * ConfidenceDimension.REASONING.weight()
                + d.evidence() * ConfidenceDimension.EVIDENCE.weight()
                + d.coherence() * ConfidenceDimension.COHERENCE.weight()
                + d.assumptionCertainty() * ConfidenceDimension.ASSUMPTION_CERTAINTY.weight();

        double offset = calibrationOffset.current();
        double overall = range.clamp(weighted + (Double.isFinite(offset) ? offset : 0.0));
        double sourceReliability = Math.min(1.0, d.evidence() * SOURCE_RELIABILITY_FACTOR);

        log.debug("Overall confidence: weighted={}, offset={}, clamped={}", weighted, offset, overall);

        return new ConfidenceAnalysis(
                overall,
                range.clamp(d.reasoning()),
                d.evidence(),
                sourceReliability,
                d.assumptionCertainty(),
                d.coherence()
        );
    }

    /**
     * Reject chains the assessors cannot score meaningfully.
     */
    private void validate(ReasoningChain chain) {
        if (chain == null) {
            throw AssessmentFault.malformed("Reasoning chain is null");
        }
        if (chain.steps() == null) {
            throw AssessmentFault.malformed("Reasoning chain has no step list");
        }

        int previousNumber = 0;
        for (int i = 0; i < chain.steps().size(); i++) {
            ReasoningStep step = chain.steps().get(i);
            if (step == null) {
                throw AssessmentFault.malformed("Step at index " + i + " is null");
            }
            if (step.reasoning() == null || step.reasoning().isBlank()) {
                throw AssessmentFault.malformed("Step " + step.stepNumber() + " has no reasoning text");
            }
            if (step.stepNumber() < 1) {
                throw AssessmentFault.malformed("Step number must be positive, got " + step.stepNumber());
            }
            if (step.stepNumber() < previousNumber) {
                throw AssessmentFault.malformed("Step numbers decrease at index " + i
                        + " (" + previousNumber + " -> " + step.stepNumber() + ")");
            }
            previousNumber = step.stepNumber();

            Double confidence = step.confidence();
            if (confidence != null && (!Double.isFinite(confidence) || confidence < 0.0 || confidence > 1.0)) {
                throw AssessmentFault.malformed("Step " + step.stepNumber()
                        + " has a non-numeric or out-of-range confidence: " + confidence);
            }
        }
    }

    private void logFault(AssessmentFault fault) {
        if (fault.kind() == AssessmentFault.Kind.INTERNAL_COMPUTATION) {
            log.warn("Confidence assessment failed ({})", fault.kind(), fault);
        } else {
            log.warn("Confidence assessment rejected input ({}): {}", fault.kind(), fault.getMessage());
        }
    }

    private record Dimensions(double reasoning, double evidence, double coherence, double assumptionCertainty) {

        boolean allFinite() {
            return Double.isFinite(reasoning)
                    && Double.isFinite(evidence)
                    && Double.isFinite(coherence)
                    && Double.isFinite(assumptionCertainty);
        }
    }
}
