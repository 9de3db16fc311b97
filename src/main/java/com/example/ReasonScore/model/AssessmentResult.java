package com.example.ReasonScore.model;

import java.util.Optional;

/**
 * Outcome of an assessment: either an analysis or the fault that prevented it.
 */
public record AssessmentResult(ConfidenceAnalysis analysis, AssessmentFault fault) {

    public static AssessmentResult success(ConfidenceAnalysis analysis) {
        return new AssessmentResult(analysis, null);
    }

    public static AssessmentResult failure(AssessmentFault fault) {
        return new AssessmentResult(null, fault);
    }

    public boolean isSuccess() {
        return fault == null;
    }

    public Optional<AssessmentFault> faultIfAny() {
        return Optional.ofNullable(fault);
    }

    /**
     * The computed analysis, or the fixed safe default when the assessment failed.
     */
    public ConfidenceAnalysis analysisOrDefault() {
        return isSuccess() ? analysis : ConfidenceAnalysis.safeDefault();
    }
}
