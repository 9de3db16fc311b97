package com.example.ReasonScore.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reasoning chain submitted for assessment.
 *
 * overallConfidence, evidenceQuality and assumptionRisk are summaries set by
 * the producer. They are informational only; the engine computes its own.
 *
 * @param query             original question or goal
 * @param steps             ordered steps, null only for malformed input
 * @param finalConclusion   conclusion text
 * @param reasoningMethod   method used, defaults to deductive
 */
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReasoningChain(
        @JsonProperty("query") String query,
        @JsonProperty("steps") List<ReasoningStep> steps,
        @JsonProperty("final_conclusion") String finalConclusion,
        @JsonProperty("reasoning_method") ReasoningMethod reasoningMethod,
        @JsonProperty("overall_confidence") Double overallConfidence,
        @JsonProperty("evidence_quality") Double evidenceQuality,
        @JsonProperty("assumption_risk") Double assumptionRisk
) {
    public ReasoningChain {
        if (steps != null) {
            steps = Collections.unmodifiableList(new ArrayList<>(steps));
        }
        if (reasoningMethod == null) {
            reasoningMethod = ReasoningMethod.DEFAULT;
        }
    }

    public int stepCount() {
        return steps == null ? 0 : steps.size();
    }
}
