package com.example.ReasonScore.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.List;
import java.util.Objects;

/**
 * One unit of reasoning inside a {@link ReasoningChain}.
 *
 * stepNumber  - position of the step, also used as a recency weight
 * description - short label
 * reasoning   - natural-language justification, required
 * confidence  - self-reported confidence in [0,1], null when not reported
 * evidence    - free-text evidence citations, never null
 * assumptions - free-text assumption statements, never null
 */
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReasoningStep(
        @JsonProperty("step_number") int stepNumber,
        @JsonProperty("description") String description,
        @JsonProperty("reasoning") String reasoning,
        @JsonProperty("confidence") Double confidence,
        @JsonProperty("evidence") List<String> evidence,
        @JsonProperty("assumptions") List<String> assumptions
) {
    public ReasoningStep {
        evidence = readOnly(evidence);
        assumptions = readOnly(assumptions);
    }

    public boolean hasReportedConfidence() {
        return confidence != null && confidence > 0;
    }

    private static List<String> readOnly(List<String> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        return values.stream()
                .filter(Objects::nonNull)
                .toList();
    }
}
