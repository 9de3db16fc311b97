package com.example.ReasonScore.lexicon;

import com.example.ReasonScore.util.TextMatcher;

import java.util.List;
import java.util.Set;

/**
 * Keyword vocabulary shared by all assessors.
 *
 * Built once and injected; substitute tables can be built for tests or
 * domain-specific vocabularies.
 *
 * @param reasoningStrength  connector words in step justifications
 * @param evidenceGrade      quality words in evidence citations
 * @param researchTerms      words marking research-backed evidence
 * @param citationTerms      words marking cited evidence
 * @param assumptionSignals  risk words in assumption statements
 * @param logicalConnectors  words showing a step builds on the previous one
 * @param contradictionPairs antonyms that should not appear together in one step
 */
public record IndicatorTables(
        ClassifiedKeywords<ReasoningStrength> reasoningStrength,
        ClassifiedKeywords<EvidenceGrade> evidenceGrade,
        Set<String> researchTerms,
        Set<String> citationTerms,
        ClassifiedKeywords<AssumptionSignal> assumptionSignals,
        Set<String> logicalConnectors,
        List<ContradictionPair> contradictionPairs
) {
    private static final IndicatorTables DEFAULTS = new IndicatorTables(
            ClassifiedKeywords.builder(ReasoningStrength.class)
                    .add(ReasoningStrength.STRONG,
                            "therefore", "because", "consequently", "thus", "hence",
                            "demonstrates", "proves", "it follows", "necessarily")
                    .add(ReasoningStrength.MODERATE,
                            "suggests", "indicates", "implies", "supports",
                            "consistent with", "based on")
                    .add(ReasoningStrength.WEAK,
                            "maybe", "perhaps", "possibly", "might", "guess", "not sure")
                    .build(),
            ClassifiedKeywords.builder(EvidenceGrade.class)
                    .add(EvidenceGrade.HIGH,
                            "peer-reviewed", "verified", "measured", "published",
                            "documented", "confirmed", "empirical", "systematic")
                    .add(EvidenceGrade.MEDIUM,
                            "reported", "analyzed", "observed", "surveyed", "according to")
                    .add(EvidenceGrade.LOW,
                            "alleged", "rumored", "anecdotal", "hearsay", "speculated")
                    .build(),
            Set.of("study", "research", "data", "statistics"),
            Set.of("citation", "reference", "source"),
            ClassifiedKeywords.builder(AssumptionSignal.class)
                    .add(AssumptionSignal.HIGH_RISK,
                            "assume", "likely", "estimate", "probably", "presumably", "expect")
                    .add(AssumptionSignal.LOW_RISK,
                            "established", "verified", "standard", "proven",
                            "documented", "well-known", "widely accepted")
                    .add(AssumptionSignal.UNCERTAINTY,
                            "uncertain", "unknown", "depends", "unclear", "unpredictable", "may vary")
                    .build(),
            Set.of("therefore", "thus", "consequently", "building on", "following from",
                    "as a result", "hence", "it follows", "given that"),
            List.of(
                    new ContradictionPair("positive", "negative"),
                    new ContradictionPair("increase", "decrease"),
                    new ContradictionPair("support", "oppose"),
                    new ContradictionPair("true", "false"),
                    new ContradictionPair("always", "never"),
                    new ContradictionPair("higher", "lower"),
                    new ContradictionPair("accept", "reject")
            )
    );

    public IndicatorTables {
        researchTerms = Set.copyOf(researchTerms);
        citationTerms = Set.copyOf(citationTerms);
        logicalConnectors = Set.copyOf(logicalConnectors);
        contradictionPairs = List.copyOf(contradictionPairs);
    }

    public static IndicatorTables defaults() {
        return DEFAULTS;
    }

    public boolean hasResearchTerm(String text) {
        return TextMatcher.containsAny(text, researchTerms);
    }

    public boolean hasCitationTerm(String text) {
        return TextMatcher.containsAny(text, citationTerms);
    }

    public boolean hasLogicalConnector(String text) {
        return TextMatcher.containsAny(text, logicalConnectors);
    }

    /**
     * Number of contradiction pairs whose members both occur in the text.
     */
    public int contradictionHits(String text) {
        int hits = 0;
        for (ContradictionPair pair : contradictionPairs) {
            if (pair.matches(text)) {
                hits++;
            }
        }
        return hits;
    }
}
