package com.example.ReasonScore.lexicon;

/**
 * Strength classes for reasoning connectors found in a step's justification.
 */
public enum ReasoningStrength {
    STRONG,
    MODERATE,
    WEAK
}
