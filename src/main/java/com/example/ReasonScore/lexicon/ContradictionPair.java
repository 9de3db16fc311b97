package com.example.ReasonScore.lexicon;

import com.example.ReasonScore.util.TextMatcher;

import java.util.Locale;

/**
 * Two opposing words. A text containing both counts as one contradiction hit.
 */
public record ContradictionPair(String first, String second) {

    public ContradictionPair {
        if (first == null || first.isBlank() || second == null || second.isBlank()) {
            throw new IllegalArgumentException("Contradiction pair members must be non-blank");
        }
        first = first.trim().toLowerCase(Locale.ROOT);
        second = second.trim().toLowerCase(Locale.ROOT);
    }

    public boolean matches(String text) {
        String normalized = TextMatcher.normalize(text);
        return normalized.contains(first) && normalized.contains(second);
    }
}
