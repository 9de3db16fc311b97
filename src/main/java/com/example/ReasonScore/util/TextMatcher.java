package com.example.ReasonScore.util;

import java.util.Collection;
import java.util.Locale;

/**
 * Case-insensitive keyword matching over free text.
 * Keywords are expected in lower case.
 */
public final class TextMatcher {

    private TextMatcher() {
    }

    public static String normalize(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }

    /**
     * Number of keywords that occur in the text. Each keyword counts once,
     * however often it repeats.
     */
    public static int countPresent(String text, Collection<String> keywords) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) {
            return 0;
        }
        int hits = 0;
        for (String keyword : keywords) {
            if (normalized.contains(keyword)) {
                hits++;
            }
        }
        return hits;
    }

    public static boolean containsAny(String text, Collection<String> keywords) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) {
            return false;
        }
        return keywords.stream().anyMatch(normalized::contains);
    }

    public static int length(String text) {
        return text == null ? 0 : text.length();
    }
}
