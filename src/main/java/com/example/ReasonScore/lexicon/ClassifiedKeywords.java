package com.example.ReasonScore.lexicon;

import com.example.ReasonScore.util.TextMatcher;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Immutable keyword sets tagged by a classification enum,
 * e.g. {@code STRONG / MODERATE / WEAK} reasoning connectors.
 *
 * @param <C> classification type
 */
public final class ClassifiedKeywords<C extends Enum<C>> {

    private final Class<C> type;
    private final Map<C, Set<String>> keywordsByClass;

    private ClassifiedKeywords(Class<C> type, Map<C, Set<String>> keywordsByClass) {
        this.type = type;
        this.keywordsByClass = keywordsByClass;
    }

    public static <C extends Enum<C>> Builder<C> builder(Class<C> type) {
        return new Builder<>(type);
    }

    public Class<C> type() {
        return type;
    }

    public Set<String> keywords(C classification) {
        return keywordsByClass.getOrDefault(classification, Set.of());
    }

    /**
     * Number of keywords of the given class present in the text.
     */
    public int count(String text, C classification) {
        return TextMatcher.countPresent(text, keywords(classification));
    }

    public static final class Builder<C extends Enum<C>> {

        private final Class<C> type;
        private final Map<C, Set<String>> keywords;

        private Builder(Class<C> type) {
            this.type = type;
            this.keywords = new EnumMap<>(type);
        }

        public Builder<C> add(C classification, String... words) {
            Set<String> target = keywords.computeIfAbsent(classification, c -> new LinkedHashSet<>());
            for (String word : words) {
                if (word != null && !word.isBlank()) {
                    target.add(word.trim().toLowerCase(Locale.ROOT));
                }
            }
            return this;
        }

        public ClassifiedKeywords<C> build() {
            Map<C, Set<String>> frozen = new EnumMap<>(type);
            keywords.forEach((classification, words) ->
                    frozen.put(classification, Collections.unmodifiableSet(new LinkedHashSet<>(words))));
            return new ClassifiedKeywords<>(type, Collections.unmodifiableMap(frozen));
        }
    }
}
