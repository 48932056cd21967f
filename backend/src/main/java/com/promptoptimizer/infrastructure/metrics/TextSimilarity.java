package com.promptoptimizer.infrastructure.metrics;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Word-set helpers shared by metrics and strategies.
 */
public final class TextSimilarity {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern EDGE_PUNCTUATION = Pattern.compile("^[^\\p{L}\\p{N}]+|[^\\p{L}\\p{N}]+$");

    private TextSimilarity() {
    }

    /**
     * Lower-cased words of the text with leading and trailing punctuation stripped.
     */
    public static Set<String> wordSet(String text) {
        Set<String> words = new LinkedHashSet<>();
        if (text == null || text.isBlank()) {
            return words;
        }
        for (String raw : WHITESPACE.split(text.strip().toLowerCase(Locale.ROOT))) {
            String word = EDGE_PUNCTUATION.matcher(raw).replaceAll("");
            if (!word.isEmpty()) {
                words.add(word);
            }
        }
        return words;
    }

    /**
     * Lower-cased whitespace-separated tokens of the text, punctuation kept.
     */
    public static Set<String> tokenSet(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        if (text == null || text.isBlank()) {
            return tokens;
        }
        for (String raw : WHITESPACE.split(text.strip().toLowerCase(Locale.ROOT))) {
            tokens.add(raw);
        }
        return tokens;
    }

    /**
     * Jaccard similarity of the raw token sets. Punctuation-only text still compares equal to itself.
     */
    public static double tokenOverlap(String a, String b) {
        return jaccard(tokenSet(a), tokenSet(b));
    }

    /**
     * Jaccard similarity of the two word sets; 0.0 when either side has no words.
     */
    public static double jaccard(String a, String b) {
        return jaccard(wordSet(a), wordSet(b));
    }

    private static double jaccard(Set<String> first, Set<String> second) {
        if (first.isEmpty() || second.isEmpty()) {
            return 0.0;
        }
        Set<String> union = new LinkedHashSet<>(first);
        union.addAll(second);
        first.retainAll(second);
        return (double) first.size() / union.size();
    }
}
