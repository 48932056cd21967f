package com.promptoptimizer.infrastructure.model;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Character/word based token estimate for models without a public tokenizer.
 * <p>
 * Base estimate is one token per four characters, plus weighted corrections for
 * long words, punctuation, digits/special characters and markup tags.
 * Deterministic, and never decreases when text is appended.
 */
public final class HeuristicTokenEstimator {

    private static final double CHARS_PER_TOKEN = 4.0;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern PUNCTUATION = Pattern.compile("[^\\w\\s]");
    private static final Pattern SPECIAL_CHARS = Pattern.compile("[0-9@#$%^&*()_+={}\\[\\]|;:,.<>?/~`]");
    private static final Pattern MARKUP_TAG = Pattern.compile("<[^>]+>");

    private final int longWordLength;
    private final double longWordWeight;
    private final double punctuationWeight;
    private final double specialCharWeight;
    private final double markupTagWeight;

    public HeuristicTokenEstimator(int longWordLength,
                                   double longWordWeight,
                                   double punctuationWeight,
                                   double specialCharWeight,
                                   double markupTagWeight) {
        this.longWordLength = longWordLength;
        this.longWordWeight = longWordWeight;
        this.punctuationWeight = punctuationWeight;
        this.specialCharWeight = specialCharWeight;
        this.markupTagWeight = markupTagWeight;
    }

    /**
     * GPT-style weights: words over 8 chars tend to split, punctuation is usually its own token.
     */
    public static HeuristicTokenEstimator openAi() {
        return new HeuristicTokenEstimator(8, 0.5, 0.3, 0.2, 0.0);
    }

    /**
     * Claude-style weights: long words split less, XML tags are common in prompts.
     */
    public static HeuristicTokenEstimator claude() {
        return new HeuristicTokenEstimator(10, 0.3, 0.25, 0.15, 0.5);
    }

    /**
     * Estimate tokens for the text.
     *
     * @return 0 for empty text, otherwise at least 1
     */
    public int estimate(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }

        double total = text.length() / CHARS_PER_TOKEN;

        if (longWordWeight > 0) {
            long longWords = WHITESPACE.splitAsStream(text)
                    .filter(w -> w.length() > longWordLength)
                    .count();
            total += longWords * longWordWeight;
        }

        total += count(PUNCTUATION, text) * punctuationWeight;
        total += count(SPECIAL_CHARS, text) * specialCharWeight;

        if (markupTagWeight > 0) {
            total += count(MARKUP_TAG, text) * markupTagWeight;
        }

        return Math.max(1, (int) total);
    }

    private static int count(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        int n = 0;
        while (matcher.find()) {
            n++;
        }
        return n;
    }
}
