package com.promptoptimizer.infrastructure.metrics;

import com.promptoptimizer.domain.optimization.model.TokenAnalysis;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Lexical token statistics and reduction-potential scoring.
 * Works on plain word tokens, independent of any model tokenizer.
 */
@Component
public class TokenMetrics {

    private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Set<String> STOP_WORDS = Set.of(
            // Italian
            "il", "la", "le", "lo", "gli", "i", "un", "una", "uno", "di", "da", "a", "in", "su", "per",
            "con", "tra", "fra", "e", "o", "ma", "però", "anche", "se", "quando", "come", "che", "cui",
            "dove", "chi", "cosa", "quanto", "quale",
            // English
            "the", "an", "and", "or", "but", "on", "at", "to", "for", "of", "with", "by", "from", "up",
            "about", "into", "through", "during", "before", "after", "above", "below", "is", "are",
            "was", "were", "be", "been", "being", "have", "has", "had", "do", "does", "did", "will",
            "would", "could", "should", "may", "might", "must", "shall", "can", "if", "when", "how", "where"
    );

    private static final Set<String> FILLERS = Set.of(
            "basically", "actually", "really", "very", "quite", "rather",
            "sostanzialmente", "praticamente", "effettivamente", "molto", "abbastanza", "piuttosto"
    );

    public TokenAnalysis analyzeTokens(String text) {
        List<String> tokens = tokenize(text);
        int total = tokens.size();
        int unique = new HashSet<>(tokens).size();

        Map<String, Integer> distribution = new LinkedHashMap<>();
        double totalLength = 0;
        for (String token : tokens) {
            distribution.merge(token, 1, Integer::sum);
            totalLength += token.length();
        }

        double averageLength = total > 0 ? totalLength / total : 0.0;
        double redundancy = total > 0 ? 1.0 - ((double) unique / total) : 0.0;
        return new TokenAnalysis(total, unique, averageLength, distribution, redundancy);
    }

    /**
     * Score in [0, 1] combining redundancy, verbosity and sentence repetition.
     */
    public double calculateReductionPotential(String text) {
        TokenAnalysis analysis = analyzeTokens(text);
        double potential = (analysis.redundancyScore() + verbosity(text) + repetition(text)) / 3.0;
        return Math.min(potential, 1.0);
    }

    /**
     * Quick per-family estimate: gpt/claude ≈ chars/4, llama ≈ chars/3.5, otherwise word count.
     */
    public int estimateTokenCount(String text, String modelType) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        String type = modelType == null ? "gpt" : modelType.toLowerCase(Locale.ROOT);
        return switch (type) {
            case "gpt", "claude" -> text.length() / 4;
            case "llama" -> (int) (text.length() / 3.5);
            default -> words(text).length;
        };
    }

    double verbosity(String text) {
        String[] words = words(text);
        if (words.length == 0) {
            return 0.0;
        }
        double totalLength = 0;
        int stopWords = 0;
        int fillers = 0;
        for (String word : words) {
            totalLength += word.length();
            String lower = word.toLowerCase(Locale.ROOT);
            if (STOP_WORDS.contains(lower)) {
                stopWords++;
            }
            if (FILLERS.contains(lower)) {
                fillers++;
            }
        }
        double averageLength = totalLength / words.length;
        double verbosity = ((double) stopWords / words.length
                + (double) fillers / words.length
                + (averageLength - 5) / 10) / 3;
        return Math.max(0.0, Math.min(verbosity, 1.0));
    }

    double repetition(String text) {
        String[] sentences = text == null ? new String[0] : text.split("\\.", -1);
        if (sentences.length < 2) {
            return 0.0;
        }
        double sum = 0.0;
        for (int i = 0; i < sentences.length - 1; i++) {
            sum += TextSimilarity.jaccard(sentences[i], sentences[i + 1]);
        }
        return sum / (sentences.length - 1);
    }

    private List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return tokens;
        }
        String cleaned = NON_WORD.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ");
        for (String token : WHITESPACE.split(cleaned.strip())) {
            if (token.length() > 1) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private static String[] words(String text) {
        if (text == null || text.isBlank()) {
            return new String[0];
        }
        return WHITESPACE.split(text.strip());
    }
}
