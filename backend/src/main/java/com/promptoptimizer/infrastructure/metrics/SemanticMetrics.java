package com.promptoptimizer.infrastructure.metrics;

import com.promptoptimizer.domain.optimization.model.SemanticAnalysis;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Meaning-preservation scoring and shallow semantic analysis.
 * <p>
 * Similarity is lexical (TF-IDF cosine), not a semantic model; it is the gate used by
 * the optimization pipeline.
 */
@Slf4j
@Component
public class SemanticMetrics {

    private static final int MAX_CONCEPTS = 5;
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Set<String> CONNECTIVES = Set.of(
            "quindi", "perciò", "tuttavia", "inoltre", "infatti", "cioè",
            "therefore", "however", "moreover", "furthermore", "indeed", "thus"
    );

    private final TfidfVectorizer vectorizer;

    public SemanticMetrics() {
        this(TfidfVectorizer.english());
    }

    public SemanticMetrics(TfidfVectorizer vectorizer) {
        this.vectorizer = vectorizer;
    }

    /**
     * Similarity of two texts in [0, 1]. Returns 0.0 when either text is null or empty.
     */
    public double calculateSimilarity(String first, String second) {
        if (first == null || first.isEmpty() || second == null || second.isEmpty()) {
            return 0.0;
        }
        try {
            List<Map<String, Double>> vectors = vectorizer.fitTransform(List.of(first, second));
            return clamp(TfidfVectorizer.cosine(vectors.get(0), vectors.get(1)));
        } catch (IllegalStateException e) {
            log.debug("TF-IDF unavailable ({}), falling back to word overlap", e.getMessage());
            return clamp(TextSimilarity.tokenOverlap(first, second));
        }
    }

    public SemanticAnalysis analyzeSemanticContent(String text) {
        return new SemanticAnalysis(
                density(text),
                coherence(text),
                complexity(text),
                keyConcepts(text)
        );
    }

    double density(String text) {
        String[] words = words(text);
        if (words.length == 0) {
            return 0.0;
        }
        long unique = Arrays.stream(words).distinct().count();
        return Math.min(2.0 * unique / words.length, 1.0);
    }

    double coherence(String text) {
        String[] sentences = sentences(text);
        if (sentences.length < 2) {
            return 1.0;
        }
        long indicators = Arrays.stream(words(text.toLowerCase(Locale.ROOT)))
                .filter(CONNECTIVES::contains)
                .count();
        return Math.min((double) indicators / sentences.length, 1.0);
    }

    double complexity(String text) {
        String[] words = words(text);
        if (words.length == 0) {
            return 0.0;
        }
        double averageSentenceLength = (double) words.length / sentences(text).length;
        double averageWordLength = Arrays.stream(words).mapToInt(String::length).average().orElse(0);
        double sentenceComplexity = Math.min(averageSentenceLength / 20, 1.0);
        double lexicalComplexity = Math.min((averageWordLength - 3) / 5, 1.0);
        return (sentenceComplexity + lexicalComplexity) / 2;
    }

    List<String> keyConcepts(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        try {
            return vectorizer.topTerms(text, MAX_CONCEPTS);
        } catch (IllegalStateException e) {
            log.debug("Key concept extraction falling back to frequency ranking: {}", e.getMessage());
            Map<String, Integer> frequency = new LinkedHashMap<>();
            for (String word : words(text.toLowerCase(Locale.ROOT))) {
                frequency.merge(word, 1, Integer::sum);
            }
            List<String> ranked = new ArrayList<>(frequency.keySet());
            ranked.sort(Comparator.<String>comparingInt(frequency::get)
                    .thenComparing(Comparator.comparingInt(String::length).reversed()));
            return ranked.subList(0, Math.min(MAX_CONCEPTS, ranked.size()));
        }
    }

    private static String[] sentences(String text) {
        return text.split("\\.", -1);
    }

    private static String[] words(String text) {
        if (text == null || text.isBlank()) {
            return new String[0];
        }
        return WHITESPACE.split(text.strip());
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(value, 1.0));
    }
}
