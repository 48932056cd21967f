package com.promptoptimizer.infrastructure.metrics;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Minimal TF-IDF vectorizer: lower-cased tokens of two or more word characters,
 * stop words removed, unigrams and bigrams, smoothed idf {@code ln((1+n)/(1+df)) + 1},
 * L2-normalised rows.
 * <p>
 * Instances are immutable; every {@link #fitTransform} call builds its own vocabulary.
 */
public class TfidfVectorizer {

    private static final Pattern TOKEN = Pattern.compile("(?U)\\b\\w\\w+\\b");

    private final int maxFeatures;
    private final Set<String> stopWords;

    public TfidfVectorizer(int maxFeatures, Set<String> stopWords) {
        if (maxFeatures < 1) {
            throw new IllegalArgumentException("maxFeatures must be positive: " + maxFeatures);
        }
        this.maxFeatures = maxFeatures;
        this.stopWords = Set.copyOf(stopWords);
    }

    public static TfidfVectorizer english() {
        return new TfidfVectorizer(1000, EnglishStopWords.WORDS);
    }

    /**
     * Fit the vocabulary on the documents and return one sparse weight vector per document.
     *
     * @throws IllegalStateException if no document yields a single term
     */
    public List<Map<String, Double>> fitTransform(List<String> documents) {
        List<List<String>> analyzed = documents.stream().map(this::analyze).toList();

        Map<String, Integer> corpusCounts = new HashMap<>();
        Map<String, Integer> documentFrequency = new HashMap<>();
        for (List<String> terms : analyzed) {
            for (String term : terms) {
                corpusCounts.merge(term, 1, Integer::sum);
            }
            for (String term : new HashSet<>(terms)) {
                documentFrequency.merge(term, 1, Integer::sum);
            }
        }
        if (corpusCounts.isEmpty()) {
            throw new IllegalStateException("empty vocabulary; the documents only contain stop words");
        }

        Set<String> vocabulary = corpusCounts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(maxFeatures)
                .map(Map.Entry::getKey)
                .collect(Collectors.toSet());

        int n = documents.size();
        List<Map<String, Double>> vectors = new ArrayList<>(n);
        for (List<String> terms : analyzed) {
            Map<String, Double> weights = new HashMap<>();
            for (String term : terms) {
                if (vocabulary.contains(term)) {
                    weights.merge(term, 1.0, Double::sum);
                }
            }
            weights.replaceAll((term, tf) -> tf * idf(n, documentFrequency.get(term)));
            normalize(weights);
            vectors.add(weights);
        }
        return vectors;
    }

    /**
     * Terms of a single document ordered by descending weight (ties alphabetical).
     */
    public List<String> topTerms(String document, int limit) {
        Map<String, Double> weights = fitTransform(List.of(document)).get(0);
        return weights.entrySet().stream()
                .filter(e -> e.getValue() > 0)
                .sorted(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(limit)
                .map(Map.Entry::getKey)
                .toList();
    }

    public static double cosine(Map<String, Double> a, Map<String, Double> b) {
        double dot = 0.0;
        for (Map.Entry<String, Double> entry : a.entrySet()) {
            Double other = b.get(entry.getKey());
            if (other != null) {
                dot += entry.getValue() * other;
            }
        }
        double normA = norm(a);
        double normB = norm(b);
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (normA * normB);
    }

    List<String> analyze(String document) {
        List<String> tokens = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(document.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            String token = matcher.group();
            if (!stopWords.contains(token)) {
                tokens.add(token);
            }
        }
        List<String> terms = new ArrayList<>(tokens);
        for (int i = 0; i + 1 < tokens.size(); i++) {
            terms.add(tokens.get(i) + " " + tokens.get(i + 1));
        }
        return terms;
    }

    private static double idf(int documents, int documentFrequency) {
        return Math.log((1.0 + documents) / (1.0 + documentFrequency)) + 1.0;
    }

    private static void normalize(Map<String, Double> weights) {
        double norm = norm(weights);
        if (norm > 0) {
            weights.replaceAll((term, w) -> w / norm);
        }
    }

    private static double norm(Map<String, Double> vector) {
        double sum = 0.0;
        for (double w : vector.values()) {
            sum += w * w;
        }
        return Math.sqrt(sum);
    }
}
