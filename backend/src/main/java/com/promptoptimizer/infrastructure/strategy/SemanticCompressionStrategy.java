package com.promptoptimizer.infrastructure.strategy;

import com.promptoptimizer.domain.optimization.model.OptimizationConfig;
import com.promptoptimizer.infrastructure.metrics.TextSimilarity;
import com.promptoptimizer.infrastructure.preprocessing.TextNormalizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Removes filler words, rewrites wordy phrases into concise ones and drops sentences
 * that repeat an earlier one.
 */
public class SemanticCompressionStrategy extends AbstractOptimizationStrategy {

    static final double MERGE_THRESHOLD = 0.7;
    static final double AGGRESSIVE_MERGE_THRESHOLD = 0.6;

    private static final int MIN_LENGTH = 20;
    private static final double MAX_REDUCTION = 0.4;

    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+");

    private static final Set<String> FILLER_WORDS = Set.of(
            // Italian
            "molto", "abbastanza", "piuttosto", "davvero", "veramente", "sostanzialmente",
            "praticamente", "effettivamente", "ovviamente", "chiaramente", "sicuramente",
            "certamente", "probabilmente", "possibilmente", "eventualmente", "naturalmente",
            "attualmente",
            // English
            "very", "quite", "rather", "really", "actually", "basically", "essentially",
            "obviously", "clearly", "certainly", "definitely", "probably", "possibly",
            "eventually", "naturally", "literally", "absolutely", "completely", "totally",
            "extremely", "incredibly", "currently", "presently"
    );

    private static final Map<Pattern, String> REDUNDANT_PHRASES = rules(
            "in order to", "to",
            "for the purpose of", "to",
            "due to the fact that", "because",
            "in spite of the fact that", "although",
            "at this point in time", "now",
            "right now", "now",
            "at this moment", "now",
            "a large number of", "many",
            "a small number of", "few",
            "al fine di", "per",
            "allo scopo di", "per",
            "a causa del fatto che", "perché",
            "nonostante il fatto che", "sebbene",
            "in questo momento", "ora",
            "al momento", "ora",
            "un gran numero di", "molti",
            "un piccolo numero di", "pochi",
            "please note that", "",
            "it should be noted that", "",
            "it is important to note that", "",
            "si noti che", "",
            "è importante notare che", "",
            "as you can see,?", "",
            "as mentioned before,?", "",
            "come si può vedere,?", "",
            "come menzionato prima,?", ""
    );

    private static final Map<Pattern, String> SIMPLIFICATION_RULES = rules(
            "it is recommended that", "recommend",
            "it is suggested that", "suggest",
            "it is believed that", "believe",
            "make a decision", "decide",
            "give consideration to", "consider",
            "make an assumption", "assume",
            "conduct an analysis of", "analyze",
            "conduct an analysis", "analyze",
            "prendere una decisione", "decidere",
            "dare considerazione a", "considerare",
            "fare un'analisi", "analizzare",
            "there are many (.+?) that", "many $1",
            "there is a (.+?) that", "a $1",
            "ci sono molti (.+?) che", "molti $1",
            "c'è un (.+?) che", "un $1"
    );

    private static final List<Pattern> VERBOSE_CONSTRUCTS = List.of(
            Pattern.compile("in order to", Pattern.CASE_INSENSITIVE),
            Pattern.compile("for the purpose of", Pattern.CASE_INSENSITIVE),
            Pattern.compile("due to the fact that", Pattern.CASE_INSENSITIVE),
            Pattern.compile("al fine di", Pattern.CASE_INSENSITIVE),
            Pattern.compile("allo scopo di", Pattern.CASE_INSENSITIVE),
            Pattern.compile("a causa del fatto che", Pattern.CASE_INSENSITIVE)
    );

    private final ContextPatternGuard guard;

    public SemanticCompressionStrategy() {
        this(OptimizationConfig.defaults());
    }

    public SemanticCompressionStrategy(OptimizationConfig config) {
        this(config, new TextNormalizer(), ContextPatternGuard.emphasis());
    }

    public SemanticCompressionStrategy(OptimizationConfig config, TextNormalizer normalizer,
                                       ContextPatternGuard guard) {
        super(config, normalizer);
        this.guard = guard;
    }

    @Override
    protected String getDescription() {
        return "Removes filler words and redundant phrasing, and merges sentences that repeat each other";
    }

    @Override
    public String apply(String prompt) {
        validatePrompt(prompt);

        String optimized = compact(prompt);
        optimized = removeFillerWords(optimized);
        optimized = replaceAll(optimized, REDUNDANT_PHRASES);
        optimized = replaceAll(optimized, SIMPLIFICATION_RULES);
        optimized = condenseEquivalentSentences(optimized);
        optimized = normalizer.tidyPunctuation(compact(optimized));
        return optimized.strip();
    }

    @Override
    public double estimateReduction(String prompt) {
        if (!canApply(prompt)) {
            return 0.0;
        }
        String[] words = words(prompt);
        double estimate = (double) countFillerWords(prompt) / words.length * 0.3
                + redundancyScore(prompt) * 0.2
                + verbosityScore(prompt) * 0.15;
        return Math.max(0.0, Math.min(estimate, MAX_REDUCTION));
    }

    @Override
    public boolean canApply(String prompt) {
        if (prompt == null || prompt.strip().length() < MIN_LENGTH) {
            return false;
        }
        return countFillerWords(prompt) > 0
                || redundancyScore(prompt) > 0.1
                || verbosityScore(prompt) > 0.1;
    }

    String removeFillerWords(String text) {
        return filterWords(text, (words, i) -> {
            if (!FILLER_WORDS.contains(bareWord(words.get(i)))) {
                return true;
            }
            return i == 0 || i == words.size() - 1 || guard.protects(words, i);
        });
    }

    /**
     * Drops every sentence that is too close to one already kept. Line and paragraph
     * breaks survive; lines left empty disappear.
     */
    String condenseEquivalentSentences(String text) {
        double threshold = config.aggressiveMode() ? AGGRESSIVE_MERGE_THRESHOLD : MERGE_THRESHOLD;
        List<String> kept = new ArrayList<>();
        List<String> paragraphs = new ArrayList<>();

        for (String paragraph : text.split("\n\n")) {
            List<String> lines = new ArrayList<>();
            for (String line : paragraph.split("\n")) {
                List<String> sentences = new ArrayList<>();
                for (String sentence : SENTENCE_BOUNDARY.split(line.strip())) {
                    String candidate = sentence.strip();
                    if (candidate.isEmpty() || isDuplicate(candidate, kept, threshold)) {
                        continue;
                    }
                    kept.add(candidate);
                    sentences.add(candidate);
                }
                if (!sentences.isEmpty()) {
                    lines.add(String.join(" ", sentences));
                }
            }
            if (!lines.isEmpty()) {
                paragraphs.add(String.join("\n", lines));
            }
        }
        return String.join("\n\n", paragraphs);
    }

    int countFillerWords(String text) {
        int count = 0;
        for (String word : words(text)) {
            if (FILLER_WORDS.contains(bareWord(word))) {
                count++;
            }
        }
        return count;
    }

    /**
     * Mean pairwise word overlap of the "."-separated sentences.
     */
    double redundancyScore(String text) {
        String[] sentences = text.split("\\.", -1);
        if (sentences.length < 2) {
            return 0.0;
        }
        double sum = 0.0;
        int pairs = 0;
        for (int i = 0; i < sentences.length; i++) {
            for (int j = i + 1; j < sentences.length; j++) {
                sum += TextSimilarity.jaccard(sentences[i], sentences[j]);
                pairs++;
            }
        }
        return sum / pairs;
    }

    double verbosityScore(String text) {
        String[] words = words(text);
        if (words.length == 0) {
            return 0.0;
        }
        double averageLength = 0;
        for (String word : words) {
            averageLength += word.length();
        }
        averageLength /= words.length;
        double fillerRatio = (double) countFillerWords(text) / words.length;
        double verboseRatio = (double) countMatches(text, VERBOSE_CONSTRUCTS) / words.length;
        return (fillerRatio + verboseRatio + (averageLength - 5) / 10) / 3;
    }

    private static boolean isDuplicate(String sentence, List<String> kept, double threshold) {
        for (String existing : kept) {
            if (TextSimilarity.jaccard(sentence, existing) > threshold) {
                return true;
            }
        }
        return false;
    }

    private static Map<Pattern, String> rules(String... pairs) {
        Map<Pattern, String> rules = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            Pattern pattern = Pattern.compile("\\b" + pairs[i] + "(?![\\p{L}\\p{N}_])",
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
            rules.put(pattern, pairs[i + 1]);
        }
        return Collections.unmodifiableMap(rules);
    }
}
