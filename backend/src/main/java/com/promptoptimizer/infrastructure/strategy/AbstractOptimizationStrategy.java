package com.promptoptimizer.infrastructure.strategy;

import com.promptoptimizer.domain.optimization.exception.InvalidPromptException;
import com.promptoptimizer.domain.optimization.model.OptimizationConfig;
import com.promptoptimizer.domain.optimization.model.StrategyMetadata;
import com.promptoptimizer.domain.optimization.service.OptimizationStrategy;
import com.promptoptimizer.infrastructure.preprocessing.TextNormalizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shared plumbing for the built-in strategies: input validation, metadata and the
 * whitespace-preserving word filter used by the removal passes.
 */
public abstract class AbstractOptimizationStrategy implements OptimizationStrategy {

    private static final Pattern WORD = Pattern.compile("\\S+");
    private static final Pattern NON_WORD_CHARS = Pattern.compile("[^\\p{L}\\p{N}_]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    protected final OptimizationConfig config;
    protected final TextNormalizer normalizer;

    protected AbstractOptimizationStrategy(OptimizationConfig config, TextNormalizer normalizer) {
        this.config = config == null ? OptimizationConfig.defaults() : config;
        this.normalizer = normalizer == null ? new TextNormalizer() : normalizer;
    }

    protected abstract String getDescription();

    @Override
    public String getName() {
        return getClass().getSimpleName();
    }

    @Override
    public OptimizationConfig getConfig() {
        return config;
    }

    @Override
    public StrategyMetadata getMetadata() {
        return new StrategyMetadata(getName(), getDescription(), config);
    }

    protected void validatePrompt(String prompt) {
        if (prompt == null) {
            throw new InvalidPromptException("Prompt must not be null");
        }
        if (prompt.isBlank()) {
            throw new InvalidPromptException("Prompt must not be blank");
        }
    }

    /**
     * Whitespace compaction honouring {@link OptimizationConfig#preserveStructure()}.
     */
    protected String compact(String text) {
        return normalizer.compact(text, config.preserveStructure());
    }

    /**
     * Drops the words rejected by {@code keep} while leaving the surrounding whitespace
     * layout intact. A line break in front of a removed word moves to the next kept word.
     */
    protected static String filterWords(String text, WordFilter keep) {
        List<String> words = new ArrayList<>();
        List<String> gaps = new ArrayList<>();
        Matcher matcher = WORD.matcher(text);
        int last = 0;
        while (matcher.find()) {
            gaps.add(text.substring(last, matcher.start()));
            words.add(matcher.group());
            last = matcher.end();
        }

        StringBuilder result = new StringBuilder(text.length());
        String carriedGap = null;
        for (int i = 0; i < words.size(); i++) {
            String gap = gaps.get(i);
            if (carriedGap != null && carriedGap.indexOf('\n') >= 0 && gap.indexOf('\n') < 0) {
                gap = carriedGap;
            }
            if (keep.test(words, i)) {
                result.append(gap).append(words.get(i));
                carriedGap = null;
            } else {
                carriedGap = gap;
            }
        }
        result.append(text.substring(last));
        return result.toString();
    }

    /**
     * Applies every pattern in order, replacing matches with the literal replacement
     * (group references such as {@code $1} are honoured).
     */
    protected static String replaceAll(String text, Map<Pattern, String> rules) {
        String result = text;
        for (Map.Entry<Pattern, String> rule : rules.entrySet()) {
            result = rule.getKey().matcher(result).replaceAll(rule.getValue());
        }
        return result;
    }

    protected static int countMatches(String text, Iterable<Pattern> patterns) {
        int count = 0;
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                count++;
            }
        }
        return count;
    }

    protected static Pattern wholeWord(String phrase) {
        return Pattern.compile("(?<![\\p{L}\\p{N}_])" + Pattern.quote(phrase) + "(?![\\p{L}\\p{N}_])",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    /**
     * Lower-cased word with every non-word character removed.
     */
    protected static String bareWord(String word) {
        return NON_WORD_CHARS.matcher(word.toLowerCase(Locale.ROOT)).replaceAll("");
    }

    protected static String[] words(String text) {
        if (text == null || text.isBlank()) {
            return new String[0];
        }
        return WHITESPACE.split(text.strip());
    }

    @FunctionalInterface
    protected interface WordFilter {
        boolean test(List<String> words, int index);
    }
}
