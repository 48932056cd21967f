package com.promptoptimizer.infrastructure.model;

import com.promptoptimizer.domain.optimization.model.ModelInfo;
import com.promptoptimizer.domain.optimization.model.ModelProfile;
import com.promptoptimizer.domain.optimization.model.OptimizationSuggestions;
import com.promptoptimizer.domain.optimization.model.OptimizationSuggestions.Severity;
import com.promptoptimizer.domain.optimization.model.OptimizationSuggestions.Suggestion;
import com.promptoptimizer.domain.optimization.model.SuggestionType;
import com.promptoptimizer.domain.optimization.service.ModelAdapter;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Shared token/cost arithmetic for all model families.
 * Subclasses supply the exact tokenizer (if any) and family-specific advice.
 */
public abstract class AbstractModelAdapter implements ModelAdapter {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    static final double CONTEXT_WARNING_RATIO = 0.8;
    static final double COST_WARNING_USD = 0.01;

    // Courtesy preambles that carry no instruction for any model
    static final Pattern COURTESY_PREAMBLE = Pattern.compile(
            "\\b(please|kindly)\\s+(could you|would you|can you)\\s+", Pattern.CASE_INSENSITIVE);
    static final Pattern WANT_YOU_TO = Pattern.compile("\\bI would like you to\\s*", Pattern.CASE_INSENSITIVE);
    static final Pattern MULTIPLE_SPACES = Pattern.compile(" {2,}");
    static final Pattern EXCESSIVE_NEWLINES = Pattern.compile("\\n{3,}");

    protected final ModelProfile profile;
    private final HeuristicTokenEstimator estimator;

    protected AbstractModelAdapter(ModelProfile profile, HeuristicTokenEstimator estimator) {
        this.profile = profile;
        this.estimator = estimator;
    }

    @Override
    public final int countTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        String cleaned = cleanForTokenization(text);
        return Math.max(1, countCleanedTokens(cleaned));
    }

    /**
     * Count tokens of whitespace-normalized text. Defaults to the heuristic estimate.
     */
    protected int countCleanedTokens(String cleaned) {
        return estimateTokens(cleaned);
    }

    protected final int estimateTokens(String cleaned) {
        return estimator.estimate(cleaned);
    }

    @Override
    public double calculateCost(int inputTokens, int outputTokens) {
        double inputCost = (inputTokens / 1000.0) * profile.costPer1kInputTokens();
        double outputCost = (outputTokens / 1000.0) * profile.costPer1kOutputTokens();
        return inputCost + outputCost;
    }

    @Override
    public double calculateCostReduction(int tokenReduction) {
        return tokenReduction * (profile.costPer1kInputTokens() / 1000.0);
    }

    @Override
    public boolean canFitInContext(String text, int reserveTokens) {
        return countTokens(text) + reserveTokens <= profile.maxContextLength();
    }

    @Override
    public double estimateContextUsage(String text) {
        return (double) countTokens(text) / profile.maxContextLength();
    }

    @Override
    public OptimizationSuggestions suggestOptimizations(String text) {
        int tokenCount = countTokens(text);
        double contextUsage = (double) tokenCount / profile.maxContextLength();
        double cost = calculateCost(tokenCount);

        List<Suggestion> suggestions = new ArrayList<>();

        if (contextUsage > CONTEXT_WARNING_RATIO) {
            suggestions.add(new Suggestion(SuggestionType.CONTEXT_WARNING,
                    "Prompt uses more than 80% of the available context window",
                    Severity.HIGH));
        }

        if (cost > COST_WARNING_USD) {
            suggestions.add(new Suggestion(SuggestionType.COST_OPTIMIZATION,
                    String.format("Estimated cost: $%.4f. Consider optimizing to reduce costs", cost),
                    Severity.MEDIUM));
        }

        addModelSuggestions(text, tokenCount, suggestions);

        return new OptimizationSuggestions(tokenCount, contextUsage * 100, cost, suggestions);
    }

    /**
     * Family-specific hints, appended after the generic ones.
     */
    protected abstract void addModelSuggestions(String text, int tokenCount, List<Suggestion> suggestions);

    @Override
    public ModelProfile getProfile() {
        return profile;
    }

    @Override
    public ModelInfo getModelInfo() {
        return new ModelInfo(
                profile.modelName(),
                profile.maxContextLength(),
                profile.costPer1kInputTokens(),
                profile.costPer1kOutputTokens(),
                getClass().getSimpleName(),
                isExactTokenizer());
    }

    protected static String cleanForTokenization(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").strip();
    }

    protected static String removeCourtesyPreamble(String prompt) {
        String result = COURTESY_PREAMBLE.matcher(prompt).replaceAll("");
        return WANT_YOU_TO.matcher(result).replaceAll("");
    }

    protected static String tidySpacing(String prompt) {
        String result = MULTIPLE_SPACES.matcher(prompt).replaceAll(" ");
        return EXCESSIVE_NEWLINES.matcher(result).replaceAll("\n\n");
    }
}
