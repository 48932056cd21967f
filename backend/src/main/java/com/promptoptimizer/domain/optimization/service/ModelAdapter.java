package com.promptoptimizer.domain.optimization.service;

import com.promptoptimizer.domain.optimization.model.ModelInfo;
import com.promptoptimizer.domain.optimization.model.ModelProfile;
import com.promptoptimizer.domain.optimization.model.OptimizationSuggestions;

/**
 * Model-specific token accounting and pricing.
 * <p>
 * Implementations use an exact subword tokenizer when the model family publishes one,
 * otherwise a deterministic heuristic estimate. Callers must tolerate the variance
 * between the two.
 */
public interface ModelAdapter {

    /**
     * Count tokens of the given text for this model.
     *
     * @param text text to count, may be empty
     * @return 0 for an empty string, at least 1 for any non-empty string
     */
    int countTokens(String text);

    /**
     * Cost in USD of the given input and output token counts.
     */
    double calculateCost(int inputTokens, int outputTokens);

    default double calculateCost(int inputTokens) {
        return calculateCost(inputTokens, 0);
    }

    /**
     * Input-cost saving in USD for a token delta.
     */
    double calculateCostReduction(int tokenReduction);

    boolean canFitInContext(String text, int reserveTokens);

    default boolean canFitInContext(String text) {
        return canFitInContext(text, 1000);
    }

    /**
     * Share of the context window the text occupies (may exceed 1.0).
     */
    double estimateContextUsage(String text);

    /**
     * Advisory hints; never alters the prompt.
     */
    OptimizationSuggestions suggestOptimizations(String text);

    /**
     * Rewrite the prompt in the form this model family handles best.
     */
    String optimizeForModel(String text);

    ModelProfile getProfile();

    ModelInfo getModelInfo();

    /**
     * Whether counts come from the exact tokenizer rather than the heuristic.
     */
    boolean isExactTokenizer();
}
