package com.promptoptimizer.domain.optimization.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Final output of one optimization run.
 *
 * @param originalPrompt     the input text, untouched
 * @param optimizedPrompt    the text after every accepted strategy
 * @param tokenReduction     originalTokens - optimizedTokens (may be zero or negative)
 * @param semanticSimilarity similarity of optimized vs original, in [0, 1]
 * @param costReduction      estimated input-cost delta in USD
 * @param optimizationTime   wall-clock duration in seconds
 * @param strategiesUsed     names of the strategies whose output passed the gate, in order
 * @param metadata           token counts, reduction percentage and run diagnostics
 */
public record OptimizationResult(
        String originalPrompt,
        String optimizedPrompt,
        int tokenReduction,
        double semanticSimilarity,
        double costReduction,
        double optimizationTime,
        List<String> strategiesUsed,
        Map<String, Object> metadata
) {

    public static final String ORIGINAL_TOKENS = "original_tokens";
    public static final String OPTIMIZED_TOKENS = "optimized_tokens";
    public static final String REDUCTION_PERCENTAGE = "reduction_percentage";

    public OptimizationResult {
        semanticSimilarity = Math.max(0.0, Math.min(semanticSimilarity, 1.0));
        strategiesUsed = strategiesUsed == null ? List.of() : List.copyOf(strategiesUsed);
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public int originalTokens() {
        return ((Number) metadata.getOrDefault(ORIGINAL_TOKENS, 0)).intValue();
    }

    public int optimizedTokens() {
        return ((Number) metadata.getOrDefault(OPTIMIZED_TOKENS, 0)).intValue();
    }

    public double reductionPercentage() {
        return ((Number) metadata.getOrDefault(REDUCTION_PERCENTAGE, 0.0)).doubleValue();
    }

    public boolean wasOptimized() {
        return !strategiesUsed.isEmpty();
    }
}
