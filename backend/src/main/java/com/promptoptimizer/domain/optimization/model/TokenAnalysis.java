package com.promptoptimizer.domain.optimization.model;

import java.util.Map;

/**
 * Lexical statistics of a text.
 */
public record TokenAnalysis(
        int totalTokens,
        int uniqueTokens,
        double averageTokenLength,
        Map<String, Integer> tokenDistribution,
        double redundancyScore
) {
    public TokenAnalysis {
        tokenDistribution = tokenDistribution == null ? Map.of() : Map.copyOf(tokenDistribution);
    }
}
