package com.promptoptimizer.domain.optimization.model;

import java.util.List;

/**
 * Non-authoritative advice about a prompt for a given model.
 *
 * @param currentTokens       token count of the prompt
 * @param contextUsagePercent share of the context window used, 0-100+
 * @param estimatedCost       input cost of the prompt in USD
 * @param suggestions         individual hints, most general first
 */
public record OptimizationSuggestions(
        int currentTokens,
        double contextUsagePercent,
        double estimatedCost,
        List<Suggestion> suggestions
) {
    public OptimizationSuggestions {
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public boolean has(SuggestionType type) {
        return suggestions.stream().anyMatch(s -> s.type() == type);
    }

    /**
     * @param type     category of the hint
     * @param message  human-readable advice
     * @param severity how strongly the caller should surface it
     */
    public record Suggestion(
            SuggestionType type,
            String message,
            Severity severity
    ) {}

    public enum Severity {
        HIGH,
        MEDIUM,
        LOW
    }
}
