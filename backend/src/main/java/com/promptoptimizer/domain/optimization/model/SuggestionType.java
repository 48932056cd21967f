package com.promptoptimizer.domain.optimization.model;

public enum SuggestionType {
    CONTEXT_WARNING,
    COST_OPTIMIZATION,
    MODEL_RECOMMENDATION,
    FORMAT_OPTIMIZATION,
    EFFECTIVENESS_TIP
}
