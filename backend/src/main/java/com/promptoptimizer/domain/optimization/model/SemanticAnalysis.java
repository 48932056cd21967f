package com.promptoptimizer.domain.optimization.model;

import java.util.List;

public record SemanticAnalysis(
        double semanticDensity,
        double coherenceScore,
        double complexityScore,
        List<String> keyConcepts
) {
    public SemanticAnalysis {
        keyConcepts = keyConcepts == null ? List.of() : List.copyOf(keyConcepts);
    }
}
