package com.promptoptimizer.application.analysis;

import com.promptoptimizer.domain.optimization.model.SemanticAnalysis;
import com.promptoptimizer.domain.optimization.model.TokenAnalysis;

/**
 * Token count, cost and lexical analysis of one text for one model.
 */
public record TokenReport(
        String model,
        int tokenCount,
        boolean exactTokenizer,
        double estimatedCost,
        double contextUsage,
        TokenAnalysis tokenAnalysis,
        double reductionPotential,
        SemanticAnalysis semanticAnalysis
) {}
