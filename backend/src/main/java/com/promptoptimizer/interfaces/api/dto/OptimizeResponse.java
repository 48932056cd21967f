package com.promptoptimizer.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.promptoptimizer.domain.optimization.model.OptimizationResult;

import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record OptimizeResponse(
        String originalPrompt,
        String optimizedPrompt,
        int originalTokens,
        int optimizedTokens,
        int tokenReduction,
        double reductionPercentage,
        double semanticSimilarity,
        double costReduction,
        double optimizationTime,
        List<String> strategiesUsed,
        Map<String, Object> metadata
) {
    public static OptimizeResponse from(OptimizationResult result) {
        return new OptimizeResponse(
                result.originalPrompt(),
                result.optimizedPrompt(),
                result.originalTokens(),
                result.optimizedTokens(),
                result.tokenReduction(),
                result.reductionPercentage(),
                result.semanticSimilarity(),
                result.costReduction(),
                result.optimizationTime(),
                result.strategiesUsed(),
                result.metadata()
        );
    }
}
