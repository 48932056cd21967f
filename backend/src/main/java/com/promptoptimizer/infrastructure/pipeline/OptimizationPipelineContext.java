package com.promptoptimizer.infrastructure.pipeline;

import com.promptoptimizer.domain.optimization.model.OptimizationResult;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of a single optimize call.
 * Created per call, never shared between threads.
 */
@Data
public class OptimizationPipelineContext {

    // --- Input ---
    private String originalPrompt;
    private String modelName;
    private double threshold;
    private Double targetReduction;
    private long startNanos;

    // --- Baseline ---
    private int originalTokens;

    // --- Progress ---
    private String currentPrompt;
    private List<String> strategiesUsed = new ArrayList<>();
    private List<String> strategiesSkipped = new ArrayList<>();
    private List<String> strategiesRejected = new ArrayList<>();
    private List<String> strategiesFailed = new ArrayList<>();
    private boolean targetReached;

    // --- Final ---
    private int optimizedTokens;
    private double semanticSimilarity;
    private double costReduction;

    public int tokenReduction() {
        return originalTokens - optimizedTokens;
    }

    public double reductionPercentage() {
        return originalTokens > 0 ? (double) tokenReduction() / originalTokens : 0.0;
    }

    /**
     * Build the final OptimizationResult from accumulated context.
     */
    public OptimizationResult toResult() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(OptimizationResult.ORIGINAL_TOKENS, originalTokens);
        metadata.put(OptimizationResult.OPTIMIZED_TOKENS, optimizedTokens);
        metadata.put(OptimizationResult.REDUCTION_PERCENTAGE, reductionPercentage());
        if (modelName != null) {
            metadata.put("model", modelName);
        }
        metadata.put("strategies_skipped", List.copyOf(strategiesSkipped));
        metadata.put("strategies_rejected", List.copyOf(strategiesRejected));
        metadata.put("strategies_failed", List.copyOf(strategiesFailed));
        if (targetReduction != null) {
            metadata.put("target_reduction", targetReduction);
            metadata.put("target_reached", targetReached);
        }

        double elapsedSeconds = (System.nanoTime() - startNanos) / 1_000_000_000.0;
        return new OptimizationResult(
                originalPrompt,
                currentPrompt,
                tokenReduction(),
                semanticSimilarity,
                costReduction,
                elapsedSeconds,
                strategiesUsed,
                metadata
        );
    }
}
