package com.promptoptimizer.domain.optimization.service;

import com.promptoptimizer.domain.optimization.model.OptimizationConfig;
import com.promptoptimizer.domain.optimization.model.StrategyMetadata;

/**
 * A stateless, pluggable prompt transformer.
 * <p>
 * Implementations hold only their {@link OptimizationConfig} and read-only lookup tables,
 * so one instance may serve concurrent optimize calls.
 */
public interface OptimizationStrategy {

    /**
     * Transform the prompt.
     *
     * @param prompt the text to transform
     * @return the transformed text
     * @throws com.promptoptimizer.domain.optimization.exception.InvalidPromptException
     *         if the prompt is null or blank
     */
    String apply(String prompt);

    /**
     * Predicted reduction fraction. A prediction only; may be negative for strategies
     * that add scaffolding.
     */
    double estimateReduction(String prompt);

    /**
     * Cheap pre-check. Returns false whenever {@link #estimateReduction} would be ~0.
     */
    boolean canApply(String prompt);

    String getName();

    OptimizationConfig getConfig();

    StrategyMetadata getMetadata();
}
