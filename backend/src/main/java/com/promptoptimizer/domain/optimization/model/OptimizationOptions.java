package com.promptoptimizer.domain.optimization.model;

import java.util.List;

/**
 * Per-call options of the optimization pipeline.
 *
 * @param targetReduction stop once this reduction fraction is reached (nullable)
 * @param strategyNames   only run strategies with these names (nullable = all)
 */
public record OptimizationOptions(
        Double targetReduction,
        List<String> strategyNames
) {
    public OptimizationOptions {
        strategyNames = strategyNames == null ? null : List.copyOf(strategyNames);
    }

    public static OptimizationOptions none() {
        return new OptimizationOptions(null, null);
    }
}
