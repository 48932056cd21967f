package com.promptoptimizer.domain.optimization.model;

public record StrategyMetadata(
        String name,
        String description,
        OptimizationConfig config
) {}
