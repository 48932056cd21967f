package com.promptoptimizer.application.analysis;

public record ModelComparison(
        String model,
        String adapterType,
        int tokenCount,
        double estimatedCost,
        double contextUsage,
        boolean fitsInContext
) {}
