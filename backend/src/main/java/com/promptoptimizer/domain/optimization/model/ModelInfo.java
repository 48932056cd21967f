package com.promptoptimizer.domain.optimization.model;

public record ModelInfo(
        String modelName,
        int maxContextLength,
        double costPer1kInput,
        double costPer1kOutput,
        String adapterType,
        boolean exactTokenizer
) {}
