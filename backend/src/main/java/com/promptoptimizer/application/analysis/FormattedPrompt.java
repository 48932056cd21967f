package com.promptoptimizer.application.analysis;

public record FormattedPrompt(
        String model,
        String originalText,
        String formattedText,
        int originalTokens,
        int formattedTokens
) {}
