package com.promptoptimizer.interfaces.api.dto;

public record ModelFormatResponse(
        String model,
        String originalText,
        String formattedText,
        int originalTokens,
        int formattedTokens
) {}
