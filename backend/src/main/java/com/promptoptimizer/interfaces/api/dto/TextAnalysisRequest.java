package com.promptoptimizer.interfaces.api.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.Map;

public record TextAnalysisRequest(
        @NotBlank(message = "Text is required")
        String text,

        String model,

        Map<String, Object> modelParams
) {}
