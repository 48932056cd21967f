package com.promptoptimizer.interfaces.api.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

public record OptimizeRequest(
        @NotBlank(message = "Prompt is required")
        String prompt,

        String model,

        List<String> strategies,

        @DecimalMin(value = "0.0", message = "Threshold must be at least 0.0")
        @DecimalMax(value = "1.0", message = "Threshold must be at most 1.0")
        Double threshold,

        Boolean aggressive,

        Boolean preserveStructure,

        @DecimalMin(value = "0.0", message = "Target reduction must be at least 0.0")
        @DecimalMax(value = "1.0", message = "Target reduction must be at most 1.0")
        Double targetReduction
) {}
