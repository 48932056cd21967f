package com.promptoptimizer.interfaces.api.dto;

public record ErrorResponse(String code, String message) {}
