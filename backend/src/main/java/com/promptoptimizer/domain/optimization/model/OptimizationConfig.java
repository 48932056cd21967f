package com.promptoptimizer.domain.optimization.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable settings owned by a strategy.
 *
 * @param aggressiveMode    enables the more lossy variants of a strategy's passes
 * @param preserveStructure keep line breaks and blank lines while compacting whitespace
 * @param targetReduction   desired reduction fraction (0.0-1.0), nullable
 * @param customParams      strategy-specific parameters (read-only)
 */
public record OptimizationConfig(
        boolean aggressiveMode,
        boolean preserveStructure,
        Double targetReduction,
        Map<String, Object> customParams
) {

    public OptimizationConfig {
        if (targetReduction != null && (targetReduction < 0.0 || targetReduction > 1.0)) {
            throw new IllegalArgumentException("targetReduction must be between 0.0 and 1.0: " + targetReduction);
        }
        customParams = customParams == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(customParams));
    }

    public static OptimizationConfig defaults() {
        return new OptimizationConfig(false, true, null, Map.of());
    }

    public OptimizationConfig withAggressiveMode(boolean aggressive) {
        return new OptimizationConfig(aggressive, preserveStructure, targetReduction, customParams);
    }

    public OptimizationConfig withPreserveStructure(boolean preserve) {
        return new OptimizationConfig(aggressiveMode, preserve, targetReduction, customParams);
    }

    public OptimizationConfig withTargetReduction(Double target) {
        return new OptimizationConfig(aggressiveMode, preserveStructure, target, customParams);
    }

    public OptimizationConfig withParam(String key, Object value) {
        Map<String, Object> params = new LinkedHashMap<>(customParams);
        params.put(key, value);
        return new OptimizationConfig(aggressiveMode, preserveStructure, targetReduction, params);
    }

    /**
     * Boolean custom parameter, accepting {@code Boolean} or its string form.
     */
    public boolean flag(String key, boolean defaultValue) {
        Object value = customParams.get(key);
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            return Boolean.parseBoolean(s);
        }
        return defaultValue;
    }
}
