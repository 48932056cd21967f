package com.promptoptimizer.domain.optimization.model;

import java.util.Map;

/**
 * Per-model constants used for token accounting and pricing.
 *
 * @param modelName              catalog key / display name
 * @param maxContextLength       context window in tokens
 * @param costPer1kInputTokens   USD per 1,000 input tokens
 * @param costPer1kOutputTokens  USD per 1,000 output tokens
 * @param tokenizerName          tokenizer identifier, e.g. "cl100k_base"
 * @param specialTokens          model-specific special tokens
 * @param customParams           family-specific switches (e.g. "use_xml_tags")
 */
public record ModelProfile(
        String modelName,
        int maxContextLength,
        double costPer1kInputTokens,
        double costPer1kOutputTokens,
        String tokenizerName,
        Map<String, String> specialTokens,
        Map<String, Object> customParams
) {

    public ModelProfile {
        specialTokens = specialTokens == null ? Map.of() : Map.copyOf(specialTokens);
        customParams = customParams == null ? Map.of() : Map.copyOf(customParams);
    }

    public ModelProfile(String modelName, int maxContextLength,
                        double costPer1kInputTokens, double costPer1kOutputTokens,
                        String tokenizerName) {
        this(modelName, maxContextLength, costPer1kInputTokens, costPer1kOutputTokens,
                tokenizerName, Map.of(), Map.of());
    }

    public ModelProfile withCustomParams(Map<String, Object> params) {
        return new ModelProfile(modelName, maxContextLength, costPer1kInputTokens,
                costPer1kOutputTokens, tokenizerName, specialTokens, params);
    }

    public boolean customFlag(String key) {
        Object value = customParams.get(key);
        return value instanceof Boolean b ? b : value != null && Boolean.parseBoolean(value.toString());
    }
}
