package com.promptoptimizer.infrastructure.model;

import java.util.Locale;

/**
 * The closed set of supported model families.
 */
public enum ModelFamily {
    OPENAI("gpt-3.5-turbo"),
    CLAUDE("claude-3-sonnet");

    private final String defaultModel;

    ModelFamily(String defaultModel) {
        this.defaultModel = defaultModel;
    }

    public String getDefaultModel() {
        return defaultModel;
    }

    /**
     * Resolve the family from a model name; anything that is not a Claude model is
     * accounted as OpenAI.
     */
    public static ModelFamily fromModelName(String modelName) {
        if (modelName != null && modelName.toLowerCase(Locale.ROOT).startsWith("claude")) {
            return CLAUDE;
        }
        return OPENAI;
    }
}
