package com.promptoptimizer.infrastructure.model;

import com.promptoptimizer.domain.optimization.model.ModelProfile;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Static, read-only catalog of model profiles keyed by model name.
 * Unknown names resolve to the family default.
 */
@Slf4j
public final class ModelProfileCatalog {

    private static final Map<String, String> CL100K_SPECIAL_TOKENS = Map.of(
            "endoftext", "<|endoftext|>",
            "fim_prefix", "<|fim_prefix|>",
            "fim_middle", "<|fim_middle|>",
            "fim_suffix", "<|fim_suffix|>",
            "endofprompt", "<|endofprompt|>"
    );
    private static final Map<String, String> O200K_SPECIAL_TOKENS = Map.of(
            "endoftext", "<|endoftext|>",
            "endofprompt", "<|endofprompt|>"
    );

    private static final Map<ModelFamily, Map<String, ModelProfile>> PROFILES = new EnumMap<>(ModelFamily.class);

    static {
        register(ModelFamily.OPENAI, openAi("gpt-3.5-turbo", 4096, 0.0015, 0.002, "cl100k_base"));
        register(ModelFamily.OPENAI, openAi("gpt-3.5-turbo-16k", 16384, 0.003, 0.004, "cl100k_base"));
        register(ModelFamily.OPENAI, openAi("gpt-4", 8192, 0.03, 0.06, "cl100k_base"));
        register(ModelFamily.OPENAI, openAi("gpt-4-turbo", 128000, 0.01, 0.03, "cl100k_base"));
        register(ModelFamily.OPENAI, openAi("gpt-4o", 128000, 0.005, 0.015, "o200k_base"));

        register(ModelFamily.CLAUDE, new ModelProfile("claude-2", 100000, 0.008, 0.024, "claude"));
        register(ModelFamily.CLAUDE, new ModelProfile("claude-2.1", 200000, 0.008, 0.024, "claude"));
        register(ModelFamily.CLAUDE, new ModelProfile("claude-3-haiku", 200000, 0.00025, 0.00125, "claude"));
        register(ModelFamily.CLAUDE, new ModelProfile("claude-3-sonnet", 200000, 0.003, 0.015, "claude"));
        register(ModelFamily.CLAUDE, new ModelProfile("claude-3-opus", 200000, 0.015, 0.075, "claude"));
        register(ModelFamily.CLAUDE, new ModelProfile("claude-3.5-sonnet", 200000, 0.003, 0.015, "claude"));
    }

    private ModelProfileCatalog() {
    }

    private static ModelProfile openAi(String name, int context, double input, double output, String tokenizer) {
        Map<String, String> special = "o200k_base".equals(tokenizer) ? O200K_SPECIAL_TOKENS : CL100K_SPECIAL_TOKENS;
        return new ModelProfile(name, context, input, output, tokenizer, special, Map.of());
    }

    private static void register(ModelFamily family, ModelProfile profile) {
        PROFILES.computeIfAbsent(family, f -> new LinkedHashMap<>()).put(profile.modelName(), profile);
    }

    /**
     * Look up a profile within a family, falling back to the family default.
     */
    public static ModelProfile lookup(ModelFamily family, String modelName) {
        Map<String, ModelProfile> profiles = PROFILES.get(family);
        if (modelName != null) {
            ModelProfile profile = profiles.get(modelName.toLowerCase(Locale.ROOT));
            if (profile != null) {
                return profile;
            }
            log.debug("Unknown {} model '{}', using default {}", family, modelName, family.getDefaultModel());
        }
        return profiles.get(family.getDefaultModel());
    }

    public static ModelProfile lookup(String modelName) {
        return lookup(ModelFamily.fromModelName(modelName), modelName);
    }

    public static boolean contains(String modelName) {
        if (modelName == null) {
            return false;
        }
        String key = modelName.toLowerCase(Locale.ROOT);
        return PROFILES.values().stream().anyMatch(p -> p.containsKey(key));
    }

    public static List<ModelProfile> all() {
        List<ModelProfile> all = new ArrayList<>();
        PROFILES.values().forEach(p -> all.addAll(p.values()));
        return Collections.unmodifiableList(all);
    }
}
