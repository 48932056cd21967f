package com.promptoptimizer.infrastructure.model;

import com.promptoptimizer.domain.optimization.model.ModelProfile;
import com.promptoptimizer.domain.optimization.service.ModelAdapter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates model adapters by model name. Adapters are immutable, so one instance per
 * model is cached and shared.
 */
@Slf4j
@Component
public class ModelAdapterFactory {

    private final Map<String, ModelAdapter> adapters = new ConcurrentHashMap<>();

    public ModelAdapter forModel(String modelName) {
        ModelProfile profile = ModelProfileCatalog.lookup(modelName);
        return adapters.computeIfAbsent(profile.modelName(), name -> create(profile));
    }

    /**
     * Adapter for a catalog model with family-specific switches (e.g. "use_xml_tags").
     * Without switches this is the cached catalog adapter.
     */
    public ModelAdapter forModel(String modelName, Map<String, Object> customParams) {
        if (customParams == null || customParams.isEmpty()) {
            return forModel(modelName);
        }
        return forProfile(ModelProfileCatalog.lookup(modelName).withCustomParams(customParams));
    }

    /**
     * Adapter for a caller-supplied profile; not cached.
     */
    public ModelAdapter forProfile(ModelProfile profile) {
        return create(profile);
    }

    public List<ModelProfile> availableModels() {
        return ModelProfileCatalog.all();
    }

    private ModelAdapter create(ModelProfile profile) {
        ModelAdapter adapter = switch (ModelFamily.fromModelName(profile.modelName())) {
            case CLAUDE -> new ClaudeModelAdapter(profile);
            case OPENAI -> new OpenAiModelAdapter(profile);
        };
        log.info("Model adapter created: model={}, type={}, exactTokenizer={}",
                profile.modelName(), adapter.getClass().getSimpleName(), adapter.isExactTokenizer());
        return adapter;
    }
}
