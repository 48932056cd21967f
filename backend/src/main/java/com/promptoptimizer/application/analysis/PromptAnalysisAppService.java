package com.promptoptimizer.application.analysis;

import com.promptoptimizer.application.optimization.exception.PromptTooLongException;
import com.promptoptimizer.domain.optimization.exception.InvalidPromptException;
import com.promptoptimizer.domain.optimization.model.ModelInfo;
import com.promptoptimizer.domain.optimization.model.OptimizationSuggestions;
import com.promptoptimizer.domain.optimization.service.ModelAdapter;
import com.promptoptimizer.infrastructure.metrics.SemanticMetrics;
import com.promptoptimizer.infrastructure.metrics.TokenMetrics;
import com.promptoptimizer.infrastructure.model.ModelAdapterFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Read-only analyses of a prompt: token accounting, advice, cross-model comparison
 * and model-specific formatting.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PromptAnalysisAppService {

    private final ModelAdapterFactory modelAdapterFactory;
    private final TokenMetrics tokenMetrics;
    private final SemanticMetrics semanticMetrics;

    @Value("${optimizer.default-model:gpt-3.5-turbo}")
    private String defaultModel;

    @Value("${optimizer.max-prompt-length:20000}")
    private int maxPromptLength;

    public TokenReport analyzeTokens(String text, String model) {
        validateText(text);
        ModelAdapter adapter = adapterFor(model);
        int tokens = adapter.countTokens(text);

        return new TokenReport(
                adapter.getProfile().modelName(),
                tokens,
                adapter.isExactTokenizer(),
                adapter.calculateCost(tokens),
                adapter.estimateContextUsage(text),
                tokenMetrics.analyzeTokens(text),
                tokenMetrics.calculateReductionPotential(text),
                semanticMetrics.analyzeSemanticContent(text)
        );
    }

    public OptimizationSuggestions suggest(String text, String model) {
        validateText(text);
        return adapterFor(model).suggestOptimizations(text);
    }

    /**
     * Tokens and input cost of the text for every catalog model, cheapest first.
     */
    public List<ModelComparison> compareModels(String text) {
        validateText(text);
        List<ModelComparison> comparisons = modelAdapterFactory.availableModels().stream()
                .map(profile -> modelAdapterFactory.forModel(profile.modelName()))
                .map(adapter -> {
                    int tokens = adapter.countTokens(text);
                    return new ModelComparison(
                            adapter.getProfile().modelName(),
                            adapter.getModelInfo().adapterType(),
                            tokens,
                            adapter.calculateCost(tokens),
                            adapter.estimateContextUsage(text),
                            adapter.canFitInContext(text));
                })
                .sorted(Comparator.comparingDouble(ModelComparison::estimatedCost))
                .toList();
        log.debug("Compared prompt across {} models", comparisons.size());
        return comparisons;
    }

    public FormattedPrompt formatForModel(String text, String model) {
        return formatForModel(text, model, Map.of());
    }

    /**
     * Rewrite the text for the model, with optional family switches such as
     * "use_xml_tags" or "encourage_reasoning" for Claude models.
     */
    public FormattedPrompt formatForModel(String text, String model, Map<String, Object> modelParams) {
        validateText(text);
        ModelAdapter adapter = modelAdapterFactory.forModel(resolveModel(model), modelParams);
        String formatted = adapter.optimizeForModel(text);
        return new FormattedPrompt(
                adapter.getProfile().modelName(),
                text,
                formatted,
                adapter.countTokens(text),
                adapter.countTokens(formatted));
    }

    public List<ModelInfo> listModels() {
        return modelAdapterFactory.availableModels().stream()
                .map(profile -> modelAdapterFactory.forModel(profile.modelName()).getModelInfo())
                .toList();
    }

    // ===== Internal methods =====

    private ModelAdapter adapterFor(String model) {
        return modelAdapterFactory.forModel(resolveModel(model));
    }

    private String resolveModel(String model) {
        return model == null || model.isBlank() ? defaultModel : model.strip();
    }

    private void validateText(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidPromptException("Text must not be blank");
        }
        if (text.length() > maxPromptLength) {
            throw new PromptTooLongException(text.length(), maxPromptLength);
        }
    }
}
