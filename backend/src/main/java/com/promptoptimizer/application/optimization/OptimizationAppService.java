package com.promptoptimizer.application.optimization;

import com.promptoptimizer.application.optimization.exception.BatchTooLargeException;
import com.promptoptimizer.application.optimization.exception.PromptTooLongException;
import com.promptoptimizer.domain.optimization.exception.InvalidPromptException;
import com.promptoptimizer.domain.optimization.model.OptimizationConfig;
import com.promptoptimizer.domain.optimization.model.OptimizationOptions;
import com.promptoptimizer.domain.optimization.model.OptimizationResult;
import com.promptoptimizer.domain.optimization.model.StrategyMetadata;
import com.promptoptimizer.domain.optimization.service.ModelAdapter;
import com.promptoptimizer.domain.optimization.service.OptimizationStrategy;
import com.promptoptimizer.infrastructure.model.ModelAdapterFactory;
import com.promptoptimizer.infrastructure.pipeline.OptimizationPipeline;
import com.promptoptimizer.infrastructure.strategy.StrategyRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Entry point for optimize calls: validates input, resolves the model adapter and the
 * strategies by name, then hands off to the {@link OptimizationPipeline}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OptimizationAppService {

    private final OptimizationPipeline optimizationPipeline;
    private final ModelAdapterFactory modelAdapterFactory;
    private final StrategyRegistry strategyRegistry;
    private final ExecutorService optimizationExecutor;

    @Value("${optimizer.default-model:gpt-3.5-turbo}")
    private String defaultModel;

    @Value("${optimizer.preserve-meaning-threshold:0.85}")
    private double defaultThreshold;

    @Value("${optimizer.max-prompt-length:20000}")
    private int maxPromptLength;

    @Value("${optimizer.max-batch-size:50}")
    private int maxBatchSize;

    @Value("${optimizer.default-strategies:semantic,token,structural}")
    private String defaultStrategies;

    /**
     * Optimize a single prompt. Null options fall back to the configured defaults.
     */
    public OptimizationResult optimize(String prompt,
                                       String model,
                                       List<String> strategyNames,
                                       Double threshold,
                                       Boolean aggressive,
                                       Boolean preserveStructure,
                                       Double targetReduction) {
        validatePrompt(prompt);

        ModelAdapter adapter = modelAdapterFactory.forModel(resolveModel(model));
        List<OptimizationStrategy> strategies = resolveStrategies(strategyNames,
                buildConfig(aggressive, preserveStructure, targetReduction));

        return optimizationPipeline.optimize(prompt, adapter, strategies, resolveThreshold(threshold),
                new OptimizationOptions(targetReduction, null));
    }

    /**
     * Optimize every prompt independently and concurrently. Results keep the input order.
     */
    public List<OptimizationResult> batchOptimize(List<String> prompts,
                                                  String model,
                                                  List<String> strategyNames,
                                                  Double threshold,
                                                  Boolean aggressive,
                                                  Boolean preserveStructure,
                                                  Double targetReduction) {
        if (prompts == null || prompts.isEmpty()) {
            return List.of();
        }
        if (prompts.size() > maxBatchSize) {
            throw new BatchTooLargeException(prompts.size(), maxBatchSize);
        }
        prompts.forEach(this::validatePrompt);

        ModelAdapter adapter = modelAdapterFactory.forModel(resolveModel(model));
        List<OptimizationStrategy> strategies = resolveStrategies(strategyNames,
                buildConfig(aggressive, preserveStructure, targetReduction));
        double resolvedThreshold = resolveThreshold(threshold);
        OptimizationOptions options = new OptimizationOptions(targetReduction, null);

        long start = System.currentTimeMillis();
        List<CompletableFuture<OptimizationResult>> futures = prompts.stream()
                .map(prompt -> CompletableFuture.supplyAsync(() ->
                        optimizationPipeline.optimize(prompt, adapter, strategies, resolvedThreshold, options),
                        optimizationExecutor))
                .toList();

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }

        List<OptimizationResult> results = futures.stream().map(CompletableFuture::join).toList();
        log.info("Batch optimized {} prompts in {}ms", results.size(), System.currentTimeMillis() - start);
        return results;
    }

    public List<StrategyMetadata> availableStrategies() {
        return strategyRegistry.describeAll(OptimizationConfig.defaults());
    }

    public List<String> defaultStrategyNames() {
        return parseStrategyList(defaultStrategies);
    }

    // ===== Internal methods =====

    private void validatePrompt(String prompt) {
        if (prompt == null || prompt.isBlank()) {
            throw new InvalidPromptException("Prompt must not be blank");
        }
        if (prompt.length() > maxPromptLength) {
            throw new PromptTooLongException(prompt.length(), maxPromptLength);
        }
    }

    private String resolveModel(String model) {
        return model == null || model.isBlank() ? defaultModel : model.strip();
    }

    private double resolveThreshold(Double threshold) {
        return threshold != null ? threshold : defaultThreshold;
    }

    private List<OptimizationStrategy> resolveStrategies(List<String> names, OptimizationConfig config) {
        List<String> requested = names == null || names.isEmpty() ? defaultStrategyNames() : names;
        return strategyRegistry.createAll(requested, config);
    }

    private static OptimizationConfig buildConfig(Boolean aggressive, Boolean preserveStructure,
                                                  Double targetReduction) {
        OptimizationConfig config = OptimizationConfig.defaults();
        if (aggressive != null) {
            config = config.withAggressiveMode(aggressive);
        }
        if (preserveStructure != null) {
            config = config.withPreserveStructure(preserveStructure);
        }
        return config.withTargetReduction(targetReduction);
    }

    private static List<String> parseStrategyList(String value) {
        if (value == null || value.isBlank()) {
            return StrategyRegistry.DEFAULT_ORDER;
        }
        return Arrays.stream(value.split(","))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
