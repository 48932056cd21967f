package com.promptoptimizer.infrastructure.pipeline;

import com.promptoptimizer.domain.optimization.exception.InvalidPromptException;
import com.promptoptimizer.domain.optimization.model.OptimizationOptions;
import com.promptoptimizer.domain.optimization.model.OptimizationResult;
import com.promptoptimizer.domain.optimization.service.ModelAdapter;
import com.promptoptimizer.domain.optimization.service.OptimizationStrategy;
import com.promptoptimizer.infrastructure.metrics.SemanticMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Runs strategies in order over a prompt, accepting each output only if it stays
 * close enough in meaning to the original:
 * <p>
 * baseline tokens → for each strategy: can apply? → apply → similarity ≥ threshold? accept : reject → finalize
 * </p>
 * Similarity is always measured against the original prompt, never the previous step.
 * A failing strategy is logged and treated as a rejection; it never aborts the run.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OptimizationPipeline {

    /** Cost per token delta when no model adapter is available. */
    static final double FALLBACK_COST_PER_TOKEN = 0.000001;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final SemanticMetrics semanticMetrics;

    public OptimizationResult optimize(String prompt,
                                       ModelAdapter adapter,
                                       List<OptimizationStrategy> strategies,
                                       double threshold) {
        return optimize(prompt, adapter, strategies, threshold, OptimizationOptions.none());
    }

    public OptimizationResult optimize(String prompt,
                                       ModelAdapter adapter,
                                       List<OptimizationStrategy> strategies,
                                       double threshold,
                                       OptimizationOptions options) {
        if (prompt == null) {
            throw new InvalidPromptException("Prompt must not be null");
        }
        validateThreshold(threshold);
        OptimizationOptions opts = options != null ? options : OptimizationOptions.none();

        OptimizationPipelineContext ctx = new OptimizationPipelineContext();
        ctx.setStartNanos(System.nanoTime());
        ctx.setOriginalPrompt(prompt);
        ctx.setCurrentPrompt(prompt);
        ctx.setThreshold(threshold);
        ctx.setTargetReduction(opts.targetReduction());
        ctx.setModelName(adapter != null ? adapter.getProfile().modelName() : null);

        // 1. Baseline
        ctx.setOriginalTokens(countTokens(prompt, adapter));

        // 2. Strategies
        runStrategies(ctx, adapter, selectStrategies(strategies, opts));

        // 3. Finalize
        finalizeMetrics(ctx, adapter);

        log.info("Optimized prompt: {} -> {} tokens ({}%), similarity={}, strategies={}, rejected={}",
                ctx.getOriginalTokens(), ctx.getOptimizedTokens(),
                String.format("%.1f", ctx.reductionPercentage() * 100),
                String.format("%.3f", ctx.getSemanticSimilarity()),
                ctx.getStrategiesUsed(), ctx.getStrategiesRejected());

        return ctx.toResult();
    }

    /**
     * Optimize each prompt independently with the same settings. Output order matches input order.
     */
    public List<OptimizationResult> batchOptimize(List<String> prompts,
                                                  ModelAdapter adapter,
                                                  List<OptimizationStrategy> strategies,
                                                  double threshold,
                                                  OptimizationOptions options) {
        List<OptimizationResult> results = new ArrayList<>(prompts.size());
        for (String prompt : prompts) {
            results.add(optimize(prompt, adapter, strategies, threshold, options));
        }
        return results;
    }

    // ===== Internal methods =====

    private void runStrategies(OptimizationPipelineContext ctx, ModelAdapter adapter,
                               List<OptimizationStrategy> strategies) {
        for (OptimizationStrategy strategy : strategies) {
            if (targetReached(ctx, adapter)) {
                ctx.setTargetReached(true);
                log.debug("Target reduction {} reached, skipping remaining strategies", ctx.getTargetReduction());
                break;
            }

            String name = strategyName(strategy);
            String current = ctx.getCurrentPrompt();
            String candidate;
            try {
                if (!strategy.canApply(current)) {
                    log.debug("Strategy {} not applicable, skipped", name);
                    ctx.getStrategiesSkipped().add(name);
                    continue;
                }
                candidate = strategy.apply(current);
            } catch (RuntimeException e) {
                log.warn("Strategy {} failed, output discarded: {}", name, e.getMessage(), e);
                ctx.getStrategiesFailed().add(name);
                continue;
            }

            double similarity = semanticMetrics.calculateSimilarity(ctx.getOriginalPrompt(), candidate);
            if (similarity >= ctx.getThreshold()) {
                log.debug("Strategy {} accepted (similarity={})", name, similarity);
                ctx.setCurrentPrompt(candidate);
                ctx.getStrategiesUsed().add(name);
            } else {
                log.debug("Strategy {} rejected: similarity {} below threshold {}",
                        name, similarity, ctx.getThreshold());
                ctx.getStrategiesRejected().add(name);
            }
        }

        if (!ctx.isTargetReached() && ctx.getTargetReduction() != null) {
            ctx.setTargetReached(targetReached(ctx, adapter));
        }
    }

    private void finalizeMetrics(OptimizationPipelineContext ctx, ModelAdapter adapter) {
        String original = ctx.getOriginalPrompt();
        String optimized = ctx.getCurrentPrompt();

        ctx.setOptimizedTokens(countTokens(optimized, adapter));
        ctx.setSemanticSimilarity(optimized.equals(original)
                ? 1.0
                : semanticMetrics.calculateSimilarity(original, optimized));

        int delta = ctx.tokenReduction();
        ctx.setCostReduction(adapter != null
                ? adapter.calculateCostReduction(delta)
                : delta * FALLBACK_COST_PER_TOKEN);
    }

    private boolean targetReached(OptimizationPipelineContext ctx, ModelAdapter adapter) {
        Double target = ctx.getTargetReduction();
        if (target == null || ctx.getOriginalTokens() == 0 || ctx.getStrategiesUsed().isEmpty()) {
            return false;
        }
        int current = countTokens(ctx.getCurrentPrompt(), adapter);
        double reduction = (double) (ctx.getOriginalTokens() - current) / ctx.getOriginalTokens();
        return reduction >= target;
    }

    private static List<OptimizationStrategy> selectStrategies(List<OptimizationStrategy> strategies,
                                                               OptimizationOptions options) {
        if (strategies == null || strategies.isEmpty()) {
            return List.of();
        }
        if (options.strategyNames() == null) {
            return strategies;
        }
        return strategies.stream()
                .filter(s -> options.strategyNames().stream().anyMatch(n -> n.equalsIgnoreCase(strategyName(s))))
                .toList();
    }

    private static String strategyName(OptimizationStrategy strategy) {
        try {
            return strategy.getName();
        } catch (RuntimeException e) {
            log.warn("Strategy {} has no usable name: {}", strategy.getClass().getSimpleName(), e.getMessage());
            return strategy.getClass().getSimpleName();
        }
    }

    private static int countTokens(String text, ModelAdapter adapter) {
        if (adapter != null) {
            return adapter.countTokens(text);
        }
        return text.isBlank() ? 0 : WHITESPACE.split(text.strip()).length;
    }

    private static void validateThreshold(double threshold) {
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("Threshold must be between 0.0 and 1.0: " + threshold);
        }
    }
}
