package com.promptoptimizer.infrastructure.strategy;

import com.promptoptimizer.domain.optimization.exception.UnknownStrategyException;
import com.promptoptimizer.domain.optimization.model.OptimizationConfig;
import com.promptoptimizer.domain.optimization.model.StrategyMetadata;
import com.promptoptimizer.domain.optimization.service.OptimizationStrategy;
import com.promptoptimizer.infrastructure.preprocessing.TextNormalizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.BiFunction;

/**
 * Builds strategy instances by name. Accepts the short names ({@code semantic},
 * {@code token}, {@code structural}), their snake-case forms and the class names.
 */
@Component
@RequiredArgsConstructor
public class StrategyRegistry {

    public static final List<String> DEFAULT_ORDER = List.of("semantic", "token", "structural");

    private static final Map<String, BiFunction<OptimizationConfig, TextNormalizer, OptimizationStrategy>> FACTORIES = Map.of(
            "semantic", (config, normalizer) ->
                    new SemanticCompressionStrategy(config, normalizer, ContextPatternGuard.emphasis()),
            "token", (config, normalizer) ->
                    new TokenReductionStrategy(config, normalizer, ContextPatternGuard.fixedExpressions()),
            "structural", StructuralOptimizationStrategy::new
    );

    private static final Map<String, String> ALIASES = Map.of(
            "semantic_compression", "semantic",
            "semanticcompressionstrategy", "semantic",
            "token_reduction", "token",
            "tokenreductionstrategy", "token",
            "structural_optimization", "structural",
            "structuraloptimizationstrategy", "structural"
    );

    private final TextNormalizer textNormalizer;

    public OptimizationStrategy create(String name, OptimizationConfig config) {
        String key = canonicalName(name);
        return FACTORIES.get(key).apply(config, textNormalizer);
    }

    /**
     * Strategies in the given order; the default order when {@code names} is null or empty.
     */
    public List<OptimizationStrategy> createAll(List<String> names, OptimizationConfig config) {
        List<String> requested = names == null || names.isEmpty() ? DEFAULT_ORDER : names;
        List<OptimizationStrategy> strategies = new ArrayList<>(requested.size());
        for (String name : requested) {
            strategies.add(create(name, config));
        }
        return strategies;
    }

    public List<StrategyMetadata> describeAll(OptimizationConfig config) {
        return DEFAULT_ORDER.stream()
                .map(name -> create(name, config).getMetadata())
                .toList();
    }

    public boolean isKnown(String name) {
        try {
            canonicalName(name);
            return true;
        } catch (UnknownStrategyException e) {
            return false;
        }
    }

    /**
     * Short name for any accepted spelling.
     *
     * @throws UnknownStrategyException if the name is not recognised
     */
    public String canonicalName(String name) {
        if (name == null || name.isBlank()) {
            throw new UnknownStrategyException(String.valueOf(name));
        }
        String key = name.strip().toLowerCase(Locale.ROOT);
        key = ALIASES.getOrDefault(key, key);
        if (!FACTORIES.containsKey(key)) {
            throw new UnknownStrategyException(name);
        }
        return key;
    }
}
