package com.promptoptimizer.infrastructure.strategy;

import com.promptoptimizer.domain.optimization.exception.UnknownStrategyException;
import com.promptoptimizer.domain.optimization.model.OptimizationConfig;
import com.promptoptimizer.domain.optimization.model.StrategyMetadata;
import com.promptoptimizer.domain.optimization.service.OptimizationStrategy;
import com.promptoptimizer.infrastructure.preprocessing.TextNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StrategyRegistryTest {

    private StrategyRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new StrategyRegistry(new TextNormalizer());
    }

    @Test
    @DisplayName("short names, snake-case names and class names are accepted")
    void aliases() {
        assertThat(registry.create("semantic", null)).isInstanceOf(SemanticCompressionStrategy.class);
        assertThat(registry.create("token_reduction", null)).isInstanceOf(TokenReductionStrategy.class);
        assertThat(registry.create("StructuralOptimizationStrategy", null))
                .isInstanceOf(StructuralOptimizationStrategy.class);
    }

    @Test
    @DisplayName("unknown names are rejected")
    void unknownName() {
        assertThatThrownBy(() -> registry.create("magic", null))
                .isInstanceOf(UnknownStrategyException.class)
                .hasMessageContaining("magic");
        assertThat(registry.isKnown("magic")).isFalse();
        assertThat(registry.isKnown(" Semantic ")).isTrue();
    }

    @Test
    @DisplayName("the default order is semantic, token, structural")
    void defaultOrder() {
        List<OptimizationStrategy> strategies = registry.createAll(null, null);

        assertThat(strategies).extracting(OptimizationStrategy::getName).containsExactly(
                "SemanticCompressionStrategy", "TokenReductionStrategy", "StructuralOptimizationStrategy");
    }

    @Test
    @DisplayName("requested order is kept and the config is passed on")
    void requestedOrder() {
        OptimizationConfig config = OptimizationConfig.defaults().withAggressiveMode(true);
        List<OptimizationStrategy> strategies = registry.createAll(List.of("structural", "token"), config);

        assertThat(strategies).extracting(OptimizationStrategy::getName)
                .containsExactly("StructuralOptimizationStrategy", "TokenReductionStrategy");
        assertThat(strategies).allMatch(s -> s.getConfig().aggressiveMode());
    }

    @Test
    @DisplayName("every built-in strategy is described")
    void describeAll() {
        assertThat(registry.describeAll(OptimizationConfig.defaults()))
                .extracting(StrategyMetadata::description)
                .hasSize(3)
                .allMatch(d -> !d.isBlank());
    }
}
