package com.promptoptimizer.infrastructure.pipeline;

import com.promptoptimizer.domain.optimization.exception.InvalidPromptException;
import com.promptoptimizer.domain.optimization.model.OptimizationOptions;
import com.promptoptimizer.domain.optimization.model.OptimizationResult;
import com.promptoptimizer.domain.optimization.service.OptimizationStrategy;
import com.promptoptimizer.infrastructure.metrics.SemanticMetrics;
import com.promptoptimizer.infrastructure.metrics.TextSimilarity;
import com.promptoptimizer.infrastructure.model.OpenAiModelAdapter;
import com.promptoptimizer.infrastructure.strategy.SemanticCompressionStrategy;
import com.promptoptimizer.infrastructure.strategy.StructuralOptimizationStrategy;
import com.promptoptimizer.infrastructure.strategy.TokenReductionStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OptimizationPipelineTest {

    private static final String VERBOSE_PROMPT = """
            Please could you very kindly take the time to carefully analyze
            the following text and provide a very detailed explanation.
            """;

    private static final String REDUNDANT_PROMPT = """
            I would like to ask you to please analyze this.
            Please analyze this carefully.
            It's important to analyze this.
            """;

    private static final String FIVE_WORDS = "alpha beta gamma delta epsilon";
    private static final String FOUR_WORDS = "alpha beta gamma delta";

    @Mock
    private OptimizationStrategy first;

    @Mock
    private OptimizationStrategy second;

    private OptimizationPipeline pipeline;

    @BeforeEach
    void setUp() {
        pipeline = new OptimizationPipeline(new SemanticMetrics());
    }

    @Nested
    @DisplayName("with the built-in strategies")
    class BuiltInStrategies {

        private final OpenAiModelAdapter adapter = new OpenAiModelAdapter("gpt-3.5-turbo");

        private List<OptimizationStrategy> all() {
            return List.of(new SemanticCompressionStrategy(), new TokenReductionStrategy(),
                    new StructuralOptimizationStrategy());
        }

        @Test
        @DisplayName("a verbose prompt gets shorter without losing meaning")
        void verbosePrompt() {
            OptimizationResult result = pipeline.optimize(VERBOSE_PROMPT, adapter, all(), 0.85);

            assertThat(result.tokenReduction()).isPositive();
            assertThat(result.semanticSimilarity()).isGreaterThanOrEqualTo(0.85);
            assertThat(result.strategiesUsed()).contains("SemanticCompressionStrategy");
            assertThat(result.optimizedPrompt()).doesNotContain("very");
            assertThat(result.tokenReduction()).isEqualTo(result.originalTokens() - result.optimizedTokens());
            assertThat(result.reductionPercentage())
                    .isCloseTo((double) result.tokenReduction() / result.originalTokens(), within(1e-9));
            assertThat(result.costReduction())
                    .isCloseTo(adapter.calculateCostReduction(result.tokenReduction()), within(1e-12));
        }

        @Test
        @DisplayName("no two sentences of a redundant prompt stay near-identical")
        void redundantPrompt() {
            OptimizationResult result = pipeline.optimize(REDUNDANT_PROMPT, adapter, all(), 0.85);

            List<String> sentences = new ArrayList<>();
            for (String sentence : result.optimizedPrompt().split("[.!?\\n]+")) {
                if (!sentence.isBlank()) {
                    sentences.add(sentence.strip());
                }
            }
            for (int i = 0; i < sentences.size(); i++) {
                for (int j = i + 1; j < sentences.size(); j++) {
                    assertThat(TextSimilarity.jaccard(sentences.get(i), sentences.get(j))).isLessThanOrEqualTo(0.8);
                }
            }
            assertThat(result.semanticSimilarity()).isGreaterThanOrEqualTo(0.85);
        }

        @Test
        @DisplayName("threshold 1.0 only accepts outputs with identical term weights")
        void strictThreshold() {
            OptimizationResult result = pipeline.optimize(VERBOSE_PROMPT, adapter, all(), 1.0);

            assertThat(result.semanticSimilarity()).isGreaterThanOrEqualTo(1.0 - 1e-9);
        }
    }

    @Test
    @DisplayName("an empty strategy list leaves the prompt unchanged")
    void noStrategies() {
        OptimizationResult result = pipeline.optimize(FIVE_WORDS, null, List.of(), 0.85);

        assertThat(result.optimizedPrompt()).isEqualTo(FIVE_WORDS);
        assertThat(result.tokenReduction()).isZero();
        assertThat(result.strategiesUsed()).isEmpty();
        assertThat(result.semanticSimilarity()).isEqualTo(1.0);
        assertThat(result.wasOptimized()).isFalse();
    }

    @Test
    @DisplayName("a strategy that cannot apply is skipped without running")
    void skippedStrategy() {
        when(first.getName()).thenReturn("Skipped");
        when(first.canApply(anyString())).thenReturn(false);

        OptimizationResult result = pipeline.optimize(FIVE_WORDS, null, List.of(first), 0.85);

        verify(first, never()).apply(anyString());
        assertThat(result.metadata()).containsEntry("strategies_skipped", List.of("Skipped"));
        assertThat(result.optimizedPrompt()).isEqualTo(FIVE_WORDS);
    }

    @Test
    @DisplayName("a failing strategy is recorded and the run continues")
    void failingStrategy() {
        when(first.getName()).thenReturn("Broken");
        when(first.canApply(anyString())).thenReturn(true);
        when(first.apply(anyString())).thenThrow(new IllegalStateException("boom"));
        when(second.getName()).thenReturn("Shortener");
        when(second.canApply(anyString())).thenReturn(true);
        when(second.apply(FIVE_WORDS)).thenReturn(FOUR_WORDS);

        OptimizationResult result = pipeline.optimize(FIVE_WORDS, null, List.of(first, second), 0.5);

        assertThat(result.metadata()).containsEntry("strategies_failed", List.of("Broken"));
        assertThat(result.strategiesUsed()).containsExactly("Shortener");
        assertThat(result.optimizedPrompt()).isEqualTo(FOUR_WORDS);
    }

    @Test
    @DisplayName("a strategy throwing from its applicability check is recorded as failed and the run continues")
    void failingApplicabilityCheck() {
        when(first.getName()).thenReturn("Unstable");
        when(first.canApply(anyString())).thenThrow(new IllegalArgumentException("bad pattern"));
        when(second.getName()).thenReturn("Shortener");
        when(second.canApply(anyString())).thenReturn(true);
        when(second.apply(FIVE_WORDS)).thenReturn(FOUR_WORDS);

        OptimizationResult result = pipeline.optimize(FIVE_WORDS, null, List.of(first, second), 0.5);

        assertThat(result.metadata()).containsEntry("strategies_failed", List.of("Unstable"));
        assertThat(result.strategiesUsed()).containsExactly("Shortener");
        assertThat(result.optimizedPrompt()).isEqualTo(FOUR_WORDS);
        verify(first, never()).apply(anyString());
    }

    @Test
    @DisplayName("an output that drifts in meaning is rejected")
    void rejectedStrategy() {
        when(first.getName()).thenReturn("Drifter");
        when(first.canApply(anyString())).thenReturn(true);
        when(first.apply(anyString())).thenReturn("zebra giraffe");

        OptimizationResult result = pipeline.optimize(FIVE_WORDS, null, List.of(first), 0.85);

        assertThat(result.optimizedPrompt()).isEqualTo(FIVE_WORDS);
        assertThat(result.strategiesUsed()).isEmpty();
        assertThat(result.metadata()).containsEntry("strategies_rejected", List.of("Drifter"));
    }

    @Test
    @DisplayName("without an adapter tokens are words and cost uses the fallback rate")
    void noAdapter() {
        when(first.getName()).thenReturn("Shortener");
        when(first.canApply(anyString())).thenReturn(true);
        when(first.apply(FIVE_WORDS)).thenReturn(FOUR_WORDS);

        OptimizationResult result = pipeline.optimize(FIVE_WORDS, null, List.of(first), 0.5);

        assertThat(result.originalTokens()).isEqualTo(5);
        assertThat(result.optimizedTokens()).isEqualTo(4);
        assertThat(result.costReduction()).isCloseTo(OptimizationPipeline.FALLBACK_COST_PER_TOKEN, within(1e-15));
        assertThat(result.semanticSimilarity()).isBetween(0.5, 1.0);
    }

    @Test
    @DisplayName("remaining strategies are skipped once the target reduction is reached")
    void targetReduction() {
        when(first.getName()).thenReturn("Shortener");
        when(first.canApply(anyString())).thenReturn(true);
        when(first.apply(FIVE_WORDS)).thenReturn(FOUR_WORDS);

        OptimizationResult result = pipeline.optimize(FIVE_WORDS, null, List.of(first, second), 0.5,
                new OptimizationOptions(0.1, null));

        verifyNoInteractions(second);
        assertThat(result.metadata())
                .containsEntry("target_reduction", 0.1)
                .containsEntry("target_reached", true);
    }

    @Test
    @DisplayName("strategy names in the options filter the list")
    void strategyNameFilter() {
        when(first.getName()).thenReturn("KeepMe");
        when(first.canApply(anyString())).thenReturn(false);
        when(second.getName()).thenReturn("DropMe");

        pipeline.optimize(FIVE_WORDS, null, List.of(first, second), 0.5,
                new OptimizationOptions(null, List.of("keepme")));

        verify(second, never()).canApply(anyString());
    }

    @Test
    @DisplayName("invalid input is rejected")
    void invalidInput() {
        assertThatThrownBy(() -> pipeline.optimize(null, null, List.of(), 0.5))
                .isInstanceOf(InvalidPromptException.class);
        assertThatThrownBy(() -> pipeline.optimize(FIVE_WORDS, null, List.of(), 1.5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> pipeline.optimize(FIVE_WORDS, null, List.of(), Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("batch results keep the input order")
    void batchOrder() {
        List<OptimizationResult> results = pipeline.batchOptimize(
                List.of("first prompt text", "second prompt text"), null, List.of(), 0.85, null);

        assertThat(results).extracting(OptimizationResult::originalPrompt)
                .containsExactly("first prompt text", "second prompt text");
    }
}
