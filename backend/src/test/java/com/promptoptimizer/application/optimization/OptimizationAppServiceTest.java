package com.promptoptimizer.application.optimization;

import com.promptoptimizer.application.optimization.exception.BatchTooLargeException;
import com.promptoptimizer.application.optimization.exception.PromptTooLongException;
import com.promptoptimizer.domain.optimization.exception.InvalidPromptException;
import com.promptoptimizer.domain.optimization.exception.UnknownStrategyException;
import com.promptoptimizer.domain.optimization.model.OptimizationResult;
import com.promptoptimizer.infrastructure.metrics.SemanticMetrics;
import com.promptoptimizer.infrastructure.model.ModelAdapterFactory;
import com.promptoptimizer.infrastructure.pipeline.OptimizationPipeline;
import com.promptoptimizer.infrastructure.preprocessing.TextNormalizer;
import com.promptoptimizer.infrastructure.strategy.StrategyRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OptimizationAppServiceTest {

    private static final String VERBOSE_PROMPT =
            "Please could you very kindly take the time to carefully analyze the following text "
                    + "and provide a very detailed explanation.";

    private ExecutorService executor;
    private OptimizationAppService service;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        service = new OptimizationAppService(
                new OptimizationPipeline(new SemanticMetrics()),
                new ModelAdapterFactory(),
                new StrategyRegistry(new TextNormalizer()),
                executor);
        ReflectionTestUtils.setField(service, "defaultModel", "gpt-3.5-turbo");
        ReflectionTestUtils.setField(service, "defaultThreshold", 0.85);
        ReflectionTestUtils.setField(service, "maxPromptLength", 500);
        ReflectionTestUtils.setField(service, "maxBatchSize", 3);
        ReflectionTestUtils.setField(service, "defaultStrategies", "semantic, token, structural");
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Nested
    @DisplayName("optimize")
    class Optimize {

        @Test
        @DisplayName("defaults apply when no options are given")
        void defaults() {
            OptimizationResult result = service.optimize(VERBOSE_PROMPT, null, null, null, null, null, null);

            assertThat(result.metadata()).containsEntry("model", "gpt-3.5-turbo");
            assertThat(result.tokenReduction()).isPositive();
            assertThat(result.semanticSimilarity()).isGreaterThanOrEqualTo(0.85);
        }

        @Test
        @DisplayName("only the requested strategies run")
        void requestedStrategies() {
            OptimizationResult result = service.optimize(
                    VERBOSE_PROMPT, "claude-3-haiku", List.of("semantic"), 0.8, false, false, null);

            assertThat(result.strategiesUsed()).containsExactly("SemanticCompressionStrategy");
            assertThat(result.metadata()).containsEntry("model", "claude-3-haiku");
        }

        @Test
        @DisplayName("blank and oversized prompts are rejected")
        void invalidPrompts() {
            assertThatThrownBy(() -> service.optimize("  ", null, null, null, null, null, null))
                    .isInstanceOf(InvalidPromptException.class);
            assertThatThrownBy(() -> service.optimize("x".repeat(501), null, null, null, null, null, null))
                    .isInstanceOf(PromptTooLongException.class);
        }

        @Test
        @DisplayName("unknown strategy names are rejected")
        void unknownStrategy() {
            assertThatThrownBy(() -> service.optimize(VERBOSE_PROMPT, null, List.of("magic"), null, null, null, null))
                    .isInstanceOf(UnknownStrategyException.class);
        }

        @Test
        @DisplayName("the target reduction is reported")
        void targetReduction() {
            OptimizationResult result = service.optimize(VERBOSE_PROMPT, null, null, null, null, null, 0.05);

            assertThat(result.metadata()).containsEntry("target_reduction", 0.05).containsKey("target_reached");
        }
    }

    @Nested
    @DisplayName("batchOptimize")
    class BatchOptimize {

        @Test
        @DisplayName("one result per prompt, in input order, each above the similarity threshold")
        void order() {
            List<OptimizationResult> results = service.batchOptimize(
                    List.of(VERBOSE_PROMPT, "Summarize the incident report in order to brief the team."),
                    null, null, null, null, null, null);

            assertThat(results).hasSize(2);
            assertThat(results.get(0).originalPrompt()).isEqualTo(VERBOSE_PROMPT);
            assertThat(results.get(1).originalPrompt()).startsWith("Summarize the incident report");
            assertThat(results.get(0).strategiesUsed()).isNotEmpty();
            assertThat(results)
                    .filteredOn(result -> !result.strategiesUsed().isEmpty())
                    .allSatisfy(result -> assertThat(result.semanticSimilarity()).isGreaterThanOrEqualTo(0.85));
        }

        @Test
        @DisplayName("a stricter threshold holds for every item that changed")
        void strictThreshold() {
            List<OptimizationResult> results = service.batchOptimize(
                    List.of(VERBOSE_PROMPT, "Summarize the incident report in order to brief the team."),
                    null, null, 0.95, null, null, null);

            assertThat(results)
                    .filteredOn(result -> !result.strategiesUsed().isEmpty())
                    .allSatisfy(result -> assertThat(result.semanticSimilarity()).isGreaterThanOrEqualTo(0.95));
        }

        @Test
        @DisplayName("an empty batch gives an empty result")
        void empty() {
            assertThat(service.batchOptimize(List.of(), null, null, null, null, null, null)).isEmpty();
        }

        @Test
        @DisplayName("oversized batches and invalid members are rejected up front")
        void invalidBatches() {
            List<String> tooMany = Collections.nCopies(4, VERBOSE_PROMPT);

            assertThatThrownBy(() -> service.batchOptimize(tooMany, null, null, null, null, null, null))
                    .isInstanceOf(BatchTooLargeException.class);
            assertThatThrownBy(() -> service.batchOptimize(List.of(VERBOSE_PROMPT, " "), null, null, null, null, null, null))
                    .isInstanceOf(InvalidPromptException.class);
        }

        @Test
        @DisplayName("a pipeline error is rethrown unwrapped")
        void invalidThreshold() {
            assertThatThrownBy(() -> service.batchOptimize(List.of(VERBOSE_PROMPT), null, null, 2.0, null, null, null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("configured default strategies are parsed in order")
    void defaultStrategyNames() {
        assertThat(service.defaultStrategyNames()).containsExactly("semantic", "token", "structural");
        assertThat(service.availableStrategies()).hasSize(3);
    }
}
