package com.promptoptimizer.infrastructure.model;

import com.promptoptimizer.domain.optimization.model.ModelInfo;
import com.promptoptimizer.domain.optimization.model.OptimizationSuggestions;
import com.promptoptimizer.domain.optimization.model.OptimizationSuggestions.Severity;
import com.promptoptimizer.domain.optimization.model.SuggestionType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class OpenAiModelAdapterTest {

    private final OpenAiModelAdapter gpt35 = new OpenAiModelAdapter("gpt-3.5-turbo");
    private final OpenAiModelAdapter gpt4 = new OpenAiModelAdapter("gpt-4");

    @Nested
    @DisplayName("token counting")
    class CountTokens {

        @Test
        @DisplayName("uses the exact BPE encoding")
        void exactEncoding() {
            assertThat(gpt35.isExactTokenizer()).isTrue();
            assertThat(gpt35.countTokens("Hello world")).isEqualTo(2);
        }

        @Test
        @DisplayName("empty text is 0, whitespace-only text is 1")
        void edgeCases() {
            assertThat(gpt35.countTokens("")).isZero();
            assertThat(gpt35.countTokens("   \n ")).isEqualTo(1);
        }

        @Test
        @DisplayName("whitespace runs do not change the count")
        void whitespaceNormalised() {
            assertThat(gpt35.countTokens("Hello   \n\n world")).isEqualTo(gpt35.countTokens("Hello world"));
        }

        @Test
        @DisplayName("reserved special tokens in the text do not break counting")
        void specialTokensInText() {
            assertThat(gpt35.countTokens("<|endoftext|> summarize")).isPositive();
        }

        @Test
        @DisplayName("each special token of the profile counts as one token")
        void specialTokensCountOnce() {
            assertThat(gpt35.getProfile().specialTokens()).containsEntry("endoftext", "<|endoftext|>");
            assertThat(gpt35.countTokens("<|endoftext|>")).isEqualTo(1);
            assertThat(gpt35.countTokens("<|endoftext|><|endofprompt|>")).isEqualTo(2);
            assertThat(gpt35.countTokens("Hello world<|endoftext|>")).isEqualTo(3);
        }
    }

    @Nested
    @DisplayName("pricing")
    class Pricing {

        @Test
        @DisplayName("cost of 1000 input and 500 output tokens on gpt-4")
        void calculateCost() {
            assertThat(gpt4.calculateCost(1000, 500)).isCloseTo(0.06, within(1e-9));
            assertThat(gpt4.calculateCost(1000)).isCloseTo(0.03, within(1e-9));
        }

        @Test
        @DisplayName("cost reduction uses the input price")
        void costReduction() {
            assertThat(gpt4.calculateCostReduction(1000)).isCloseTo(0.03, within(1e-9));
            assertThat(gpt35.calculateCostReduction(0)).isZero();
        }
    }

    @Test
    @DisplayName("context fit honours the reserve")
    void canFitInContext() {
        assertThat(gpt35.canFitInContext("Hello world")).isTrue();
        assertThat(gpt35.canFitInContext("Hello world", 4095)).isFalse();
        assertThat(gpt35.estimateContextUsage("Hello world")).isCloseTo(2.0 / 4096, within(1e-12));
    }

    @Nested
    @DisplayName("suggestOptimizations")
    class Suggestions {

        @Test
        @DisplayName("a short prompt gets no warnings")
        void shortPrompt() {
            OptimizationSuggestions suggestions = gpt35.suggestOptimizations("Summarize the report.");

            assertThat(suggestions.suggestions()).isEmpty();
            assertThat(suggestions.currentTokens()).isPositive();
        }

        @Test
        @DisplayName("a prompt filling most of the window gets a high context warning")
        void contextWarning() {
            OptimizationSuggestions suggestions = gpt35.suggestOptimizations("word ".repeat(4000));

            assertThat(suggestions.has(SuggestionType.CONTEXT_WARNING)).isTrue();
            assertThat(suggestions.suggestions())
                    .filteredOn(s -> s.type() == SuggestionType.CONTEXT_WARNING)
                    .allMatch(s -> s.severity() == Severity.HIGH);
            assertThat(suggestions.contextUsagePercent()).isGreaterThan(80.0);
        }

        @Test
        @DisplayName("an expensive prompt gets a cost hint")
        void costHint() {
            assertThat(gpt4.suggestOptimizations("word ".repeat(500)).has(SuggestionType.COST_OPTIMIZATION)).isTrue();
        }

        @Test
        @DisplayName("excessive courtesy gets a format hint")
        void courtesyHint() {
            OptimizationSuggestions suggestions = gpt35.suggestOptimizations(
                    "Please read this. Please summarize it. Please be brief.");

            assertThat(suggestions.has(SuggestionType.FORMAT_OPTIMIZATION)).isTrue();
        }
    }

    @Nested
    @DisplayName("optimizeForModel")
    class OptimizeForModel {

        @Test
        @DisplayName("drops the courtesy preamble and the space before punctuation")
        void courtesyPreamble() {
            assertThat(gpt35.optimizeForModel("Please could you summarize this text .")).isEqualTo("summarize this text.");
        }

        @Test
        @DisplayName("strips special tokens")
        void specialTokens() {
            assertThat(gpt35.optimizeForModel("<|endoftext|>Summarize this")).isEqualTo("Summarize this");
        }

        @Test
        @DisplayName("drops thanks and chat fillers for chat models")
        void chatFillers() {
            assertThat(gpt4.optimizeForModel("Summarize the logs if possible. Thanks in advance!"))
                    .isEqualTo("Summarize the logs.");
        }
    }

    @Test
    @DisplayName("unknown models resolve to the family default")
    void unknownModel() {
        OpenAiModelAdapter adapter = new OpenAiModelAdapter("gpt-unknown");
        ModelInfo info = adapter.getModelInfo();

        assertThat(info.modelName()).isEqualTo("gpt-3.5-turbo");
        assertThat(info.adapterType()).isEqualTo("OpenAiModelAdapter");
        assertThat(info.exactTokenizer()).isTrue();
    }
}
