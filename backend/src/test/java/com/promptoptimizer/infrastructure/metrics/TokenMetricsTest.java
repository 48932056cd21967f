package com.promptoptimizer.infrastructure.metrics;

import com.promptoptimizer.domain.optimization.model.TokenAnalysis;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TokenMetricsTest {

    private final TokenMetrics metrics = new TokenMetrics();

    @Nested
    @DisplayName("analyzeTokens")
    class AnalyzeTokens {

        @Test
        @DisplayName("counts lower-cased words without punctuation")
        void basicCounts() {
            TokenAnalysis analysis = metrics.analyzeTokens("The cat and the dog.");

            assertThat(analysis.totalTokens()).isEqualTo(5);
            assertThat(analysis.uniqueTokens()).isEqualTo(4);
            assertThat(analysis.averageTokenLength()).isCloseTo(3.0, within(1e-9));
            assertThat(analysis.redundancyScore()).isCloseTo(0.2, within(1e-9));
            assertThat(analysis.tokenDistribution()).containsEntry("the", 2).containsEntry("dog", 1);
        }

        @Test
        @DisplayName("single-character tokens are ignored")
        void dropsSingleCharacters() {
            assertThat(metrics.analyzeTokens("a b cc").totalTokens()).isEqualTo(1);
        }

        @Test
        @DisplayName("empty text has zero tokens and zero redundancy")
        void emptyText() {
            TokenAnalysis analysis = metrics.analyzeTokens("");

            assertThat(analysis.totalTokens()).isZero();
            assertThat(analysis.redundancyScore()).isZero();
            assertThat(analysis.averageTokenLength()).isZero();
        }
    }

    @Test
    @DisplayName("reduction potential stays within [0, 1]")
    void reductionPotentialBounded() {
        String repetitive = "Analyze this. Analyze this. Analyze this very very carefully.";

        assertThat(metrics.calculateReductionPotential(repetitive)).isBetween(0.0, 1.0);
        assertThat(metrics.calculateReductionPotential("")).isBetween(0.0, 1.0);
    }

    @Test
    @DisplayName("repetitive text scores higher than varied text")
    void repetitiveTextScoresHigher() {
        double repetitive = metrics.calculateReductionPotential("Check the logs. Check the logs. Check the logs.");
        double varied = metrics.calculateReductionPotential("Deploy services. Rotate credentials. Archive backups.");

        assertThat(repetitive).isGreaterThan(varied);
    }

    @Test
    @DisplayName("quick estimates per model family")
    void estimateTokenCount() {
        assertThat(metrics.estimateTokenCount("abcdefgh", "gpt")).isEqualTo(2);
        assertThat(metrics.estimateTokenCount("abcdefgh", "claude")).isEqualTo(2);
        assertThat(metrics.estimateTokenCount("abcdefg", "llama")).isEqualTo(2);
        assertThat(metrics.estimateTokenCount("three words here", "other")).isEqualTo(3);
        assertThat(metrics.estimateTokenCount("", "gpt")).isZero();
    }
}
