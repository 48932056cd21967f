package com.promptoptimizer.infrastructure.strategy;

import com.promptoptimizer.domain.optimization.model.OptimizationConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TokenReductionStrategyTest {

    private TokenReductionStrategy strategy;

    @BeforeEach
    void setUp() {
        strategy = new TokenReductionStrategy();
    }

    private static TokenReductionStrategy without(String... passes) {
        OptimizationConfig config = OptimizationConfig.defaults();
        for (String pass : passes) {
            config = config.withParam(pass, false);
        }
        return new TokenReductionStrategy(config);
    }

    @Test
    @DisplayName("verbose prompt loses articles and gains symbols")
    void verbosePrompt() {
        String prompt = """
                Please could you very kindly take the time to carefully analyze
                the following text and provide a very detailed explanation.
                """;

        assertThat(strategy.apply(prompt)).isEqualTo(
                "Please could you very kindly take time to carefully analyze\n"
                        + "following text & provide very detailed explanation.");
    }

    @Nested
    @DisplayName("individual passes")
    class Passes {

        @Test
        @DisplayName("long words are abbreviated")
        void abbreviations() {
            assertThat(without(TokenReductionStrategy.ELISION).apply("Update the configuration in the database"))
                    .isEqualTo("Update the config in the db");
        }

        @Test
        @DisplayName("negations and pronoun phrases are contracted")
        void contractions() {
            assertThat(without(TokenReductionStrategy.ELISION).apply("You do not need it and it is fine"))
                    .isEqualTo("You don't need it & it's fine");
        }

        @Test
        @DisplayName("symbol replacements are inserted literally")
        void symbols() {
            assertThat(without(TokenReductionStrategy.ELISION).apply("Cost in dollar terms"))
                    .isEqualTo("Cost in $ terms");
        }

        @Test
        @DisplayName("number words become digits and percent becomes %")
        void numbers() {
            assertThat(without(TokenReductionStrategy.ELISION, TokenReductionStrategy.SYMBOLS)
                    .apply("Pick three items and twenty percent of them"))
                    .isEqualTo("Pick 3 items and 20% of them");
        }

        @Test
        @DisplayName("spelled-out dates become numeric")
        void dates() {
            assertThat(without(TokenReductionStrategy.ELISION).apply("Deadline is March 5, 2024"))
                    .isEqualTo("Deadline is 3/5/2024");
        }
    }

    @Nested
    @DisplayName("elision")
    class Elision {

        @Test
        @DisplayName("fixed expressions keep their function words")
        void fixedExpressions() {
            assertThat(strategy.apply("This is the most important part")).isEqualTo("This is the most important part");
            assertThat(strategy.apply("We have a lot of data")).isEqualTo("We have a lot of data");
        }

        @Test
        @DisplayName("the first word is never removed")
        void firstWord() {
            assertThat(strategy.apply("The report is late")).isEqualTo("The report is late");
        }

        @Test
        @DisplayName("conjunctions are removed only in aggressive mode")
        void aggressiveConjunctions() {
            TokenReductionStrategy aggressive = new TokenReductionStrategy(
                    OptimizationConfig.defaults().withAggressiveMode(true));

            assertThat(strategy.apply("Use red or blue markers")).isEqualTo("Use red or blue markers");
            assertThat(aggressive.apply("Use red or blue markers")).isEqualTo("Use red blue markers");
        }
    }

    @Test
    @DisplayName("nothing to reduce means not applicable")
    void canApply() {
        assertThat(strategy.canApply("Hi")).isFalse();
        assertThat(strategy.canApply("xyz qqq zzz")).isFalse();
        assertThat(strategy.canApply("Read the information")).isTrue();
    }

    @Test
    @DisplayName("the estimate is capped")
    void estimateCapped() {
        assertThat(strategy.estimateReduction("the a an of in on at by the a an of")).isEqualTo(0.35);
        assertThat(strategy.estimateReduction("xyz qqq zzz")).isZero();
    }
}
