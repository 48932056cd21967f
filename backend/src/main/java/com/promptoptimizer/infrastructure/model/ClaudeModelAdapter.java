package com.promptoptimizer.infrastructure.model;

import com.promptoptimizer.domain.optimization.model.ModelProfile;
import com.promptoptimizer.domain.optimization.model.OptimizationSuggestions.Severity;
import com.promptoptimizer.domain.optimization.model.OptimizationSuggestions.Suggestion;
import com.promptoptimizer.domain.optimization.model.SuggestionType;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Adapter for Anthropic Claude models.
 * <p>
 * There is no public Claude tokenizer, so every count is a heuristic estimate.
 * Custom profile params:
 * <ul>
 *   <li>{@code use_xml_tags} - wrap recognizable sections in XML-like tags</li>
 *   <li>{@code encourage_reasoning} - append a step-by-step nudge to analytic prompts</li>
 * </ul>
 */
public class ClaudeModelAdapter extends AbstractModelAdapter {

    public static final String USE_XML_TAGS = "use_xml_tags";
    public static final String ENCOURAGE_REASONING = "encourage_reasoning";

    private static final List<Pattern> IMPERATIVE_REWRITES = List.of(
            Pattern.compile("\\bI need you to\\s*", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bCan you\\s*", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bCould you\\s*", Pattern.CASE_INSENSITIVE)
    );
    private static final Pattern XML_TAG = Pattern.compile("<[^>]+>");
    private static final Pattern STEP_BY_STEP = Pattern.compile("step[- ]by[- ]step", Pattern.CASE_INSENSITIVE);

    private static final List<String> ANALYSIS_KEYWORDS = List.of(
            "analyze", "explain", "reasoning", "why", "analizza", "spiega", "ragionamento", "perché");

    private static final int LONG_PROMPT_TOKENS = 150_000;
    private static final int SHORT_PROMPT_TOKENS = 10_000;

    public ClaudeModelAdapter(String modelName) {
        this(ModelProfileCatalog.lookup(ModelFamily.CLAUDE, modelName));
    }

    public ClaudeModelAdapter(ModelProfile profile) {
        super(profile, HeuristicTokenEstimator.claude());
    }

    @Override
    public boolean isExactTokenizer() {
        return false;
    }

    @Override
    public String optimizeForModel(String prompt) {
        String optimized = removeCourtesyPreamble(prompt);
        for (Pattern rewrite : IMPERATIVE_REWRITES) {
            optimized = rewrite.matcher(optimized).replaceAll("");
        }

        optimized = addStructuralTags(optimized);

        if (profile.customFlag(ENCOURAGE_REASONING)
                && hasAnalysisKeyword(prompt)
                && !STEP_BY_STEP.matcher(prompt).find()) {
            optimized = optimized.stripTrailing() + "\n\nThink step by step.";
        }

        return tidySpacing(optimized).strip();
    }

    private String addStructuralTags(String prompt) {
        if (!profile.customFlag(USE_XML_TAGS) || XML_TAG.matcher(prompt).find()) {
            return prompt;
        }
        String[] sections = prompt.split("\n\n");
        if (sections.length <= 2) {
            return prompt;
        }

        List<String> tagged = new ArrayList<>();
        for (int i = 0; i < sections.length; i++) {
            String section = sections[i].strip();
            if (section.isEmpty()) {
                continue;
            }
            String lower = section.toLowerCase(Locale.ROOT);
            if (i == 0 || lower.contains("context") || lower.contains("background")) {
                tagged.add("<context>\n" + section + "\n</context>");
            } else if (lower.contains("example") || lower.contains("instance")) {
                tagged.add("<example>\n" + section + "\n</example>");
            } else if (lower.contains("instruction") || lower.contains("task")) {
                tagged.add("<instruction>\n" + section + "\n</instruction>");
            } else {
                tagged.add(section);
            }
        }
        return String.join("\n\n", tagged);
    }

    @Override
    protected void addModelSuggestions(String text, int tokenCount, List<Suggestion> suggestions) {
        if (tokenCount > LONG_PROMPT_TOKENS) {
            suggestions.add(new Suggestion(SuggestionType.CONTEXT_WARNING,
                    "Very long prompt. Even with a 200K context, consider splitting it for better performance",
                    Severity.MEDIUM));
        }

        if (text.split("\n\n").length > 3 && !XML_TAG.matcher(text).find()) {
            suggestions.add(new Suggestion(SuggestionType.FORMAT_OPTIMIZATION,
                    "Consider XML tags to structure the prompt (e.g. <context>, <instruction>, <example>)",
                    Severity.LOW));
        }

        if ("claude-3-opus".equals(profile.modelName()) && tokenCount < SHORT_PROMPT_TOKENS) {
            suggestions.add(new Suggestion(SuggestionType.COST_OPTIMIZATION,
                    "For short prompts consider claude-3-sonnet or claude-3-haiku to cut costs significantly",
                    Severity.MEDIUM));
        }

        if (hasAnalysisKeyword(text) && !STEP_BY_STEP.matcher(text).find()) {
            suggestions.add(new Suggestion(SuggestionType.EFFECTIVENESS_TIP,
                    "Analytic tasks work better with an explicit \"think step by step\" instruction",
                    Severity.LOW));
        }
    }

    private static boolean hasAnalysisKeyword(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        return ANALYSIS_KEYWORDS.stream().anyMatch(lower::contains);
    }
}
