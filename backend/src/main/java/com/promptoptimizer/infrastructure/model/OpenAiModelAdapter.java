package com.promptoptimizer.infrastructure.model;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.promptoptimizer.domain.optimization.model.ModelProfile;
import com.promptoptimizer.domain.optimization.model.OptimizationSuggestions.Severity;
import com.promptoptimizer.domain.optimization.model.OptimizationSuggestions.Suggestion;
import com.promptoptimizer.domain.optimization.model.SuggestionType;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Adapter for OpenAI GPT models. Counts tokens with the model's BPE encoding via jtokkit
 * and falls back to the heuristic estimate if the encoding is unavailable.
 */
@Slf4j
public class OpenAiModelAdapter extends AbstractModelAdapter {

    private static final String DEFAULT_ENCODING = "cl100k_base";

    // Lazy: encodings are loaded from the jtokkit jar on first use
    private static final EncodingRegistry REGISTRY = Encodings.newLazyEncodingRegistry();

    private static final Pattern SPECIAL_TOKEN = Pattern.compile("<\\|.*?\\|>");
    private static final Pattern SPACE_BEFORE_PUNCTUATION = Pattern.compile("\\s+([,.!?;:])");
    private static final Pattern SPLIT_CONTRACTION = Pattern.compile("\\s+'\\s*([st])\\b");
    private static final Pattern THANKS = Pattern.compile("\\b(thank you|thanks)\\b.*?[.!]\\s*", Pattern.CASE_INSENSITIVE);
    private static final List<Pattern> CHAT_FILLERS = List.of(
            Pattern.compile("\\bcould you please\\s*", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bwould you mind\\s*", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bif possible\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bI would appreciate if\\s*", Pattern.CASE_INSENSITIVE)
    );
    private static final Pattern PLEASE = Pattern.compile("\\bplease\\b", Pattern.CASE_INSENSITIVE);

    private final Encoding encoding;

    public OpenAiModelAdapter(String modelName) {
        this(ModelProfileCatalog.lookup(ModelFamily.OPENAI, modelName));
    }

    public OpenAiModelAdapter(ModelProfile profile) {
        super(profile, HeuristicTokenEstimator.openAi());
        this.encoding = initializeEncoding(profile.tokenizerName());
    }

    private static Encoding initializeEncoding(String tokenizerName) {
        String name = tokenizerName != null ? tokenizerName : DEFAULT_ENCODING;
        try {
            Encoding resolved = REGISTRY.getEncoding(name).orElse(null);
            if (resolved == null) {
                log.warn("Encoding '{}' not available, token counts will be estimated", name);
            }
            return resolved;
        } catch (RuntimeException e) {
            log.warn("Failed to initialize encoding '{}', token counts will be estimated: {}", name, e.getMessage());
            return null;
        }
    }

    @Override
    protected int countCleanedTokens(String cleaned) {
        if (encoding != null) {
            try {
                return countWithSpecialTokens(cleaned);
            } catch (RuntimeException e) {
                log.debug("Exact token count failed, using estimate: {}", e.getMessage());
            }
        }
        return estimateTokens(cleaned);
    }

    /**
     * Each special token of the profile counts as one token; the rest is encoded as ordinary text.
     */
    private int countWithSpecialTokens(String text) {
        int special = 0;
        String ordinary = text;
        for (String token : profile.specialTokens().values()) {
            if (token.isEmpty()) {
                continue;
            }
            int at = ordinary.indexOf(token);
            while (at >= 0) {
                special++;
                ordinary = ordinary.substring(0, at) + ordinary.substring(at + token.length());
                at = ordinary.indexOf(token, at);
            }
        }
        return special + encoding.countTokensOrdinary(ordinary);
    }

    @Override
    public boolean isExactTokenizer() {
        return encoding != null;
    }

    @Override
    public String optimizeForModel(String prompt) {
        String optimized = removeCourtesyPreamble(prompt);
        optimized = optimizeForChatFormat(optimized);
        optimized = SPECIAL_TOKEN.matcher(optimized).replaceAll("");
        optimized = SPACE_BEFORE_PUNCTUATION.matcher(optimized).replaceAll("$1");
        optimized = SPLIT_CONTRACTION.matcher(optimized).replaceAll("'$1");
        optimized = tidySpacing(optimized);
        return joinSections(optimized).strip();
    }

    private String optimizeForChatFormat(String prompt) {
        if (!isChatModel()) {
            return prompt;
        }
        String result = THANKS.matcher(prompt).replaceAll("");
        for (Pattern filler : CHAT_FILLERS) {
            result = filler.matcher(result).replaceAll("");
        }
        return result;
    }

    private boolean isChatModel() {
        String name = profile.modelName();
        return name.startsWith("gpt-3.5-turbo") || name.startsWith("gpt-4");
    }

    private static String joinSections(String prompt) {
        if (!prompt.contains("\n\n")) {
            return prompt;
        }
        StringBuilder sb = new StringBuilder();
        for (String section : prompt.split("\n\n")) {
            String trimmed = section.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append("\n\n");
            }
            sb.append(trimmed);
        }
        return sb.toString();
    }

    @Override
    protected void addModelSuggestions(String text, int tokenCount, List<Suggestion> suggestions) {
        String model = profile.modelName();

        if ("gpt-4".equals(model) && tokenCount > 6000) {
            suggestions.add(new Suggestion(SuggestionType.MODEL_RECOMMENDATION,
                    "Consider gpt-4-turbo for long prompts to reduce costs",
                    Severity.MEDIUM));
        }

        if ("gpt-3.5-turbo".equals(model) && tokenCount > 3000) {
            suggestions.add(new Suggestion(SuggestionType.CONTEXT_WARNING,
                    "Prompt is close to the gpt-3.5-turbo limit. Consider gpt-3.5-turbo-16k",
                    Severity.HIGH));
        }

        if (countMatches(PLEASE, text) > 2) {
            suggestions.add(new Suggestion(SuggestionType.FORMAT_OPTIMIZATION,
                    "Reduce excessive courtesy (\"please\") for a more efficient prompt",
                    Severity.LOW));
        }
    }

    private static int countMatches(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        int n = 0;
        while (matcher.find()) {
            n++;
        }
        return n;
    }
}
