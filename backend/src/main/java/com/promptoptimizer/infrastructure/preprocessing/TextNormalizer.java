package com.promptoptimizer.infrastructure.preprocessing;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Whitespace and punctuation clean-up shared by the strategies:
 * - Unicode NFC normalization
 * - Invisible/control character removal
 * - Whitespace normalization, either keeping line structure or collapsing it
 */
@Component
public class TextNormalizer {

    // Zero-width and invisible Unicode characters
    private static final Pattern INVISIBLE_CHARS = Pattern.compile(
            "[\\u200B\\u200C\\u200D\\uFEFF\\u00AD\\u2060\\u180E]"
    );

    // Control characters except common whitespace (\n, \r, \t)
    private static final Pattern CONTROL_CHARS = Pattern.compile(
            "[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]"
    );

    // Consecutive spaces (not newlines) → single space
    private static final Pattern MULTIPLE_SPACES = Pattern.compile("[ \\t]{2,}");

    // Spaces hugging a newline (indentation, trailing blanks)
    private static final Pattern LINE_EDGE_SPACES = Pattern.compile("[ \\t]*\\n[ \\t]*");

    // 3+ consecutive newlines → 2 newlines
    private static final Pattern EXCESSIVE_NEWLINES = Pattern.compile("\\n{3,}");

    private static final Pattern ANY_WHITESPACE = Pattern.compile("\\s+");

    private static final Pattern SPACE_BEFORE_PUNCTUATION = Pattern.compile("[ \\t]+([,.;:!?])");
    private static final Pattern MISSING_SPACE_AFTER_COMMA = Pattern.compile("([,;])(?=[^\\s\\d])");
    private static final Pattern REPEATED_PERIODS = Pattern.compile("\\.{2,}");
    private static final Pattern REPEATED_COMMAS = Pattern.compile(",{2,}");
    private static final Pattern COMMA_BEFORE_PERIOD = Pattern.compile(",\\s*\\.");

    /**
     * Normalize the text while keeping its line structure.
     *
     * @param text raw prompt text
     * @return normalized text, or the input itself if null/empty
     */
    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }

        // 1. Unicode NFC normalization
        String result = Normalizer.normalize(text, Normalizer.Form.NFC);

        // 2. Remove invisible characters
        result = INVISIBLE_CHARS.matcher(result).replaceAll("");

        // 3. Remove control characters (except \n, \r, \t)
        result = CONTROL_CHARS.matcher(result).replaceAll("");

        // 4. Normalize \r\n to \n
        result = result.replace("\r\n", "\n").replace("\r", "\n");

        // 5. Collapse multiple spaces/tabs to single space
        result = MULTIPLE_SPACES.matcher(result).replaceAll(" ");

        // 6. Drop indentation and trailing blanks around line breaks
        result = LINE_EDGE_SPACES.matcher(result).replaceAll("\n");

        // 7. Collapse 3+ newlines to 2
        result = EXCESSIVE_NEWLINES.matcher(result).replaceAll("\n\n");

        // 8. Trim
        return result.strip();
    }

    /**
     * Normalize, then either keep line breaks ({@code preserveStructure}) or collapse
     * every whitespace run to a single space.
     */
    public String compact(String text, boolean preserveStructure) {
        String normalized = normalize(text);
        if (normalized == null || normalized.isEmpty() || preserveStructure) {
            return normalized;
        }
        return ANY_WHITESPACE.matcher(normalized).replaceAll(" ").strip();
    }

    /**
     * Tidy punctuation left behind by word removal: no space before punctuation,
     * one space after commas/semicolons, no repeated periods or commas.
     */
    public String tidyPunctuation(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String result = SPACE_BEFORE_PUNCTUATION.matcher(text).replaceAll("$1");
        result = REPEATED_PERIODS.matcher(result).replaceAll(".");
        result = REPEATED_COMMAS.matcher(result).replaceAll(",");
        result = COMMA_BEFORE_PERIOD.matcher(result).replaceAll(".");
        result = MISSING_SPACE_AFTER_COMMA.matcher(result).replaceAll("$1 ");
        return result;
    }
}
