package com.promptoptimizer.infrastructure.strategy;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Decides whether a removable word must stay because of its neighbours.
 * <p>
 * The word at {@code index} is protected when any pattern matches the lower-cased window of
 * {@code before} words, the word itself and {@code after} words. The pattern list is the
 * extension point: strategies accept a custom guard through their constructor.
 */
public class ContextPatternGuard {

    private final List<Pattern> patterns;
    private final int before;
    private final int after;

    public ContextPatternGuard(List<Pattern> patterns, int before, int after) {
        this.patterns = List.copyOf(patterns);
        this.before = before;
        this.after = after;
    }

    /**
     * Emphasis that carries meaning ("very important", "really need", ...).
     */
    public static ContextPatternGuard emphasis() {
        return new ContextPatternGuard(List.of(
                Pattern.compile("\\b(very|really|extremely|absolutely)\\s+(important|necessary|critical|essential)\\b"),
                Pattern.compile("\\breally\\s+need"),
                Pattern.compile("\\bactually\\s+means?\\b"),
                Pattern.compile("\\bmolto\\s+important[ei]\\b"),
                Pattern.compile("\\bdavvero\\s+necessari[oa]\\b"),
                Pattern.compile("\\beffettivamente\\s+significa\\b")
        ), 2, 2);
    }

    /**
     * Function words that are part of a fixed expression ("the most", "a lot", "an example").
     */
    public static ContextPatternGuard fixedExpressions() {
        return new ContextPatternGuard(List.of(
                Pattern.compile("\\bthe\\s+(most|best|worst|first|last)\\b"),
                Pattern.compile("\\ba\\s+(lot|few|little)\\b"),
                Pattern.compile("\\ban\\s+(example|instance)\\b")
        ), 2, 2);
    }

    public boolean protects(List<String> words, int index) {
        int from = Math.max(0, index - before);
        int to = Math.min(words.size(), index + after + 1);
        String window = String.join(" ", words.subList(from, to)).toLowerCase(Locale.ROOT);
        for (Pattern pattern : patterns) {
            if (pattern.matcher(window).find()) {
                return true;
            }
        }
        return false;
    }

    public List<Pattern> getPatterns() {
        return patterns;
    }
}
