package com.promptoptimizer.infrastructure.strategy;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Prompt sections recognised by {@link StructuralOptimizationStrategy}. Declaration order is
 * both the classification priority and the canonical output order.
 */
public enum SectionType {

    CONTEXT("Context:", List.of(
            "background", "context", "situation", "given", "assume", "assuming", "scenario", "setting",
            "environment", "contesto", "situazione", "dato", "supponi", "ambiente")),

    INSTRUCTIONS("Instructions:", List.of(
            "please", "write", "create", "generate", "analyze", "analyse", "explain", "describe", "list",
            "identify", "compare", "evaluate", "summarize", "translate", "extract", "provide",
            "per favore", "scrivi", "crea", "genera", "analizza", "spiega", "descrivi", "elenca",
            "identifica", "confronta", "valuta", "riassumi", "traduci")),

    CONSTRAINTS("Constraints:", List.of(
            "do not", "don't", "avoid", "must not", "never", "only", "limit", "restrict", "constraint",
            "requirement", "non", "evita", "non devi", "mai", "solo", "limita", "restrizione", "vincolo",
            "requisito")),

    EXAMPLES("Examples:", List.of(
            "example", "for instance", "such as", "e.g.", "esempio", "ad esempio", "per esempio")),

    OUTPUT_FORMAT("Output Format:", List.of(
            "format", "output", "response", "answer", "result", "formato", "risposta", "risultato")),

    OTHER(null, List.of());

    // keywords of five or more characters also match longer forms ("limit" -> "limitation")
    private static final int PREFIX_MATCH_LENGTH = 5;

    private final String header;
    private final Pattern keywordPattern;

    SectionType(String header, List<String> keywords) {
        this.header = header;
        this.keywordPattern = keywords.isEmpty() ? null : compile(keywords);
    }

    public String getHeader() {
        return header;
    }

    public boolean matches(String text) {
        return keywordPattern != null && keywordPattern.matcher(text).find();
    }

    /**
     * First section, in declaration order, whose keywords occur in the text.
     */
    public static SectionType classify(String text) {
        for (SectionType type : values()) {
            if (type.matches(text)) {
                return type;
            }
        }
        return OTHER;
    }

    private static Pattern compile(List<String> keywords) {
        String alternatives = keywords.stream()
                .map(keyword -> Pattern.quote(keyword)
                        + (keyword.length() >= PREFIX_MATCH_LENGTH ? "" : "(?![\\p{L}\\p{N}_])"))
                .collect(Collectors.joining("|"));
        return Pattern.compile("(?<![\\p{L}\\p{N}_])(?:" + alternatives + ")",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}
