package com.promptoptimizer.infrastructure.strategy;

import com.promptoptimizer.domain.optimization.model.OptimizationConfig;
import com.promptoptimizer.infrastructure.metrics.TextSimilarity;
import com.promptoptimizer.infrastructure.preprocessing.TextNormalizer;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reorganizes a prompt into canonical sections (context, instructions, constraints,
 * examples, output format), removing duplicated items on the way.
 * <p>
 * The result may be longer than the input when headers or numbering are added; the
 * pipeline accepts it on meaning preservation alone. Line structure is always rebuilt,
 * so {@link OptimizationConfig#preserveStructure()} does not apply here.
 */
public class StructuralOptimizationStrategy extends AbstractOptimizationStrategy {

    static final double SECTION_DUPLICATE_THRESHOLD = 0.8;
    static final double INSTRUCTION_MERGE_THRESHOLD = 0.7;

    private static final int MIN_LENGTH = 50;

    private static final Pattern BLANK_LINE = Pattern.compile("\\n\\s*\\n");
    private static final Pattern SENTENCE_OR_LINE = Pattern.compile("(?<=[.!?])\\s+|\\n");
    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+");
    private static final Pattern SENTENCE_SPLIT = Pattern.compile("[.!?]+");
    private static final Pattern LIST_MARKER = Pattern.compile("^(?:[-•*]|\\d+[.)])\\s+");
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[.:;]+$");

    private static final Pattern HEADERS = Pattern.compile("^[A-Z][^:\\n]*:", Pattern.MULTILINE);
    private static final Pattern LISTS = Pattern.compile("^\\s*[-•\\d]", Pattern.MULTILINE);
    private static final Pattern EXCESSIVE_SPACING = Pattern.compile("\\s{3,}");
    private static final Pattern SEPARATED_SENTENCES = Pattern.compile("[.!?]\\s+[A-Z]");
    private static final Pattern DOUBLED_PUNCTUATION = Pattern.compile("[,.!?]{2,}");

    public StructuralOptimizationStrategy() {
        this(OptimizationConfig.defaults());
    }

    public StructuralOptimizationStrategy(OptimizationConfig config) {
        this(config, new TextNormalizer());
    }

    public StructuralOptimizationStrategy(OptimizationConfig config, TextNormalizer normalizer) {
        super(config, normalizer);
    }

    @Override
    protected String getDescription() {
        return "Reorders the prompt into context, instructions, constraints, examples and output format sections";
    }

    @Override
    public String apply(String prompt) {
        validatePrompt(prompt);

        Map<SectionType, List<String>> sections = analyzeStructure(normalizer.normalize(prompt));
        sections.replaceAll((type, items) -> removeSectionDuplicates(items));
        sections.computeIfPresent(SectionType.INSTRUCTIONS, (type, items) -> mergeSimilarInstructions(items));
        sections.values().removeIf(List::isEmpty);

        boolean withHeaders = sections.size() > 2;
        List<String> parts = new ArrayList<>();
        for (Map.Entry<SectionType, List<String>> section : sections.entrySet()) {
            SectionType type = section.getKey();
            List<String> items = withHeaders ? stripLabels(type, section.getValue()) : section.getValue();
            String content = format(type, items).strip();
            if (content.isEmpty()) {
                continue;
            }
            if (withHeaders && type.getHeader() != null) {
                parts.add(type.getHeader() + "\n" + content);
            } else {
                parts.add(content);
            }
        }
        return String.join("\n\n", parts).strip();
    }

    @Override
    public double estimateReduction(String prompt) {
        if (!canApply(prompt)) {
            return 0.0;
        }
        double structure = structureScore(prompt);
        double duplication = duplicationScore(prompt);
        double formatting = formattingScore(prompt);

        if (structure > 0.8) {
            return duplication * 0.1;
        }
        return (1 - structure) * 0.05
                + duplication * 0.15
                + (1 - formatting) * 0.02
                - 0.05;
    }

    @Override
    public boolean canApply(String prompt) {
        if (prompt == null || prompt.strip().length() < MIN_LENGTH) {
            return false;
        }
        return structureScore(prompt) < 0.8
                || duplicationScore(prompt) > 0.1
                || formattingScore(prompt) < 0.7;
    }

    /**
     * Splits into paragraphs (or, for a single paragraph, into lines and sentences) and files
     * each one under its section, in canonical order.
     */
    Map<SectionType, List<String>> analyzeStructure(String text) {
        Map<SectionType, List<String>> sections = new EnumMap<>(SectionType.class);
        for (String unit : splitIntoUnits(text)) {
            sections.computeIfAbsent(SectionType.classify(unit), type -> new ArrayList<>()).add(unit);
        }
        return sections;
    }

    List<String> splitIntoUnits(String text) {
        String[] paragraphs = BLANK_LINE.split(text.strip());
        String[] units = paragraphs.length > 1 ? paragraphs : SENTENCE_OR_LINE.split(text.strip());
        List<String> result = new ArrayList<>();
        for (String unit : units) {
            if (!unit.isBlank()) {
                result.add(unit.strip());
            }
        }
        return result;
    }

    private static List<String> removeSectionDuplicates(List<String> items) {
        List<String> unique = new ArrayList<>();
        for (String item : items) {
            if (!isSimilarToAny(item, unique, SECTION_DUPLICATE_THRESHOLD)) {
                unique.add(item);
            }
        }
        return unique;
    }

    /**
     * Drops instruction sentences that restate an earlier instruction sentence.
     */
    private static List<String> mergeSimilarInstructions(List<String> items) {
        List<String> seen = new ArrayList<>();
        List<String> merged = new ArrayList<>();
        for (String item : items) {
            List<String> kept = new ArrayList<>();
            for (String sentence : SENTENCE_BOUNDARY.split(item)) {
                String candidate = sentence.strip();
                if (candidate.isEmpty() || isSimilarToAny(candidate, seen, INSTRUCTION_MERGE_THRESHOLD)) {
                    continue;
                }
                seen.add(candidate);
                kept.add(candidate);
            }
            if (!kept.isEmpty()) {
                merged.add(String.join(" ", kept));
            }
        }
        return merged;
    }

    private static List<String> stripLabels(SectionType type, List<String> items) {
        if (type.getHeader() == null) {
            return items;
        }
        String label = type.getHeader().toLowerCase(Locale.ROOT);
        List<String> stripped = new ArrayList<>();
        for (String item : items) {
            if (item.toLowerCase(Locale.ROOT).startsWith(label) && item.length() > label.length()) {
                stripped.add(item.substring(label.length()).strip());
            } else {
                stripped.add(item);
            }
        }
        return stripped;
    }

    private static String format(SectionType type, List<String> items) {
        return switch (type) {
            case INSTRUCTIONS -> formatInstructions(items);
            case CONSTRAINTS -> formatConstraints(items);
            case EXAMPLES -> formatExamples(items);
            case OUTPUT_FORMAT -> formatOutput(items);
            default -> String.join(" ", items);
        };
    }

    private static String formatInstructions(List<String> items) {
        if (items.size() <= 2) {
            return String.join(" ", items);
        }
        List<String> numbered = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            String instruction = LIST_MARKER.matcher(items.get(i)).replaceFirst("");
            instruction = TRAILING_PUNCTUATION.matcher(instruction).replaceAll("");
            numbered.add((i + 1) + ". " + instruction);
        }
        return String.join("\n", numbered);
    }

    private static String formatConstraints(List<String> items) {
        if (items.size() == 1) {
            return items.get(0);
        }
        List<String> bullets = new ArrayList<>();
        for (String constraint : items) {
            bullets.add(constraint.startsWith("-") || constraint.startsWith("•") ? constraint : "- " + constraint);
        }
        return String.join("\n", bullets);
    }

    private static String formatExamples(List<String> items) {
        if (items.size() == 1) {
            return items.get(0);
        }
        List<String> examples = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            examples.add("Example " + (i + 1) + ": " + items.get(i));
        }
        return String.join("\n", examples);
    }

    private static String formatOutput(List<String> items) {
        String content = String.join(" ", items);
        String lower = content.toLowerCase(Locale.ROOT);
        if (lower.contains("format") || lower.contains("output") || lower.contains("response")) {
            return content;
        }
        return "Output format: " + content;
    }

    double structureScore(String prompt) {
        int indicators = 0;
        if (HEADERS.matcher(prompt).find()) {
            indicators++;
        }
        if (BLANK_LINE.split(prompt.strip()).length > 1) {
            indicators++;
        }
        if (LISTS.matcher(prompt).find()) {
            indicators++;
        }
        return indicators / 3.0;
    }

    double duplicationScore(String prompt) {
        List<String> sentences = new ArrayList<>();
        for (String sentence : SENTENCE_SPLIT.split(prompt)) {
            if (!sentence.isBlank()) {
                sentences.add(sentence.strip());
            }
        }
        if (sentences.size() < 2) {
            return 0.0;
        }
        int duplicates = 0;
        int comparisons = 0;
        for (int i = 0; i < sentences.size(); i++) {
            for (int j = i + 1; j < sentences.size(); j++) {
                if (TextSimilarity.jaccard(sentences.get(i), sentences.get(j)) > INSTRUCTION_MERGE_THRESHOLD) {
                    duplicates++;
                }
                comparisons++;
            }
        }
        return (double) duplicates / comparisons;
    }

    double formattingScore(String prompt) {
        int indicators = 0;
        if (!EXCESSIVE_SPACING.matcher(prompt).find()) {
            indicators++;
        }
        if (SEPARATED_SENTENCES.matcher(prompt).find()) {
            indicators++;
        }
        if (!DOUBLED_PUNCTUATION.matcher(prompt).find()) {
            indicators++;
        }
        return indicators / 3.0;
    }

    private static boolean isSimilarToAny(String text, List<String> existing, double threshold) {
        for (String other : existing) {
            if (TextSimilarity.jaccard(text, other) > threshold) {
                return true;
            }
        }
        return false;
    }
}
