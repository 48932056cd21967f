package com.promptoptimizer.infrastructure.strategy;

import com.promptoptimizer.domain.optimization.model.OptimizationConfig;
import com.promptoptimizer.infrastructure.preprocessing.TextNormalizer;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shortens the token stream directly: abbreviations, contractions, symbols, elision of
 * function words and digits instead of number words.
 * <p>
 * Each pass can be switched off with a boolean custom parameter
 * ({@link #ABBREVIATIONS}, {@link #CONTRACTIONS}, {@link #SYMBOLS}, {@link #ELISION},
 * {@link #NUMBERS}); all default to on.
 */
public class TokenReductionStrategy extends AbstractOptimizationStrategy {

    public static final String ABBREVIATIONS = "abbreviations";
    public static final String CONTRACTIONS = "contractions";
    public static final String SYMBOLS = "symbols";
    public static final String ELISION = "elision";
    public static final String NUMBERS = "numbers";

    private static final int MIN_LENGTH = 10;
    private static final double MAX_REDUCTION = 0.35;

    private static final Map<Pattern, String> ABBREVIATION_RULES = wordRules(
            "information", "info",
            "maximum", "max",
            "minimum", "min",
            "administration", "admin",
            "application", "app",
            "documentation", "docs",
            "configuration", "config",
            "organization", "org",
            "university", "univ",
            "department", "dept",
            "management", "mgmt",
            "development", "dev",
            "environment", "env",
            "specification", "spec",
            "description", "desc",
            "reference", "ref",
            "example", "ex",
            "between", "btw",
            "without", "w/o",
            "within", "w/in",
            "through", "thru",
            "because", "bc",
            "informazione", "info",
            "informazioni", "info",
            "massimo", "max",
            "minimo", "min",
            "amministrazione", "admin",
            "applicazione", "app",
            "documentazione", "docs",
            "configurazione", "config",
            "organizzazione", "org",
            "università", "univ",
            "dipartimento", "dip",
            "sviluppo", "dev",
            "esempio", "es",
            "riferimento", "rif",
            "descrizione", "desc",
            "database", "db",
            "server", "srv",
            "client", "cli",
            "interface", "UI",
            "programming", "prog",
            "function", "func",
            "variable", "var",
            "parameter", "param",
            "algorithm", "algo"
    );

    private static final Map<Pattern, String> CONTRACTION_RULES = wordRules(
            "do not", "don't",
            "does not", "doesn't",
            "did not", "didn't",
            "will not", "won't",
            "would not", "wouldn't",
            "could not", "couldn't",
            "should not", "shouldn't",
            "cannot", "can't",
            "is not", "isn't",
            "are not", "aren't",
            "was not", "wasn't",
            "were not", "weren't",
            "have not", "haven't",
            "has not", "hasn't",
            "had not", "hadn't",
            "I am", "I'm",
            "you are", "you're",
            "he is", "he's",
            "she is", "she's",
            "it is", "it's",
            "we are", "we're",
            "they are", "they're",
            "I will", "I'll",
            "you will", "you'll",
            "he will", "he'll",
            "she will", "she'll",
            "it will", "it'll",
            "we will", "we'll",
            "they will", "they'll",
            "I would", "I'd",
            "you would", "you'd",
            "he would", "he'd",
            "she would", "she'd",
            "it would", "it'd",
            "we would", "we'd",
            "they would", "they'd"
    );

    private static final Map<Pattern, String> SYMBOL_RULES = wordRules(
            "and", "&",
            "at", "@",
            "plus", "+",
            "minus", "-",
            "equals", "=",
            "greater than", ">",
            "less than", "<",
            "number", "#",
            "dollar", "$",
            "percent", "%",
            "versus", "vs",
            "with", "w/",
            "più", "+",
            "meno", "-",
            "uguale", "=",
            "maggiore di", ">",
            "minore di", "<",
            "numero", "#",
            "dollaro", "$",
            "percento", "%",
            "contro", "vs",
            "con", "w/",
            "senza", "w/o"
    );

    // "due" is left out of the Italian numbers; it collides with English "due to"
    private static final Map<Pattern, String> NUMBER_WORD_RULES = wordRules(
            "zero", "0", "one", "1", "two", "2", "three", "3", "four", "4", "five", "5",
            "six", "6", "seven", "7", "eight", "8", "nine", "9", "ten", "10", "eleven", "11",
            "twelve", "12", "thirteen", "13", "fourteen", "14", "fifteen", "15", "sixteen", "16",
            "seventeen", "17", "eighteen", "18", "nineteen", "19", "twenty", "20",
            "uno", "1", "tre", "3", "quattro", "4", "cinque", "5", "sei", "6", "sette", "7",
            "otto", "8", "nove", "9", "dieci", "10", "undici", "11", "dodici", "12",
            "tredici", "13", "quattordici", "14", "quindici", "15", "sedici", "16",
            "diciassette", "17", "diciotto", "18", "diciannove", "19", "venti", "20"
    );

    private static final String[] MONTHS = {
            "January|Jan", "February|Feb", "March|Mar", "April|Apr", "May", "June|Jun",
            "July|Jul", "August|Aug", "September|Sept|Sep", "October|Oct", "November|Nov", "December|Dec"
    };

    private static final List<Pattern> DATE_PATTERNS = datePatterns();

    private static final Pattern PERCENT_WORD = Pattern.compile(
            "\\s*\\b(percent|per\\s+cent)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern SPACE_BEFORE_PERCENT = Pattern.compile("(\\d)[ \\t]+%");
    private static final Pattern OPEN_PAREN_SPACE = Pattern.compile("\\([ \\t]+");
    private static final Pattern CLOSE_PAREN_SPACE = Pattern.compile("[ \\t]+\\)");

    private static final Set<String> ARTICLES = Set.of(
            "a", "an", "the", "il", "la", "lo", "gli", "le", "un", "una", "uno");

    private static final Set<String> PREPOSITIONS = Set.of(
            "of", "in", "on", "at", "by", "for", "from", "up", "about",
            "di", "da", "su", "per", "con", "tra", "fra");

    private static final Set<String> CONJUNCTIONS = Set.of("and", "or", "but", "e", "o", "ma");

    private static final Set<String> LINKING_WORDS = Set.of(
            "also", "too", "anche", "pure", "inoltre");

    private static final Set<String> INTENSIFIERS = Set.of(
            "just", "only", "simply", "solo", "soltanto", "semplicemente");

    private final ContextPatternGuard guard;
    private final Set<String> removableWords;

    public TokenReductionStrategy() {
        this(OptimizationConfig.defaults());
    }

    public TokenReductionStrategy(OptimizationConfig config) {
        this(config, new TextNormalizer(), ContextPatternGuard.fixedExpressions());
    }

    public TokenReductionStrategy(OptimizationConfig config, TextNormalizer normalizer,
                                  ContextPatternGuard guard) {
        super(config, normalizer);
        this.guard = guard;

        Set<String> removable = new HashSet<>();
        removable.addAll(ARTICLES);
        removable.addAll(PREPOSITIONS);
        removable.addAll(LINKING_WORDS);
        removable.addAll(INTENSIFIERS);
        if (this.config.aggressiveMode()) {
            removable.addAll(CONJUNCTIONS);
        }
        this.removableWords = Collections.unmodifiableSet(removable);
    }

    @Override
    protected String getDescription() {
        return "Shortens the token stream with abbreviations, contractions, symbols and elision of function words";
    }

    @Override
    public String apply(String prompt) {
        validatePrompt(prompt);

        String optimized = compact(prompt);
        if (enabled(ABBREVIATIONS)) {
            optimized = replaceAll(optimized, ABBREVIATION_RULES);
        }
        if (enabled(CONTRACTIONS)) {
            optimized = replaceAll(optimized, CONTRACTION_RULES);
        }
        if (enabled(SYMBOLS)) {
            optimized = replaceAll(optimized, SYMBOL_RULES);
        }
        if (enabled(ELISION)) {
            optimized = removeNonEssentialWords(optimized);
        }
        if (enabled(NUMBERS)) {
            optimized = optimizeNumbersAndDates(optimized);
        }
        return compressFormatting(optimized);
    }

    @Override
    public double estimateReduction(String prompt) {
        if (!canApply(prompt)) {
            return 0.0;
        }
        double totalWords = words(prompt).length;
        double estimate = countAbbreviable(prompt) / totalWords * 0.25
                + countContractable(prompt) / totalWords * 0.15
                + countSymbolizable(prompt) / totalWords * 0.3
                + countRemovable(prompt) / totalWords;
        return Math.min(estimate, MAX_REDUCTION);
    }

    @Override
    public boolean canApply(String prompt) {
        if (prompt == null || prompt.strip().length() < MIN_LENGTH) {
            return false;
        }
        return countAbbreviable(prompt) > 0
                || countContractable(prompt) > 0
                || countSymbolizable(prompt) > 0
                || countRemovable(prompt) > 0;
    }

    String removeNonEssentialWords(String text) {
        return filterWords(text, (words, i) ->
                !removableWords.contains(bareWord(words.get(i))) || i == 0 || guard.protects(words, i));
    }

    String optimizeNumbersAndDates(String text) {
        String result = replaceAll(text, NUMBER_WORD_RULES);
        for (int month = 0; month < DATE_PATTERNS.size(); month++) {
            result = DATE_PATTERNS.get(month).matcher(result).replaceAll((month + 1) + "/$2/$3");
        }
        result = PERCENT_WORD.matcher(result).replaceAll("%");
        return SPACE_BEFORE_PERCENT.matcher(result).replaceAll("$1%");
    }

    String compressFormatting(String text) {
        String result = normalizer.tidyPunctuation(compact(text));
        result = OPEN_PAREN_SPACE.matcher(result).replaceAll("(");
        result = CLOSE_PAREN_SPACE.matcher(result).replaceAll(")");
        return result.strip();
    }

    private boolean enabled(String pass) {
        return config.flag(pass, true);
    }

    private int countAbbreviable(String text) {
        return enabled(ABBREVIATIONS) ? countMatches(text, ABBREVIATION_RULES.keySet()) : 0;
    }

    private int countContractable(String text) {
        return enabled(CONTRACTIONS) ? countMatches(text, CONTRACTION_RULES.keySet()) : 0;
    }

    private int countSymbolizable(String text) {
        return enabled(SYMBOLS) ? countMatches(text, SYMBOL_RULES.keySet()) : 0;
    }

    private int countRemovable(String text) {
        if (!enabled(ELISION)) {
            return 0;
        }
        int count = 0;
        for (String word : words(text)) {
            if (removableWords.contains(bareWord(word))) {
                count++;
            }
        }
        return count;
    }

    private static List<Pattern> datePatterns() {
        return Arrays.stream(MONTHS)
                .map(names -> Pattern.compile("\\b(" + names + ")\\.?\\s+(\\d{1,2}),?\\s+(\\d{4})\\b",
                        Pattern.CASE_INSENSITIVE))
                .toList();
    }

    private static Map<Pattern, String> wordRules(String... pairs) {
        Map<Pattern, String> rules = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            rules.put(wholeWord(pairs[i]), Matcher.quoteReplacement(pairs[i + 1]));
        }
        return Collections.unmodifiableMap(rules);
    }
}
