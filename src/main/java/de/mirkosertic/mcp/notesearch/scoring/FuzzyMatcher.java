package de.mirkosertic.mcp.notesearch.scoring;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Normalized string similarity based on the Damerau-Levenshtein edit distance
 * (optimal string alignment variant).
 *
 * <p>Similarity is {@code 1 - distance / max(length)}, computed on lowercased, trimmed input. When one
 * string is a prefix of the other the remaining gap to 1.0 is narrowed by {@code prefixWeight - 1}, so
 * {@code java} is closer to {@code javascript} than {@code script} is.</p>
 *
 * <p>Instances are immutable and thread-safe.</p>
 */
public class FuzzyMatcher {

    private static final Pattern WORD_SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}_]+");

    /**
     * Absorbs rounding noise when comparing similarities against thresholds.
     */
    private static final double EPSILON = 1e-9;

    public static final int DEFAULT_MAX_RESULTS = 10;
    public static final int DEFAULT_MAX_ALTERNATIVES = 5;

    private final FuzzyMatchConfig config;

    public FuzzyMatcher() {
        this(FuzzyMatchConfig.DEFAULTS);
    }

    public FuzzyMatcher(final FuzzyMatchConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public FuzzyMatchConfig getConfig() {
        return config;
    }

    /**
     * Similarity of two strings in {@code [0,1]}, ignoring case and surrounding whitespace. An empty input
     * is similar to nothing, not even to another empty input.
     */
    public double calculateSimilarity(final @Nullable String first, final @Nullable String second) {
        final String a = normalize(first);
        final String b = normalize(second);

        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        if (a.equals(b)) {
            return 1.0;
        }

        final int distance = editDistance(a, b);
        double similarity = 1.0 - (double) distance / Math.max(a.length(), b.length());

        if (config.prefixWeight() > 1.0 && (a.startsWith(b) || b.startsWith(a))) {
            similarity = Math.min(1.0, similarity + (1.0 - similarity) * (config.prefixWeight() - 1.0));
        }

        return Math.max(0.0, similarity);
    }

    /**
     * Edit distance between two strings, case-sensitive. Adjacent transpositions count as one edit
     * when enabled in the configuration.
     */
    public int editDistance(final String a, final String b) {
        final int n = a.length();
        final int m = b.length();
        if (n == 0) {
            return m;
        }
        if (m == 0) {
            return n;
        }

        int[] twoAgo = new int[m + 1];
        int[] previous = new int[m + 1];
        int[] current = new int[m + 1];
        for (int j = 0; j <= m; j++) {
            previous[j] = j;
        }

        for (int i = 1; i <= n; i++) {
            current[0] = i;
            fillRow(a, b, i, twoAgo, previous, current);

            final int[] recycled = twoAgo;
            twoAgo = previous;
            previous = current;
            current = recycled;
        }
        return previous[m];
    }

    /**
     * Checks the configured {@link FuzzyMatchConfig#maxEditDistance()} bound.
     */
    public boolean isWithinEditDistance(final String a, final String b) {
        return isWithinEditDistance(a, b, config.maxEditDistance());
    }

    /**
     * Bounded edit distance check. Stops as soon as a whole row of the distance matrix exceeds the bound,
     * which keeps comparisons against large vocabularies cheap.
     */
    public boolean isWithinEditDistance(final String a, final String b, final int maxDistance) {
        final String first = normalize(a);
        final String second = normalize(b);
        final int n = first.length();
        final int m = second.length();
        if (Math.abs(n - m) > maxDistance) {
            return false;
        }
        if (n == 0 || m == 0) {
            return Math.max(n, m) <= maxDistance;
        }

        int[] twoAgo = new int[m + 1];
        int[] previous = new int[m + 1];
        int[] current = new int[m + 1];
        for (int j = 0; j <= m; j++) {
            previous[j] = j;
        }

        for (int i = 1; i <= n; i++) {
            current[0] = i;
            final int rowMinimum = fillRow(first, second, i, twoAgo, previous, current);
            if (rowMinimum > maxDistance) {
                return false;
            }

            final int[] recycled = twoAgo;
            twoAgo = previous;
            previous = current;
            current = recycled;
        }
        return previous[m] <= maxDistance;
    }

    /**
     * Computes row {@code i} of the distance matrix and returns its minimum.
     */
    private int fillRow(final String a, final String b, final int i,
                        final int[] twoAgo, final int[] previous, final int[] current) {
        final int m = b.length();
        final char ai = a.charAt(i - 1);
        int rowMinimum = current[0];
        for (int j = 1; j <= m; j++) {
            final char bj = b.charAt(j - 1);
            final int cost = ai == bj ? 0 : 1;
            int value = Math.min(Math.min(previous[j] + 1, current[j - 1] + 1), previous[j - 1] + cost);
            if (config.includeTranspositions() && i > 1 && j > 1
                    && ai == b.charAt(j - 2) && a.charAt(i - 2) == bj) {
                value = Math.min(value, twoAgo[j - 2] + 1);
            }
            current[j] = value;
            rowMinimum = Math.min(rowMinimum, value);
        }
        return rowMinimum;
    }

    /**
     * True if the similarity reaches the configured minimum similarity.
     */
    public boolean matches(final @Nullable String a, final @Nullable String b) {
        return matches(a, b, config.defaultTolerance());
    }

    /**
     * @param tolerance 0 demands an exact match, 1 accepts anything
     */
    public boolean matches(final @Nullable String a, final @Nullable String b, final double tolerance) {
        return calculateSimilarity(a, b) + EPSILON >= 1.0 - tolerance;
    }

    public List<FuzzyMatch> findBestMatches(final String query, final Collection<String> candidates) {
        return findBestMatches(query, candidates, DEFAULT_MAX_RESULTS, config.minSimilarity());
    }

    /**
     * Ranks candidates by similarity to the query.
     *
     * @return matches sorted by descending similarity (ties: shorter candidate first), at most {@code maxResults}
     */
    public List<FuzzyMatch> findBestMatches(final String query, final Collection<String> candidates,
                                            final int maxResults, final double minSimilarity) {
        if (maxResults <= 0 || candidates.isEmpty()) {
            return List.of();
        }

        final Set<String> seen = new LinkedHashSet<>(candidates);
        final List<FuzzyMatch> matches = new ArrayList<>();
        for (final String candidate : seen) {
            if (candidate == null) {
                continue;
            }
            final double similarity = calculateSimilarity(query, candidate);
            if (similarity + EPSILON >= minSimilarity) {
                matches.add(new FuzzyMatch(candidate, similarity));
            }
        }

        matches.sort(Comparator.comparingDouble(FuzzyMatch::similarity).reversed()
                .thenComparingInt(match -> match.value().length()));

        return matches.size() > maxResults ? List.copyOf(matches.subList(0, maxResults)) : matches;
    }

    public boolean matchTokens(final String query, final String target) {
        return matchTokens(tokenize(query), tokenize(target), config.defaultTolerance());
    }

    public boolean matchTokens(final List<String> queryTokens, final List<String> targetTokens) {
        return matchTokens(queryTokens, targetTokens, config.defaultTolerance());
    }

    /**
     * Every query token must fuzzy-match at least one target token. An empty query always matches,
     * an empty target never matches a non-empty query.
     */
    public boolean matchTokens(final List<String> queryTokens, final List<String> targetTokens, final double tolerance) {
        if (queryTokens.isEmpty()) {
            return true;
        }
        if (targetTokens.isEmpty()) {
            return false;
        }
        for (final String queryToken : queryTokens) {
            boolean found = false;
            for (final String targetToken : targetTokens) {
                if (matches(queryToken, targetToken, tolerance)) {
                    found = true;
                    break;
                }
            }
            if (!found) {
                return false;
            }
        }
        return true;
    }

    public double calculateTokenSimilarity(final String a, final String b) {
        return calculateTokenSimilarity(tokenize(a), tokenize(b));
    }

    /**
     * Average best per-token similarity, taken in both directions and averaged. Returns 0 when no token
     * reaches the configured minimum similarity.
     */
    public double calculateTokenSimilarity(final List<String> a, final List<String> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        final double forward = directionalSimilarity(a, b);
        final double backward = directionalSimilarity(b, a);
        if (forward == 0.0 && backward == 0.0) {
            return 0.0;
        }
        return (forward + backward) / 2.0;
    }

    private double directionalSimilarity(final List<String> source, final List<String> target) {
        double sum = 0.0;
        int cleared = 0;
        for (final String token : source) {
            double best = 0.0;
            for (final String candidate : target) {
                best = Math.max(best, calculateSimilarity(token, candidate));
                if (best >= 1.0) {
                    break;
                }
            }
            if (best + EPSILON >= config.minSimilarity()) {
                cleared++;
            }
            sum += best;
        }
        return cleared == 0 ? 0.0 : sum / source.size();
    }

    public List<String> generateAlternatives(final String word) {
        return generateAlternatives(word, DEFAULT_MAX_ALTERNATIVES);
    }

    /**
     * Spelling variants of a word: every single-character deletion, then every adjacent transposition.
     * The word itself and duplicates are skipped.
     */
    public List<String> generateAlternatives(final @Nullable String word, final int max) {
        if (word == null || word.isEmpty() || max <= 0) {
            return List.of();
        }

        final Set<String> alternatives = new LinkedHashSet<>();
        for (int i = 0; i < word.length() && alternatives.size() < max; i++) {
            final String deletion = word.substring(0, i) + word.substring(i + 1);
            if (!deletion.isEmpty() && !deletion.equals(word)) {
                alternatives.add(deletion);
            }
        }
        for (int i = 0; i < word.length() - 1 && alternatives.size() < max; i++) {
            final char[] chars = word.toCharArray();
            final char swap = chars[i];
            chars[i] = chars[i + 1];
            chars[i + 1] = swap;
            final String transposition = new String(chars);
            if (!transposition.equals(word)) {
                alternatives.add(transposition);
            }
        }
        return List.copyOf(alternatives);
    }

    /**
     * Lowercase word tokens of a text, split on everything that is not a letter, digit or underscore.
     */
    public static List<String> tokenize(final @Nullable String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        final List<String> tokens = new ArrayList<>();
        for (final String token : WORD_SEPARATOR.split(text.toLowerCase(Locale.ROOT))) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private static String normalize(final @Nullable String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
