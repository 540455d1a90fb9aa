package de.mirkosertic.mcp.notesearch.scoring;

/**
 * Tuning for {@link FuzzyMatcher}.
 *
 * @param maxEditDistance       upper bound used by {@link FuzzyMatcher#isWithinEditDistance(String, String)}
 * @param includeTranspositions count swapping two adjacent characters as a single edit
 * @param minSimilarity         similarity a candidate needs to count as a match
 * @param prefixWeight          boost factor (at least 1) when one string is a prefix of the other
 */
public record FuzzyMatchConfig(int maxEditDistance, boolean includeTranspositions, double minSimilarity,
                               double prefixWeight) {

    public static final FuzzyMatchConfig DEFAULTS = new FuzzyMatchConfig(2, true, 0.7, 1.5);

    public FuzzyMatchConfig {
        if (maxEditDistance < 0) {
            throw new IllegalArgumentException("maxEditDistance must not be negative, was " + maxEditDistance);
        }
        if (minSimilarity < 0.0 || minSimilarity > 1.0) {
            throw new IllegalArgumentException("minSimilarity must be within [0,1], was " + minSimilarity);
        }
        if (prefixWeight < 1.0) {
            throw new IllegalArgumentException("prefixWeight must be at least 1, was " + prefixWeight);
        }
    }

    /**
     * Tolerance equivalent to {@link #minSimilarity()}, used when callers do not pass one.
     */
    public double defaultTolerance() {
        return 1.0 - minSimilarity;
    }
}
