package de.mirkosertic.mcp.notesearch.scoring;

/**
 * Weights of the additive model used by {@link RelevanceScorer}.
 *
 * @param exactTagMatch   per query tag equal to a document tag
 * @param partialTagMatch per query tag contained in (or containing) a document tag
 * @param titleMatch      title contains the query; doubled on equality, scaled by word overlap otherwise
 * @param contentMatch    per occurrence in the content
 * @param maxContentScore cap of the content contribution
 * @param recencyBoost    added for a document modified just now, decaying to 0 over a year
 */
public record ScoringWeights(double exactTagMatch, double partialTagMatch, double titleMatch,
                             double contentMatch, double maxContentScore, double recencyBoost) {

    public static final ScoringWeights DEFAULTS = new ScoringWeights(30, 15, 25, 10, 50, 1);

    public ScoringWeights {
        if (exactTagMatch < 0 || partialTagMatch < 0 || titleMatch < 0
                || contentMatch < 0 || maxContentScore < 0 || recencyBoost < 0) {
            throw new IllegalArgumentException("Scoring weights must not be negative");
        }
    }
}
