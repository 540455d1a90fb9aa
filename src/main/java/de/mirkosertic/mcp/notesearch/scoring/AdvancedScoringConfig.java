package de.mirkosertic.mcp.notesearch.scoring;

/**
 * Weights of {@link AdvancedRelevanceScorer}.
 *
 * <p>A matching clause contributes {@code typeWeight * fieldBoost * matchQuality}, where the match quality is
 * in {@code [0,1]} and depends on the clause type. Should clauses are multiplied by {@code shouldWeight}.</p>
 *
 * @param exactWeight    base weight of exact clauses
 * @param fuzzyWeight    base weight of fuzzy clauses
 * @param wildcardWeight base weight of wildcard clauses
 * @param phraseWeight   base weight of phrase clauses
 * @param regexWeight    base weight of regex clauses
 * @param titleBoost     factor for matches in the title
 * @param contentBoost   factor for matches in the content
 * @param tagBoost       factor for matches in the tags
 * @param shouldWeight   factor in {@code (0,1]} applied to should clauses
 * @param allTermsBoost  factor applied when every must and should clause matched
 */
public record AdvancedScoringConfig(double exactWeight, double fuzzyWeight, double wildcardWeight,
                                    double phraseWeight, double regexWeight,
                                    double titleBoost, double contentBoost, double tagBoost,
                                    double shouldWeight, double allTermsBoost) {

    public static final AdvancedScoringConfig DEFAULTS =
            new AdvancedScoringConfig(30, 20, 22, 26, 27, 2.0, 1.0, 0.8, 0.7, 1.2);

    public AdvancedScoringConfig {
        if (exactWeight < 0 || fuzzyWeight < 0 || wildcardWeight < 0 || phraseWeight < 0 || regexWeight < 0) {
            throw new IllegalArgumentException("Clause weights must not be negative");
        }
        if (titleBoost < 0 || contentBoost < 0 || tagBoost < 0) {
            throw new IllegalArgumentException("Field boosts must not be negative");
        }
        if (shouldWeight <= 0 || shouldWeight > 1) {
            throw new IllegalArgumentException("shouldWeight must be within (0,1], was " + shouldWeight);
        }
        if (allTermsBoost < 1) {
            throw new IllegalArgumentException("allTermsBoost must be at least 1, was " + allTermsBoost);
        }
    }
}
