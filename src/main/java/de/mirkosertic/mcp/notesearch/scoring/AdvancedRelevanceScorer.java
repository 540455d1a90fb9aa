package de.mirkosertic.mcp.notesearch.scoring;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import de.mirkosertic.mcp.notesearch.index.IndexedDocument;
import de.mirkosertic.mcp.notesearch.query.Clause;
import de.mirkosertic.mcp.notesearch.query.ParsedQuery;
import de.mirkosertic.mcp.notesearch.query.QueryField;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Scores documents against a {@link ParsedQuery}.
 *
 * <ol>
 *   <li>Any matching {@code mustNot} clause gives 0.</li>
 *   <li>Any {@code must} clause without a match gives 0.</li>
 *   <li>Otherwise the contributions of all matching {@code must} clauses are summed, plus the contributions
 *       of matching {@code should} clauses times {@link AdvancedScoringConfig#shouldWeight()}.</li>
 *   <li>When every {@code must} and {@code should} clause matched, the sum is multiplied by
 *       {@link AdvancedScoringConfig#allTermsBoost()}.</li>
 *   <li>The result is clamped to {@code [0,100]}.</li>
 * </ol>
 *
 * <p>A clause restricted to a field is evaluated on that field only, an unrestricted clause on title,
 * content and tags, keeping the best field. A query consisting only of exclusions gives every document
 * that is not excluded a score of {@link #EXCLUSION_ONLY_SCORE}.</p>
 */
public class AdvancedRelevanceScorer extends RelevanceScorer {

    private static final Logger logger = LoggerFactory.getLogger(AdvancedRelevanceScorer.class);

    public static final double EXCLUSION_ONLY_SCORE = 1.0;

    static final double CONTAINED_EXACT_FACTOR = 0.8;
    static final double TOKEN_FUZZY_FACTOR = 0.9;
    static final double PHRASE_START_BOOST = 0.25;
    static final int PHRASE_START_WINDOW = 100;

    private static final int MAX_CACHED_PATTERNS = 1_000;

    private enum Field { TITLE, CONTENT, TAGS }

    private record PatternKey(boolean glob, String source) {
    }

    private final AdvancedScoringConfig config;
    private final FuzzyMatcher fuzzyMatcher;
    private final KeywordExtractor keywordExtractor;
    private final Cache<PatternKey, Optional<Pattern>> patternCache;

    public AdvancedRelevanceScorer() {
        this(ScoringWeights.DEFAULTS, AdvancedScoringConfig.DEFAULTS, new FuzzyMatcher(), Clock.systemUTC());
    }

    public AdvancedRelevanceScorer(final ScoringWeights weights, final AdvancedScoringConfig config,
                                   final FuzzyMatcher fuzzyMatcher, final Clock clock) {
        this(weights, config, fuzzyMatcher, new KeywordExtractor(), clock);
    }

    public AdvancedRelevanceScorer(final ScoringWeights weights, final AdvancedScoringConfig config,
                                   final FuzzyMatcher fuzzyMatcher, final KeywordExtractor keywordExtractor,
                                   final Clock clock) {
        super(weights, clock);
        this.config = Objects.requireNonNull(config, "config");
        this.fuzzyMatcher = Objects.requireNonNull(fuzzyMatcher, "fuzzyMatcher");
        this.keywordExtractor = Objects.requireNonNull(keywordExtractor, "keywordExtractor");
        this.patternCache = Caffeine.newBuilder()
                .maximumSize(MAX_CACHED_PATTERNS)
                .build();
    }

    public AdvancedScoringConfig getConfig() {
        return config;
    }

    public double calculateAdvancedScore(final IndexedDocument document, final ParsedQuery query) {
        if (query.isEmpty()) {
            return 0.0;
        }

        for (final Clause clause : query.mustNot()) {
            if (scoreClause(document, clause) > 0.0) {
                return 0.0;
            }
        }

        if (query.must().isEmpty() && query.should().isEmpty()) {
            return EXCLUSION_ONLY_SCORE;
        }

        double score = 0.0;
        int matched = 0;
        for (final Clause clause : query.must()) {
            final double clauseScore = scoreClause(document, clause);
            if (clauseScore <= 0.0) {
                return 0.0;
            }
            score += clauseScore;
            matched++;
        }
        for (final Clause clause : query.should()) {
            final double clauseScore = scoreClause(document, clause);
            if (clauseScore > 0.0) {
                score += clauseScore * config.shouldWeight();
                matched++;
            }
        }

        if (matched == query.must().size() + query.should().size()) {
            score *= config.allTermsBoost();
        }
        return clamp(score);
    }

    /**
     * Contribution of a single clause, 0 if it does not match. Not clamped.
     */
    public double scoreClause(final IndexedDocument document, final Clause clause) {
        final QueryField field = clause.field();
        if (field == null) {
            double best = 0.0;
            for (final Field candidate : Field.values()) {
                best = Math.max(best, scoreField(document, candidate, clause));
            }
            return best;
        }
        return scoreField(document, toField(field), clause);
    }

    private double scoreField(final IndexedDocument document, final Field field, final Clause clause) {
        if (clause.value().isBlank()) {
            return 0.0;
        }
        final double quality;
        final double weight;
        if (clause instanceof Clause.Exact) {
            quality = exactQuality(document, field, clause.value());
            weight = config.exactWeight();
        } else if (clause instanceof Clause.Fuzzy fuzzy) {
            quality = fuzzyQuality(document, field, fuzzy.value(), fuzzy.tolerance());
            weight = config.fuzzyWeight();
        } else if (clause instanceof Clause.Phrase) {
            quality = phraseQuality(document, field, clause.value());
            weight = config.phraseWeight();
        } else if (clause instanceof Clause.Wildcard) {
            quality = wildcardQuality(document, field, clause.value());
            weight = config.wildcardWeight();
        } else {
            quality = regexQuality(document, field, clause.value());
            weight = config.regexWeight();
        }
        return quality <= 0.0 ? 0.0 : weight * boost(field) * quality;
    }

    private double exactQuality(final IndexedDocument document, final Field field, final String value) {
        final String needle = value.trim().toLowerCase(Locale.ROOT);
        double best = 0.0;
        for (final String text : values(document, field)) {
            final String haystack = text.toLowerCase(Locale.ROOT);
            if (haystack.equals(needle)) {
                return 1.0;
            }
            if (haystack.contains(needle)) {
                best = CONTAINED_EXACT_FACTOR;
            }
        }
        return best;
    }

    /**
     * Whole value similarity first, then every query token against the tokens of the field. Each query token
     * must reach {@code minSimilarity}.
     */
    private double fuzzyQuality(final IndexedDocument document, final Field field, final String value,
                                final double minSimilarity) {
        double best = 0.0;
        final Set<String> fieldTokens = new LinkedHashSet<>();
        for (final String text : values(document, field)) {
            final double similarity = fuzzyMatcher.calculateSimilarity(text, value);
            if (fuzzyMatcher.matches(text, value, 1.0 - minSimilarity)) {
                best = Math.max(best, similarity);
            }
            fieldTokens.addAll(FuzzyMatcher.tokenize(text));
        }
        if (best >= 1.0) {
            return best;
        }

        final List<String> queryTokens = FuzzyMatcher.tokenize(value);
        if (queryTokens.isEmpty() || fieldTokens.isEmpty()) {
            return best;
        }
        double sum = 0.0;
        for (final String token : queryTokens) {
            final List<FuzzyMatch> matches = fuzzyMatcher.findBestMatches(token, fieldTokens, 1, minSimilarity);
            if (matches.isEmpty()) {
                return best;
            }
            sum += matches.get(0).similarity();
        }
        return Math.max(best, sum / queryTokens.size() * TOKEN_FUZZY_FACTOR);
    }

    /**
     * Containment, boosted linearly for matches within the first {@link #PHRASE_START_WINDOW} characters.
     */
    private double phraseQuality(final IndexedDocument document, final Field field, final String value) {
        final String needle = value.toLowerCase(Locale.ROOT);
        double best = 0.0;
        for (final String text : values(document, field)) {
            final int offset = text.toLowerCase(Locale.ROOT).indexOf(needle);
            if (offset >= 0) {
                final double nearStart = Math.max(0.0, 1.0 - (double) offset / PHRASE_START_WINDOW);
                best = Math.max(best, 1.0 + PHRASE_START_BOOST * nearStart);
            }
        }
        return best;
    }

    private double wildcardQuality(final IndexedDocument document, final Field field, final String value) {
        final Pattern pattern = compile(new PatternKey(true, value.trim()));
        if (pattern == null) {
            return 0.0;
        }
        for (final String text : values(document, field)) {
            if (pattern.matcher(text.trim()).matches()) {
                return 1.0;
            }
            for (final String token : FuzzyMatcher.tokenize(text)) {
                if (pattern.matcher(token).matches()) {
                    return 1.0;
                }
            }
        }
        return 0.0;
    }

    private double regexQuality(final IndexedDocument document, final Field field, final String value) {
        final Pattern pattern = compile(new PatternKey(false, value));
        if (pattern == null) {
            return 0.0;
        }
        for (final String text : values(document, field)) {
            if (pattern.matcher(text).find()) {
                return 1.0;
            }
        }
        return 0.0;
    }

    private @Nullable Pattern compile(final PatternKey key) {
        return patternCache.get(key, this::doCompile).orElse(null);
    }

    private Optional<Pattern> doCompile(final PatternKey key) {
        try {
            if (key.glob()) {
                return Optional.of(Pattern.compile(globToRegex(key.source()),
                        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL));
            }
            return Optional.of(Pattern.compile(key.source(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
        } catch (final PatternSyntaxException e) {
            logger.debug("Ignoring invalid pattern '{}': {}", key.source(), e.getDescription());
            return Optional.empty();
        }
    }

    /**
     * Translates {@code *} and {@code ?} to their regex counterparts and quotes everything else.
     */
    static String globToRegex(final String glob) {
        final StringBuilder regex = new StringBuilder();
        final StringBuilder literal = new StringBuilder();
        for (int i = 0; i < glob.length(); i++) {
            final char c = glob.charAt(i);
            if (c == '*' || c == '?') {
                if (!literal.isEmpty()) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (!literal.isEmpty()) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return regex.toString();
    }

    /**
     * Similarity of two documents in {@code [0,1]}: a weighted mean of the fuzzy title similarity (weight
     * {@code titleBoost}), the Jaccard index of the tag sets ({@code tagBoost}) and the Jaccard index of the
     * content keywords ({@code contentBoost}). Tags and keywords only take part when at least one document
     * has some.
     */
    public double calculateDocumentSimilarity(final IndexedDocument first, final IndexedDocument second) {
        double similarity = fuzzyMatcher.calculateSimilarity(first.title(), second.title()) * config.titleBoost();
        double factors = config.titleBoost();

        if (!first.tags().isEmpty() || !second.tags().isEmpty()) {
            similarity += jaccard(lowercase(first.tags()), lowercase(second.tags())) * config.tagBoost();
            factors += config.tagBoost();
        }

        final Set<String> firstKeywords = keywordExtractor.extractKeywords(first.content());
        final Set<String> secondKeywords = keywordExtractor.extractKeywords(second.content());
        if (!firstKeywords.isEmpty() || !secondKeywords.isEmpty()) {
            similarity += jaccard(firstKeywords, secondKeywords) * config.contentBoost();
            factors += config.contentBoost();
        }

        return factors > 0.0 ? Math.min(1.0, similarity / factors) : 0.0;
    }

    private static double jaccard(final Set<String> a, final Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 0.0;
        }
        final Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        final Set<String> union = new HashSet<>(a);
        union.addAll(b);
        return (double) intersection.size() / union.size();
    }

    private static Set<String> lowercase(final Set<String> values) {
        final Set<String> result = new HashSet<>();
        for (final String value : values) {
            result.add(value.toLowerCase(Locale.ROOT));
        }
        return result;
    }

    private static List<String> values(final IndexedDocument document, final Field field) {
        return switch (field) {
            case TITLE -> List.of(document.title());
            case CONTENT -> List.of(document.content());
            case TAGS -> new ArrayList<>(document.tags());
        };
    }

    private double boost(final Field field) {
        return switch (field) {
            case TITLE -> config.titleBoost();
            case CONTENT -> config.contentBoost();
            case TAGS -> config.tagBoost();
        };
    }

    private static Field toField(final QueryField field) {
        return switch (field) {
            case TITLE -> Field.TITLE;
            case CONTENT -> Field.CONTENT;
            case TAGS, TAG -> Field.TAGS;
        };
    }
}
