package de.mirkosertic.mcp.notesearch.scoring;

import de.mirkosertic.mcp.notesearch.index.IndexedDocument;
import de.mirkosertic.mcp.notesearch.index.SearchQuery;
import org.jspecify.annotations.Nullable;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Additive relevance model for flat {@link SearchQuery} criteria.
 *
 * <p>The score is the sum of</p>
 * <ul>
 *   <li>tags: {@code exactTagMatch} per query tag equal to a document tag, otherwise {@code partialTagMatch}
 *       when one contains the other</li>
 *   <li>title: {@code 2 * titleMatch} on equality, {@code titleMatch} on containment, otherwise the share of
 *       query words (longer than two characters) found in the title times {@code titleMatch}</li>
 *   <li>content: occurrences of the phrase, or of its single words when the phrase does not occur, times
 *       {@code contentMatch}, capped at {@code maxContentScore}</li>
 *   <li>recency: {@code recencyBoost * (1 + cos(pi * days / 365)) / 2} for documents modified within the
 *       last year, 0 for older ones</li>
 * </ul>
 * <p>All comparisons ignore case. The total is clamped to {@code [0,100]} and rounded to whole points.</p>
 */
public class RelevanceScorer {

    public static final double MAX_SCORE = 100.0;

    private static final double RECENCY_WINDOW_DAYS = 365.0;
    private static final double MILLIS_PER_DAY = 86_400_000.0;
    private static final int MIN_TITLE_WORD_LENGTH = 3;

    protected final Clock clock;
    private final ScoringWeights weights;

    public RelevanceScorer() {
        this(ScoringWeights.DEFAULTS, Clock.systemUTC());
    }

    public RelevanceScorer(final ScoringWeights weights, final Clock clock) {
        this.weights = Objects.requireNonNull(weights, "weights");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ScoringWeights getWeights() {
        return weights;
    }

    public double calculateScore(final IndexedDocument document, final SearchQuery query) {
        return calculateScore(document, query, weights);
    }

    public double calculateScore(final IndexedDocument document, final SearchQuery query, final ScoringWeights weights) {
        final double score = textScore(document, query, weights) + recencyScore(document.modified(), weights);
        return Math.round(clamp(score));
    }

    /**
     * The unrounded tag, title and content share of the score, without recency. A document matches a text
     * query only if this is positive.
     */
    public double textScore(final IndexedDocument document, final SearchQuery query) {
        return textScore(document, query, weights);
    }

    private double textScore(final IndexedDocument document, final SearchQuery query, final ScoringWeights weights) {
        double score = 0.0;

        if (query.tags() != null && !query.tags().isEmpty()) {
            score += tagScore(document.tags(), query.tags(), weights);
        }
        if (query.title() != null && !query.title().isBlank()) {
            score += titleScore(document.title(), query.title(), weights);
        }
        if (query.content() != null && !query.content().isBlank()) {
            score += contentScore(document.content(), query.content(), weights);
        }
        return score;
    }

    private double tagScore(final Collection<String> documentTags, final List<String> queryTags,
                            final ScoringWeights weights) {
        final Set<String> normalizedTags = new HashSet<>();
        for (final String tag : documentTags) {
            normalizedTags.add(tag.toLowerCase(Locale.ROOT));
        }

        double score = 0.0;
        for (final String queryTag : queryTags) {
            if (queryTag == null || queryTag.isBlank()) {
                continue;
            }
            final String normalized = queryTag.trim().toLowerCase(Locale.ROOT);
            if (normalizedTags.contains(normalized)) {
                score += weights.exactTagMatch();
            } else if (normalizedTags.stream().anyMatch(tag -> tag.contains(normalized) || normalized.contains(tag))) {
                score += weights.partialTagMatch();
            }
        }
        return score;
    }

    private double titleScore(final String documentTitle, final String queryTitle, final ScoringWeights weights) {
        final String title = documentTitle.toLowerCase(Locale.ROOT).trim();
        final String query = queryTitle.toLowerCase(Locale.ROOT).trim();

        if (title.equals(query)) {
            return weights.titleMatch() * 2;
        }
        if (title.contains(query)) {
            return weights.titleMatch();
        }

        final List<String> queryWords = FuzzyMatcher.tokenize(query).stream()
                .filter(word -> word.length() >= MIN_TITLE_WORD_LENGTH)
                .toList();
        if (queryWords.isEmpty()) {
            return 0.0;
        }
        final Set<String> titleWords = new HashSet<>(FuzzyMatcher.tokenize(title));
        final long found = queryWords.stream().filter(titleWords::contains).count();
        return (double) found / queryWords.size() * weights.titleMatch();
    }

    private double contentScore(final String documentContent, final String queryContent, final ScoringWeights weights) {
        final String content = documentContent.toLowerCase(Locale.ROOT);
        final String phrase = queryContent.toLowerCase(Locale.ROOT).trim();

        int occurrences = countOccurrences(content, phrase);
        if (occurrences == 0) {
            for (final String word : phrase.split("\\s+")) {
                occurrences += countOccurrences(content, word);
            }
        }
        return Math.min(occurrences * weights.contentMatch(), weights.maxContentScore());
    }

    /**
     * Half-cosine decay of the recency boost over one year.
     */
    protected double recencyScore(final @Nullable Instant modified, final ScoringWeights weights) {
        if (modified == null || weights.recencyBoost() == 0.0) {
            return 0.0;
        }
        final double days = Math.max(0.0, Duration.between(modified, clock.instant()).toMillis() / MILLIS_PER_DAY);
        if (days >= RECENCY_WINDOW_DAYS) {
            return 0.0;
        }
        return weights.recencyBoost() * 0.5 * (1.0 + Math.cos(Math.PI * days / RECENCY_WINDOW_DAYS));
    }

    /**
     * Excerpt of {@code content} around the first occurrence of {@code term}, see {@link SnippetGenerator}.
     */
    public static String generateSnippet(final @Nullable String content, final @Nullable String term,
                                         final int maxLength, final int contextWords) {
        return SnippetGenerator.generate(content, term, maxLength, contextWords);
    }

    public static String generateSnippet(final @Nullable String content, final @Nullable String term) {
        return SnippetGenerator.generate(content, term, SnippetGenerator.DEFAULT_MAX_LENGTH,
                SnippetGenerator.DEFAULT_CONTEXT_WORDS);
    }

    static int countOccurrences(final String haystack, final String needle) {
        if (needle.isEmpty()) {
            return 0;
        }
        int count = 0;
        int index = haystack.indexOf(needle);
        while (index >= 0) {
            count++;
            index = haystack.indexOf(needle, index + needle.length());
        }
        return count;
    }

    protected static double clamp(final double score) {
        return Math.max(0.0, Math.min(MAX_SCORE, score));
    }
}
