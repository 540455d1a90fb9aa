package de.mirkosertic.mcp.notesearch.index;

import de.mirkosertic.mcp.notesearch.SearchErrorKind;
import de.mirkosertic.mcp.notesearch.SearchException;
import de.mirkosertic.mcp.notesearch.SearchRuntimeStats;
import de.mirkosertic.mcp.notesearch.SearchRuntimeStats.SearchKind;
import de.mirkosertic.mcp.notesearch.facet.Facet;
import de.mirkosertic.mcp.notesearch.facet.FacetGenerator;
import de.mirkosertic.mcp.notesearch.query.Clause;
import de.mirkosertic.mcp.notesearch.query.ParsedQuery;
import de.mirkosertic.mcp.notesearch.query.QueryParser;
import de.mirkosertic.mcp.notesearch.query.QuerySyntaxException;
import de.mirkosertic.mcp.notesearch.scoring.AdvancedRelevanceScorer;
import de.mirkosertic.mcp.notesearch.scoring.AdvancedScoringConfig;
import de.mirkosertic.mcp.notesearch.scoring.FuzzyMatchConfig;
import de.mirkosertic.mcp.notesearch.scoring.FuzzyMatcher;
import de.mirkosertic.mcp.notesearch.scoring.RelevanceScorer;
import de.mirkosertic.mcp.notesearch.scoring.ScoringWeights;
import de.mirkosertic.mcp.notesearch.scoring.SnippetGenerator;
import de.mirkosertic.mcp.notesearch.store.DocumentStore;
import de.mirkosertic.mcp.notesearch.suggest.SearchSuggester;
import de.mirkosertic.mcp.notesearch.suggest.Suggestion;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory search index over the documents of a {@link DocumentStore}.
 *
 * <p>The index maps document paths to {@link IndexedDocument}s in insertion order. Searches work on a snapshot
 * taken under the read lock, mutations and the swap of a rebuilt index happen under the write lock. A rebuild
 * reads all documents into a fresh map before swapping it in, so readers see either the old or the new index.
 * Rebuilds, updates and removals are serialized, a mutation issued during a rebuild is applied after the swap.
 * Documents that fail to load are logged and skipped.</p>
 */
public class SearchEngine {

    private static final Logger logger = LoggerFactory.getLogger(SearchEngine.class);

    static final int ADVANCED_SUGGESTIONS = 5;

    private final DocumentStore documentStore;
    private final SearchSettings settings;
    private final FuzzyMatcher fuzzyMatcher;
    private final RelevanceScorer scorer;
    private final AdvancedRelevanceScorer advancedScorer;
    private final QueryParser queryParser;
    private final Clock clock;
    private final SearchRuntimeStats runtimeStats = new SearchRuntimeStats();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Object rebuildMonitor = new Object();
    private Map<String, IndexedDocument> index = new LinkedHashMap<>();
    private long indexVersion;
    private volatile boolean initialized;
    private volatile @Nullable SuggesterSnapshot suggester;

    private record SuggesterSnapshot(long version, SearchSuggester suggester) {
    }

    private record Scored(IndexedDocument document, double score) {
    }

    public SearchEngine(final DocumentStore documentStore) {
        this(documentStore, ScoringWeights.DEFAULTS, FuzzyMatchConfig.DEFAULTS, SearchSettings.DEFAULTS,
                Clock.systemUTC());
    }

    public SearchEngine(final DocumentStore documentStore, final ScoringWeights weights,
                        final FuzzyMatchConfig fuzzyConfig, final SearchSettings settings, final Clock clock) {
        this.documentStore = Objects.requireNonNull(documentStore, "documentStore");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.fuzzyMatcher = new FuzzyMatcher(fuzzyConfig);
        this.scorer = new RelevanceScorer(weights, clock);
        this.advancedScorer = new AdvancedRelevanceScorer(weights, AdvancedScoringConfig.DEFAULTS, fuzzyMatcher, clock);
        this.queryParser = new QueryParser();
    }

    /**
     * Builds the index for the first time.
     */
    public void initialize() throws SearchException {
        rebuildIndex();
    }

    public boolean isInitialized() {
        return initialized;
    }

    /**
     * Reads every document of the store into a fresh index and swaps it in.
     *
     * @return number of indexed documents
     * @throws SearchException with {@link SearchErrorKind#INDEX_ERROR} if the store cannot be enumerated
     */
    public int rebuildIndex() throws SearchException {
        synchronized (rebuildMonitor) {
            final long start = System.nanoTime();
            final List<String> paths;
            try {
                paths = documentStore.list();
            } catch (final IOException e) {
                logger.error("Failed to enumerate documents", e);
                throw new SearchException(SearchErrorKind.INDEX_ERROR, "Failed to build search index", e);
            }

            final Map<String, IndexedDocument> fresh = new LinkedHashMap<>();
            int skipped = 0;
            for (final String path : paths) {
                try {
                    final IndexedDocument document = documentStore.read(path);
                    fresh.put(document.path(), document);
                    logger.debug("Indexed document: {}", path);
                } catch (final IOException e) {
                    skipped++;
                    logger.warn("Skipping document {}: {}", path, e.getMessage());
                } catch (final RuntimeException e) {
                    skipped++;
                    logger.warn("Skipping document {}", path, e);
                }
            }

            lock.writeLock().lock();
            try {
                index = fresh;
                indexVersion++;
            } finally {
                lock.writeLock().unlock();
            }
            initialized = true;

            logger.info("Index built with {} documents ({} skipped) in {}ms", fresh.size(), skipped,
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
            return fresh.size();
        }
    }

    /**
     * Re-reads a single document. A document that no longer exists is removed from the index.
     *
     * @return true if the document is indexed afterwards
     */
    public boolean updateDocument(final String path) {
        synchronized (rebuildMonitor) {
            final IndexedDocument document;
            try {
                document = documentStore.read(path);
            } catch (final NoSuchFileException e) {
                logger.debug("Document {} disappeared, removing it from the index", path);
                removeDocument(path);
                return false;
            } catch (final IOException e) {
                logger.warn("Failed to update document {}: {}", path, e.getMessage());
                return false;
            } catch (final RuntimeException e) {
                logger.warn("Failed to update document {}", path, e);
                return false;
            }

            lock.writeLock().lock();
            try {
                index.put(document.path(), document);
                indexVersion++;
            } finally {
                lock.writeLock().unlock();
            }
            logger.debug("Updated document: {}", path);
            return true;
        }
    }

    /**
     * @return true if the document was indexed
     */
    public boolean removeDocument(final String path) {
        synchronized (rebuildMonitor) {
            lock.writeLock().lock();
            try {
                final boolean removed = index.remove(path) != null;
                if (removed) {
                    indexVersion++;
                    logger.debug("Removed document: {}", path);
                }
                return removed;
            } finally {
                lock.writeLock().unlock();
            }
        }
    }

    /**
     * Removes every document below a directory, given as a relative {@code /}-separated path.
     *
     * @return number of removed documents
     */
    public int removeDocumentsUnder(final String directory) {
        final String prefix = directory.endsWith("/") ? directory : directory + "/";
        synchronized (rebuildMonitor) {
            lock.writeLock().lock();
            try {
                final int before = index.size();
                index.keySet().removeIf(path -> path.startsWith(prefix));
                final int removed = before - index.size();
                if (removed > 0) {
                    indexVersion++;
                    logger.debug("Removed {} documents below {}", removed, directory);
                }
                return removed;
            } finally {
                lock.writeLock().unlock();
            }
        }
    }

    public Optional<IndexedDocument> getDocument(final String path) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(index.get(path));
        } finally {
            lock.readLock().unlock();
        }
    }

    public IndexStats getIndexStats() {
        final Map<Category, Integer> categories = new EnumMap<>(Category.class);
        for (final Category category : Category.values()) {
            categories.put(category, 0);
        }
        final List<IndexedDocument> documents = snapshot();
        for (final IndexedDocument document : documents) {
            categories.merge(document.category(), 1, Integer::sum);
        }
        return new IndexStats(documents.size(), categories);
    }

    public SearchRuntimeStats getRuntimeStats() {
        return runtimeStats;
    }

    public SearchSettings getSettings() {
        return settings;
    }

    public List<Suggestion> getSuggestions(final String prefix, final int maxSuggestions) {
        return suggester().getSuggestions(prefix, maxSuggestions);
    }

    public List<Suggestion> getPopularSearches(final int limit) {
        return suggester().getPopularSearches(limit);
    }

    public SearchResults search(final SearchQuery query) throws SearchException {
        return search(query, settings.defaultOptions());
    }

    /**
     * Executes a flat query. Documents must pass the category and date filters; with tags, title or content
     * present only documents matching at least one of them are returned, recency alone does not match.
     *
     * @throws SearchException if the query fails validation
     */
    public SearchResults search(final SearchQuery query, final SearchOptions options) throws SearchException {
        final long start = System.nanoTime();
        ensureInitialized();
        try {
            validate(query, false);
        } catch (final SearchException e) {
            runtimeStats.recordRejected();
            throw e;
        }

        final List<Scored> matches = scoreSimple(query, snapshot());
        final SearchResults results = toResults(matches, query, options, List.of(), contentTerm(query, null),
                List.of(), null, start);
        runtimeStats.recordSearch(SearchKind.SIMPLE, results.executionTimeMs(), results.totalCount());
        logger.debug("Search {} found {} documents in {}ms", query, results.totalCount(), results.executionTimeMs());
        return results;
    }

    /**
     * Executes a boolean query, a similarity search or, when neither is given, a flat search. The category and
     * date filters and pagination of the base query always apply.
     *
     * @throws SearchException if the query fails validation or the raw query cannot be parsed
     */
    public SearchResults advancedSearch(final AdvancedSearchQuery query, final SearchOptions options)
            throws SearchException {
        final long start = System.nanoTime();
        ensureInitialized();

        final ParsedQuery parsed;
        try {
            parsed = parse(query);
            validate(query.base(), (parsed != null && !parsed.isEmpty()) || query.hasSimilarTo());
        } catch (final SearchException e) {
            runtimeStats.recordRejected();
            throw e;
        }

        final List<IndexedDocument> documents = snapshot();
        final SearchKind kind;
        List<Scored> matches;
        if (parsed != null && !parsed.isEmpty()) {
            kind = SearchKind.ADVANCED;
            matches = scoreAdvanced(query.base(), parsed, documents);
        } else if (query.hasSimilarTo()) {
            kind = SearchKind.SIMILARITY;
            matches = findSimilar(query.base(), Objects.requireNonNull(query.similarTo()), documents);
        } else {
            kind = SearchKind.SIMPLE;
            matches = scoreSimple(query.base(), documents);
        }

        final List<SortCriterion> sortedBy;
        if (query.sortBy().isEmpty()) {
            sortedBy = List.of(new SortCriterion(SortField.RELEVANCE, SortDirection.DESC));
        } else {
            sortedBy = query.sortBy();
            matches = new ArrayList<>(matches);
            matches.sort(comparator(sortedBy));
        }

        final List<Suggestion> suggestions = query.includeSuggestions() && query.hasRawQuery()
                ? getSuggestions(Objects.requireNonNull(query.rawQuery()), ADVANCED_SUGGESTIONS)
                : List.of();

        QueryInfo queryInfo = null;
        if (parsed != null) {
            queryInfo = new QueryInfo(usesAdvancedSyntax(parsed), QueryParser.normalize(parsed));
        }

        final SearchResults results = toResults(matches, query.base(), options, suggestions,
                contentTerm(query.base(), parsed), sortedBy, queryInfo, start);
        runtimeStats.recordSearch(kind, results.executionTimeMs(), results.totalCount());
        logger.debug("Advanced search ({}) found {} documents in {}ms", kind, results.totalCount(),
                results.executionTimeMs());
        return results;
    }

    private @Nullable ParsedQuery parse(final AdvancedSearchQuery query) throws QuerySyntaxException {
        if (query.parsedQuery() != null) {
            return query.parsedQuery();
        }
        if (!query.hasRawQuery()) {
            return null;
        }
        final String rawQuery = Objects.requireNonNull(query.rawQuery());
        if (query.fuzzyTolerance() != null) {
            return queryParser.parse(rawQuery, query.fuzzyTolerance());
        }
        return queryParser.parse(rawQuery);
    }

    private void validate(final SearchQuery query, final boolean hasQueryText) throws SearchException {
        if (query.tags() != null && query.tags().stream().anyMatch(tag -> tag == null || tag.isBlank())) {
            throw new SearchException(SearchErrorKind.INVALID_QUERY, "Tags must be non-empty strings");
        }
        if (!hasQueryText && !query.hasCriteria()) {
            throw new SearchException(SearchErrorKind.INVALID_QUERY, "At least one search criterion must be provided");
        }
        final DateRange dateRange = query.dateRange();
        if (dateRange != null && dateRange.start() != null && dateRange.end() != null
                && !dateRange.start().isBefore(dateRange.end())) {
            throw new SearchException(SearchErrorKind.INVALID_DATE_RANGE,
                    "Invalid date range: start date must be before end date");
        }
        if (query.limit() != null && query.limit() <= 0) {
            throw new SearchException(SearchErrorKind.INVALID_LIMIT, "Limit must be greater than 0");
        }
        if (query.limit() != null && query.limit() > settings.maxLimit()) {
            throw new SearchException(SearchErrorKind.INVALID_LIMIT,
                    "Limit must not exceed " + settings.maxLimit());
        }
        if (query.offset() != null && query.offset() < 0) {
            throw new SearchException(SearchErrorKind.INVALID_OFFSET, "Offset must be non-negative");
        }
    }

    private List<Scored> scoreSimple(final SearchQuery query, final List<IndexedDocument> documents) {
        final boolean textQuery = query.hasTextCriteria();
        final List<Scored> matches = new ArrayList<>();
        for (final IndexedDocument document : documents) {
            if (!matchesFilters(document, query)) {
                continue;
            }
            if (!textQuery || scorer.textScore(document, query) > 0.0) {
                matches.add(new Scored(document, scorer.calculateScore(document, query)));
            }
        }
        matches.sort(Comparator.comparingDouble(Scored::score).reversed());
        return matches;
    }

    private List<Scored> scoreAdvanced(final SearchQuery base, final ParsedQuery parsed,
                                       final List<IndexedDocument> documents) {
        final List<Scored> matches = new ArrayList<>();
        for (final IndexedDocument document : documents) {
            if (!matchesFilters(document, base)) {
                continue;
            }
            final double score = advancedScorer.calculateAdvancedScore(document, parsed);
            if (score > 0.0) {
                matches.add(new Scored(document, score));
            }
        }
        matches.sort(Comparator.comparingDouble(Scored::score).reversed());
        return matches;
    }

    /**
     * Documents similar to the reference, best first and at most one page. Scores are similarities scaled to
     * {@code [0,100]}.
     */
    private List<Scored> findSimilar(final SearchQuery base, final String referencePath,
                                     final List<IndexedDocument> documents) {
        final IndexedDocument reference = documents.stream()
                .filter(document -> document.path().equals(referencePath))
                .findFirst()
                .orElse(null);
        if (reference == null) {
            logger.warn("Reference document not found: {}", referencePath);
            return List.of();
        }

        final List<Scored> matches = new ArrayList<>();
        for (final IndexedDocument document : documents) {
            if (document.path().equals(referencePath) || !matchesFilters(document, base)) {
                continue;
            }
            final double similarity = advancedScorer.calculateDocumentSimilarity(reference, document);
            if (similarity > settings.similarityThreshold()) {
                matches.add(new Scored(document, similarity * RelevanceScorer.MAX_SCORE));
            }
        }
        matches.sort(Comparator.comparingDouble(Scored::score).reversed());
        final int limit = effectiveLimit(base);
        return matches.size() > limit ? matches.subList(0, limit) : matches;
    }

    /**
     * Category and date filters, combined with the query operator. A document without any date fails the
     * date filter.
     */
    private static boolean matchesFilters(final IndexedDocument document, final SearchQuery query) {
        final List<Boolean> checks = new ArrayList<>(2);
        if (query.category() != null) {
            checks.add(document.category() == query.category());
        }
        final DateRange dateRange = query.dateRange();
        if (dateRange != null && !dateRange.isUnbounded()) {
            final Instant date = document.effectiveDate();
            checks.add(date != null && dateRange.contains(date));
        }
        if (checks.isEmpty()) {
            return true;
        }
        if (query.effectiveOperator() == Operator.OR) {
            return checks.contains(Boolean.TRUE);
        }
        return !checks.contains(Boolean.FALSE);
    }

    private SearchResults toResults(final List<Scored> matches, final SearchQuery query, final SearchOptions options,
                                    final List<Suggestion> suggestions, final @Nullable String snippetTerm,
                                    final List<SortCriterion> sortedBy, final @Nullable QueryInfo queryInfo,
                                    final long startNanos) {
        final int offset = query.effectiveOffset();
        final int limit = effectiveLimit(query);

        final List<SearchResult> page = new ArrayList<>();
        for (int i = offset; i < matches.size() && page.size() < limit; i++) {
            final Scored match = matches.get(i);
            final IndexedDocument document = match.document();
            String snippet = null;
            if (options.includeSnippets()) {
                snippet = SnippetGenerator.generate(document.content(), snippetTerm, options.snippetLength(),
                        options.snippetContext());
            }
            page.add(new SearchResult(document.path(), document.title(), match.score(), snippet,
                    List.copyOf(document.tags()), document.category(), ResultMetadata.of(document)));
        }

        List<Facet> facets = List.of();
        if (!options.facets().isEmpty()) {
            final List<IndexedDocument> matching = new ArrayList<>(matches.size());
            for (final Scored match : matches) {
                matching.add(match.document());
            }
            facets = FacetGenerator.generateFacets(matching, options.facets(), clock);
        }

        final long executionTimeMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        return new SearchResults(page, matches.size(), executionTimeMs, facets, suggestions, sortedBy, queryInfo);
    }

    private int effectiveLimit(final SearchQuery query) {
        return query.limit() != null ? query.limit() : settings.defaultLimit();
    }

    /**
     * The term snippets are centered on: the content criterion, else the first positive clause of the
     * parsed query, else the title criterion.
     */
    private static @Nullable String contentTerm(final SearchQuery query, final @Nullable ParsedQuery parsed) {
        if (query.content() != null && !query.content().isBlank()) {
            return query.content();
        }
        if (parsed != null && !parsed.must().isEmpty()) {
            return parsed.must().get(0).value();
        }
        if (parsed != null && !parsed.should().isEmpty()) {
            return parsed.should().get(0).value();
        }
        return query.title();
    }

    /**
     * True unless the query is a plain list of unrestricted fuzzy terms.
     */
    private static boolean usesAdvancedSyntax(final ParsedQuery parsed) {
        if (!parsed.should().isEmpty() || !parsed.mustNot().isEmpty()) {
            return true;
        }
        for (final Clause clause : parsed.must()) {
            if (clause.field() != null || !(clause instanceof Clause.Fuzzy)) {
                return true;
            }
        }
        return false;
    }

    private static Comparator<Scored> comparator(final List<SortCriterion> criteria) {
        Comparator<Scored> result = null;
        for (final SortCriterion criterion : criteria) {
            Comparator<Scored> next = switch (criterion.field()) {
                case RELEVANCE -> Comparator.comparingDouble(Scored::score);
                case TITLE -> Comparator.comparing((Scored scored) -> scored.document().title(),
                        String.CASE_INSENSITIVE_ORDER);
                case CREATED -> Comparator.comparing((Scored scored) -> epoch(scored.document().created()));
                case MODIFIED -> Comparator.comparing((Scored scored) -> epoch(scored.document().modified()));
                case SIZE -> Comparator.comparingLong((Scored scored) -> scored.document().size());
            };
            if (criterion.direction() == SortDirection.DESC) {
                next = next.reversed();
            }
            result = result == null ? next : result.thenComparing(next);
        }
        return result != null ? result : Comparator.comparingDouble(Scored::score).reversed();
    }

    private static Instant epoch(final @Nullable Instant instant) {
        return instant != null ? instant : Instant.EPOCH;
    }

    private List<IndexedDocument> snapshot() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(index.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * The suggester of the current index version, rebuilt on first use after a mutation.
     */
    private SearchSuggester suggester() {
        final List<IndexedDocument> documents;
        final long version;
        lock.readLock().lock();
        try {
            final SuggesterSnapshot current = suggester;
            if (current != null && current.version() == indexVersion) {
                return current.suggester();
            }
            documents = new ArrayList<>(index.values());
            version = indexVersion;
        } finally {
            lock.readLock().unlock();
        }

        final SearchSuggester rebuilt = new SearchSuggester(documents, fuzzyMatcher);
        synchronized (this) {
            final SuggesterSnapshot current = suggester;
            if (current == null || current.version() < version) {
                suggester = new SuggesterSnapshot(version, rebuilt);
            }
        }
        return rebuilt;
    }

    private void ensureInitialized() throws SearchException {
        if (!initialized) {
            initialize();
        }
    }
}
