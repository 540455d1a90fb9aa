package de.mirkosertic.mcp.notesearch.index;

import de.mirkosertic.mcp.notesearch.SearchErrorKind;
import de.mirkosertic.mcp.notesearch.SearchException;
import de.mirkosertic.mcp.notesearch.SearchRuntimeStats;
import de.mirkosertic.mcp.notesearch.SearchRuntimeStats.SearchKind;
import de.mirkosertic.mcp.notesearch.facet.Facet;
import de.mirkosertic.mcp.notesearch.facet.FacetType;
import de.mirkosertic.mcp.notesearch.facet.FacetValue;
import de.mirkosertic.mcp.notesearch.query.QuerySyntaxException;
import de.mirkosertic.mcp.notesearch.scoring.FuzzyMatchConfig;
import de.mirkosertic.mcp.notesearch.scoring.ScoringWeights;
import de.mirkosertic.mcp.notesearch.store.DocumentParseException;
import de.mirkosertic.mcp.notesearch.store.DocumentStore;
import de.mirkosertic.mcp.notesearch.store.InMemoryDocumentStore;
import de.mirkosertic.mcp.notesearch.store.MarkdownDocumentStore;
import de.mirkosertic.mcp.notesearch.suggest.Suggestion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("SearchEngine Tests")
class SearchEngineTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-15T12:00:00Z"), ZoneOffset.UTC);

    // Recency off, so simple scores are exact sums of the text weights
    private static final ScoringWeights NO_RECENCY = new ScoringWeights(30, 15, 25, 10, 50, 0);

    private static final IndexedDocument WEBSITE = IndexedDocument.of("projects/website-redesign.md",
            "Website Redesign",
            "Redesign the company website with React components. The new website launches in July.",
            List.of("react", "web", "project"), Category.PROJECTS,
            Instant.parse("2024-05-01T00:00:00Z"), Instant.parse("2024-06-14T09:00:00Z"));
    private static final IndexedDocument HEALTH = IndexedDocument.of("areas/health.md",
            "Health Routine",
            "Morning exercise and sleep tracking. Drink water every day.",
            List.of("health", "habits"), Category.AREAS,
            Instant.parse("2024-01-10T00:00:00Z"), Instant.parse("2024-03-01T00:00:00Z"));
    private static final IndexedDocument JAVASCRIPT = IndexedDocument.of("resources/javascript-testing.md",
            "JavaScript Testing",
            "Unit testing with Jest. Testing React components requires a DOM. TypeScript adds types.",
            List.of("javascript", "testing", "typescript"), Category.RESOURCES,
            Instant.parse("2023-11-20T00:00:00Z"), Instant.parse("2024-06-10T00:00:00Z"));
    private static final IndexedDocument OLD_PROJECT = IndexedDocument.of("archives/old-project.md",
            "Old Project",
            "Legacy website built with jQuery. The project ended in 2021.",
            List.of("project", "legacy"), Category.ARCHIVES,
            Instant.parse("2021-02-01T00:00:00Z"), Instant.parse("2021-12-31T00:00:00Z"));

    private InMemoryDocumentStore store;
    private SearchEngine engine;

    @BeforeEach
    void setUp() throws SearchException {
        store = new InMemoryDocumentStore(WEBSITE, HEALTH, JAVASCRIPT, OLD_PROJECT);
        engine = new SearchEngine(store, NO_RECENCY, FuzzyMatchConfig.DEFAULTS, SearchSettings.DEFAULTS, CLOCK);
        engine.initialize();
    }

    private static List<String> paths(final SearchResults results) {
        return results.results().stream().map(SearchResult::path).toList();
    }

    private static DateRange since(final String start) {
        return new DateRange(Instant.parse(start), null);
    }

    private static AdvancedSearchQuery advanced(final SearchQuery base, final String rawQuery,
                                                final List<SortCriterion> sortBy) {
        return new AdvancedSearchQuery(base, rawQuery, null, null, sortBy, null, false);
    }

    @Test
    @DisplayName("Index statistics count documents per category")
    void indexStats() {
        final IndexStats stats = engine.getIndexStats();

        assertThat(engine.isInitialized()).isTrue();
        assertThat(stats.documentCount()).isEqualTo(4);
        assertThat(stats.categories()).containsOnlyKeys(Category.values());
        assertThat(stats.categories().values()).containsOnly(1);
    }

    @Nested
    @DisplayName("Simple search")
    class SimpleSearch {

        @Test
        @DisplayName("Exact tags add up")
        void tagSearch() throws SearchException {
            // When
            final SearchResults results = engine.search(SearchQuery.builder().tags("javascript", "testing").build());

            // Then
            assertThat(results.totalCount()).isEqualTo(1);
            assertThat(results.results())
                    .extracting(SearchResult::path, SearchResult::relevanceScore)
                    .containsExactly(tuple(JAVASCRIPT.path(), 60.0));
            assertThat(results.queryInfo()).isNull();
            assertThat(results.results().get(0).snippet()).isNull();
        }

        @Test
        @DisplayName("Equal scores keep index order")
        void ties() throws SearchException {
            final SearchResults results = engine.search(SearchQuery.builder().tags("project").build());

            assertThat(paths(results)).containsExactly(WEBSITE.path(), OLD_PROJECT.path());
        }

        @Test
        @DisplayName("Partial tag, title and content criteria")
        void textCriteria() throws SearchException {
            assertThat(engine.search(SearchQuery.builder().tags("script").build()).results())
                    .extracting(SearchResult::path, SearchResult::relevanceScore)
                    .containsExactly(tuple(JAVASCRIPT.path(), 15.0));
            assertThat(engine.search(SearchQuery.builder().title("website").build()).results())
                    .extracting(SearchResult::path, SearchResult::relevanceScore)
                    .containsExactly(tuple(WEBSITE.path(), 25.0));
            assertThat(engine.search(SearchQuery.builder().content("react components").build()).results())
                    .extracting(SearchResult::path, SearchResult::relevanceScore)
                    .containsExactly(tuple(WEBSITE.path(), 10.0), tuple(JAVASCRIPT.path(), 10.0));
        }

        @Test
        @DisplayName("Recency alone does not make a match")
        void recencyIsNotAMatch() throws SearchException {
            // Given: recent documents and the default recency boost
            final SearchEngine withRecency = new SearchEngine(store, ScoringWeights.DEFAULTS,
                    FuzzyMatchConfig.DEFAULTS, SearchSettings.DEFAULTS, CLOCK);

            // When
            final SearchResults missing = withRecency.search(SearchQuery.builder().tags("python").build());
            final SearchResults matching = withRecency.search(SearchQuery.builder().tags("javascript").build());

            // Then
            assertThat(missing.totalCount()).isZero();
            assertThat(matching.results()).extracting(SearchResult::relevanceScore).containsExactly(31.0);
        }

        @Test
        @DisplayName("Filter only queries return every filtered document")
        void filterOnly() throws SearchException {
            final SearchResults results = engine.search(SearchQuery.builder()
                    .dateRange(since("2024-01-01T00:00:00Z"))
                    .build());

            assertThat(paths(results)).containsExactly(WEBSITE.path(), HEALTH.path(), JAVASCRIPT.path());
        }

        @Test
        @DisplayName("Pagination keeps the total count")
        void pagination() throws SearchException {
            final SearchResults results = engine.search(SearchQuery.builder()
                    .dateRange(since("2024-01-01T00:00:00Z"))
                    .limit(2)
                    .offset(1)
                    .build());

            assertThat(results.totalCount()).isEqualTo(3);
            assertThat(paths(results)).containsExactly(HEALTH.path(), JAVASCRIPT.path());
        }

        @Test
        @DisplayName("Offset beyond the results gives an empty page")
        void offsetBeyondResults() throws SearchException {
            final SearchResults results = engine.search(SearchQuery.builder()
                    .tags("project")
                    .offset(10)
                    .build());

            assertThat(results.results()).isEmpty();
            assertThat(results.totalCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("Results carry document metadata")
        void metadata() throws SearchException {
            final SearchResult result = engine.search(SearchQuery.builder().title("old project").build())
                    .results().get(0);

            assertThat(result.category()).isEqualTo(Category.ARCHIVES);
            assertThat(result.tags()).containsExactly("project", "legacy");
            assertThat(result.metadata().modified()).isEqualTo(OLD_PROJECT.modified());
            assertThat(result.metadata().wordCount()).isEqualTo(10);
            assertThat(result.metadata().size()).isEqualTo(OLD_PROJECT.content().length());
        }
    }

    @Nested
    @DisplayName("Filters")
    class Filters {

        @Test
        @DisplayName("Category restricts the text matches")
        void category() throws SearchException {
            assertThat(paths(engine.search(SearchQuery.builder().category(Category.PROJECTS).build())))
                    .containsExactly(WEBSITE.path());
            assertThat(paths(engine.search(SearchQuery.builder()
                    .tags("project")
                    .category(Category.ARCHIVES)
                    .build())))
                    .containsExactly(OLD_PROJECT.path());
        }

        @Test
        @DisplayName("AND requires category and date range")
        void andOperator() throws SearchException {
            final SearchResults results = engine.search(SearchQuery.builder()
                    .category(Category.AREAS)
                    .dateRange(since("2024-06-01T00:00:00Z"))
                    .build());

            assertThat(results.totalCount()).isZero();
        }

        @Test
        @DisplayName("OR accepts category or date range")
        void orOperator() throws SearchException {
            final SearchResults results = engine.search(SearchQuery.builder()
                    .category(Category.AREAS)
                    .dateRange(since("2024-06-01T00:00:00Z"))
                    .operator(Operator.OR)
                    .build());

            assertThat(paths(results)).containsExactly(WEBSITE.path(), HEALTH.path(), JAVASCRIPT.path());
        }

        @Test
        @DisplayName("Date range falls back to the creation date")
        void createdFallback() throws SearchException {
            store.put(IndexedDocument.of("resources/undated.md", "Undated", "text", List.of(), Category.RESOURCES,
                    Instant.parse("2024-06-02T00:00:00Z"), null));
            store.put(IndexedDocument.of("resources/nodate.md", "No Date", "text", List.of(), Category.RESOURCES,
                    null, null));
            engine.rebuildIndex();

            final SearchResults results = engine.search(SearchQuery.builder()
                    .dateRange(new DateRange(Instant.parse("2024-06-01T00:00:00Z"),
                            Instant.parse("2024-06-05T00:00:00Z")))
                    .build());

            assertThat(paths(results)).containsExactly("resources/undated.md");
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        private void assertRejected(final SearchQuery query, final SearchErrorKind kind) {
            assertThatThrownBy(() -> engine.search(query))
                    .isInstanceOf(SearchException.class)
                    .extracting(e -> ((SearchException) e).getKind())
                    .isEqualTo(kind);
        }

        @Test
        @DisplayName("A query without criteria is rejected")
        void noCriteria() {
            assertRejected(SearchQuery.builder().limit(5).build(), SearchErrorKind.INVALID_QUERY);
            assertRejected(SearchQuery.builder().tags(" ").build(), SearchErrorKind.INVALID_QUERY);
        }

        @Test
        @DisplayName("Null tags are rejected as invalid queries")
        void nullTag() {
            final SearchQuery query = SearchQuery.builder().tags(Arrays.asList("web", null)).build();

            assertThat(query.tags()).containsExactly("web", null);
            assertRejected(query, SearchErrorKind.INVALID_QUERY);
        }

        @Test
        @DisplayName("Date range start must be before its end")
        void dateRange() {
            final Instant instant = Instant.parse("2024-06-01T00:00:00Z");

            assertRejected(SearchQuery.builder().dateRange(new DateRange(instant, instant)).build(),
                    SearchErrorKind.INVALID_DATE_RANGE);
        }

        @Test
        @DisplayName("Limit and offset are bounded")
        void paging() {
            assertRejected(SearchQuery.builder().tags("web").limit(0).build(), SearchErrorKind.INVALID_LIMIT);
            assertRejected(SearchQuery.builder().tags("web").limit(101).build(), SearchErrorKind.INVALID_LIMIT);
            assertRejected(SearchQuery.builder().tags("web").offset(-1).build(), SearchErrorKind.INVALID_OFFSET);
        }

        @Test
        @DisplayName("Rejected searches are counted")
        void rejectedCounted() {
            assertRejected(SearchQuery.builder().build(), SearchErrorKind.INVALID_QUERY);

            assertThat(engine.getRuntimeStats().getRejectedSearches()).isEqualTo(1);
            assertThat(engine.getRuntimeStats().getTotalSearches()).isZero();
        }
    }

    @Nested
    @DisplayName("Advanced search")
    class AdvancedSearch {

        @Test
        @DisplayName("Boolean query excludes documents")
        void rawQuery() throws SearchException {
            final SearchResults results = engine.advancedSearch(AdvancedSearchQuery.ofRawQuery("website -jquery"),
                    SearchOptions.DEFAULTS);

            assertThat(paths(results)).containsExactly(WEBSITE.path());
            assertThat(results.queryInfo()).isEqualTo(new QueryInfo(true, "website AND NOT jquery"));
            assertThat(results.sortedBy()).containsExactly(new SortCriterion(SortField.RELEVANCE, SortDirection.DESC));
        }

        @Test
        @DisplayName("Plain terms are not advanced syntax")
        void plainTerms() throws SearchException {
            final SearchResults results = engine.advancedSearch(AdvancedSearchQuery.ofRawQuery("website"),
                    SearchOptions.DEFAULTS);

            assertThat(paths(results)).contains(WEBSITE.path(), OLD_PROJECT.path());
            assertThat(results.queryInfo()).isNotNull();
            assertThat(results.queryInfo().usedAdvancedSyntax()).isFalse();
            assertThat(results.results().get(0).path()).isEqualTo(WEBSITE.path());
        }

        @Test
        @DisplayName("Base filters apply to boolean queries")
        void filtersApply() throws SearchException {
            final SearchResults results = engine.advancedSearch(
                    advanced(SearchQuery.builder().category(Category.ARCHIVES).build(), "website", List.of()),
                    SearchOptions.DEFAULTS);

            assertThat(paths(results)).containsExactly(OLD_PROJECT.path());
        }

        @Test
        @DisplayName("Syntax errors are reported with their kind")
        void syntaxError() {
            assertThatThrownBy(() -> engine.advancedSearch(AdvancedSearchQuery.ofRawQuery("(website"),
                    SearchOptions.DEFAULTS))
                    .isInstanceOf(QuerySyntaxException.class)
                    .extracting(e -> ((SearchException) e).getKind())
                    .isEqualTo(SearchErrorKind.QUERY_SYNTAX);
            assertThat(engine.getRuntimeStats().getRejectedSearches()).isEqualTo(1);
        }

        @Test
        @DisplayName("Explicit ordering by title and modification date")
        void sorting() throws SearchException {
            final SearchQuery everything = SearchQuery.builder().dateRange(since("2000-01-01T00:00:00Z")).build();
            final List<SortCriterion> byTitle = List.of(new SortCriterion(SortField.TITLE, SortDirection.ASC));
            final List<SortCriterion> byModified = List.of(new SortCriterion(SortField.MODIFIED, SortDirection.DESC));

            final SearchResults titleOrder = engine.advancedSearch(advanced(everything, null, byTitle),
                    SearchOptions.DEFAULTS);
            final SearchResults modifiedOrder = engine.advancedSearch(advanced(everything, null, byModified),
                    SearchOptions.DEFAULTS);

            assertThat(paths(titleOrder))
                    .containsExactly(HEALTH.path(), JAVASCRIPT.path(), OLD_PROJECT.path(), WEBSITE.path());
            assertThat(titleOrder.sortedBy()).isEqualTo(byTitle);
            assertThat(paths(modifiedOrder))
                    .containsExactly(WEBSITE.path(), JAVASCRIPT.path(), HEALTH.path(), OLD_PROJECT.path());
        }

        @Test
        @DisplayName("Similar documents exclude the reference")
        void similarTo() throws SearchException {
            final AdvancedSearchQuery query = new AdvancedSearchQuery(SearchQuery.builder().build(), null, null,
                    null, List.of(), WEBSITE.path(), false);

            final SearchResults results = engine.advancedSearch(query, SearchOptions.DEFAULTS);

            assertThat(paths(results)).doesNotContain(WEBSITE.path());
            assertThat(results.results()).allSatisfy(result ->
                    assertThat(result.relevanceScore()).isGreaterThan(30.0).isLessThanOrEqualTo(100.0));
            assertThat(engine.getRuntimeStats().getSearches(SearchKind.SIMILARITY)).isEqualTo(1);
        }

        @Test
        @DisplayName("Unknown reference document finds nothing")
        void unknownReference() throws SearchException {
            final AdvancedSearchQuery query = new AdvancedSearchQuery(SearchQuery.builder().build(), null, null,
                    null, List.of(), "projects/missing.md", false);

            assertThat(engine.advancedSearch(query, SearchOptions.DEFAULTS).totalCount()).isZero();
        }

        @Test
        @DisplayName("Suggestions are attached on request")
        void suggestions() throws SearchException {
            final AdvancedSearchQuery query = new AdvancedSearchQuery(SearchQuery.builder().build(), "webs", null,
                    null, List.of(), null, true);

            final SearchResults results = engine.advancedSearch(query, SearchOptions.DEFAULTS);

            assertThat(results.suggestions())
                    .hasSizeLessThanOrEqualTo(SearchEngine.ADVANCED_SUGGESTIONS)
                    .extracting(Suggestion::text)
                    .contains("website");
        }

        @Test
        @DisplayName("Without a query the flat fields are used")
        void flatFallback() throws SearchException {
            final SearchResults results = engine.advancedSearch(
                    advanced(SearchQuery.builder().tags("javascript").build(), null, List.of()),
                    SearchOptions.DEFAULTS);

            assertThat(paths(results)).containsExactly(JAVASCRIPT.path());
            assertThat(results.queryInfo()).isNull();
        }
    }

    @Nested
    @DisplayName("Presentation")
    class Presentation {

        @Test
        @DisplayName("Snippets highlight the content term")
        void snippets() throws SearchException {
            final SearchResults results = engine.search(SearchQuery.builder().content("launches").build(),
                    SearchSettings.DEFAULTS.defaultOptions().withSnippets(true));

            assertThat(results.results()).hasSize(1);
            assertThat(results.results().get(0).snippet()).contains("**launches**");
        }

        @Test
        @DisplayName("Facets cover all matches, not only the page")
        void facets() throws SearchException {
            final SearchResults results = engine.search(
                    SearchQuery.builder().tags("project").limit(1).build(),
                    SearchOptions.DEFAULTS.withFacets(List.of(FacetType.CATEGORY)));

            assertThat(results.results()).hasSize(1);
            assertThat(results.facets()).hasSize(1);
            final Facet facet = results.facets().get(0);
            assertThat(facet.field()).isEqualTo(FacetType.CATEGORY);
            assertThat(facet.values())
                    .extracting(FacetValue::value, FacetValue::count)
                    .containsExactlyInAnyOrder(tuple("projects", 1), tuple("archives", 1));
        }
    }

    @Nested
    @DisplayName("Index maintenance")
    class Maintenance {

        @Test
        @DisplayName("Updated documents become searchable")
        void update() throws SearchException {
            // Given
            store.put(IndexedDocument.of("projects/mobile-app.md", "Mobile App", "Build the kotlin app.",
                    List.of("kotlin"), Category.PROJECTS, null, null));

            // When
            final boolean updated = engine.updateDocument("projects/mobile-app.md");

            // Then
            assertThat(updated).isTrue();
            assertThat(paths(engine.search(SearchQuery.builder().tags("kotlin").build())))
                    .containsExactly("projects/mobile-app.md");
            assertThat(engine.getIndexStats().categories()).containsEntry(Category.PROJECTS, 2);
            assertThat(engine.getSuggestions("mobi", 5)).extracting(Suggestion::text).contains("mobile");
        }

        @Test
        @DisplayName("Updating a vanished document removes it")
        void updateVanished() {
            store.remove(HEALTH.path());

            assertThat(engine.updateDocument(HEALTH.path())).isFalse();
            assertThat(engine.getDocument(HEALTH.path())).isEmpty();
            assertThat(engine.getIndexStats().documentCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("Removal reports whether the document was indexed")
        void remove() {
            assertThat(engine.removeDocument(WEBSITE.path())).isTrue();
            assertThat(engine.removeDocument(WEBSITE.path())).isFalse();
            assertThat(engine.getDocument(WEBSITE.path())).isEmpty();
            assertThat(engine.getDocument(HEALTH.path())).contains(HEALTH);
        }

        @Test
        @DisplayName("Rebuild picks up store changes")
        void rebuild() throws SearchException {
            store.remove(OLD_PROJECT.path());

            assertThat(engine.rebuildIndex()).isEqualTo(3);
            assertThat(engine.getIndexStats().categories()).containsEntry(Category.ARCHIVES, 0);
        }
    }

    @Nested
    @DisplayName("Store failures")
    class StoreFailures {

        @Test
        @DisplayName("Failing enumeration is an index error")
        void listFailure() throws IOException {
            final DocumentStore failing = mock(DocumentStore.class);
            when(failing.list()).thenThrow(new IOException("disk gone"));
            final SearchEngine broken = new SearchEngine(failing);

            assertThatThrownBy(broken::initialize)
                    .isInstanceOf(SearchException.class)
                    .extracting(e -> ((SearchException) e).getKind())
                    .isEqualTo(SearchErrorKind.INDEX_ERROR);
            assertThatThrownBy(() -> broken.search(SearchQuery.builder().tags("web").build()))
                    .isInstanceOf(SearchException.class);
            assertThat(broken.isInitialized()).isFalse();
        }

        @Test
        @DisplayName("Unreadable documents are skipped")
        void readFailure() throws IOException, SearchException {
            final DocumentStore flaky = mock(DocumentStore.class);
            when(flaky.list()).thenReturn(List.of("broken.md", WEBSITE.path(), "io.md"));
            when(flaky.read("broken.md")).thenThrow(new DocumentParseException("broken.md", "bad yaml"));
            when(flaky.read(WEBSITE.path())).thenReturn(WEBSITE);
            when(flaky.read("io.md")).thenThrow(new IOException("permission denied"));
            final SearchEngine partial = new SearchEngine(flaky);

            assertThat(partial.rebuildIndex()).isEqualTo(1);
            assertThat(partial.getDocument(WEBSITE.path())).contains(WEBSITE);
        }

        @Test
        @DisplayName("Unexpected runtime failures skip only the affected document")
        void runtimeFailure() throws IOException, SearchException {
            final DocumentStore flaky = mock(DocumentStore.class);
            when(flaky.list()).thenReturn(List.of("odd.md", WEBSITE.path()));
            when(flaky.read("odd.md")).thenThrow(new IllegalStateException("unexpected"));
            when(flaky.read(WEBSITE.path())).thenReturn(WEBSITE);
            final SearchEngine partial = new SearchEngine(flaky);

            assertThat(partial.rebuildIndex()).isEqualTo(1);
            assertThat(partial.updateDocument("odd.md")).isFalse();
            assertThat(partial.getIndexStats().documentCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("A note with unconvertible frontmatter does not stop the build")
        void malformedNoteOnDisk(@TempDir final Path root) throws IOException, SearchException {
            // Given
            Files.createDirectories(root.resolve("projects"));
            Files.writeString(root.resolve("projects/good.md"), "---\ntitle: Good\n---\nFine note");
            Files.writeString(root.resolve("projects/typed.md"), "---\ntitle: !!int abc\n---\nBroken note");
            final SearchEngine fromDisk = new SearchEngine(new MarkdownDocumentStore(root));

            // When
            final int count = fromDisk.rebuildIndex();

            // Then
            assertThat(count).isEqualTo(1);
            assertThat(fromDisk.getDocument("projects/good.md")).isPresent();
            assertThat(fromDisk.getDocument("projects/typed.md")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class Concurrency {

        private static final IndexedDocument FIRST = IndexedDocument.of("areas/first.md", "First v1", "first version",
                List.of("alpha"), Category.AREAS, null, null);
        private static final IndexedDocument SECOND = IndexedDocument.of("areas/second.md", "Second", "other",
                List.of("alpha"), Category.AREAS, null, null);

        private final CountDownLatch readingSecond = new CountDownLatch(1);
        private final CountDownLatch release = new CountDownLatch(1);

        /**
         * Blocks the first read of SECOND until released, so a rebuild can be held in the middle.
         */
        private final InMemoryDocumentStore blocking = new InMemoryDocumentStore(FIRST, SECOND) {
            @Override
            public IndexedDocument read(final String path) throws NoSuchFileException {
                if (path.equals(SECOND.path()) && readingSecond.getCount() > 0) {
                    readingSecond.countDown();
                    try {
                        release.await(10, TimeUnit.SECONDS);
                    } catch (final InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                return super.read(path);
            }
        };

        private void awaitBlockedOrDone(final Thread thread) throws InterruptedException {
            final long deadline = System.currentTimeMillis() + 10_000;
            while (thread.getState() != Thread.State.BLOCKED && thread.getState() != Thread.State.TERMINATED
                    && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
        }

        @Test
        @DisplayName("An update issued during a rebuild is not lost")
        void updateDuringRebuild() throws Exception {
            // Given: a rebuild that has read FIRST and waits on SECOND
            final SearchEngine concurrent = new SearchEngine(blocking);
            final Thread rebuild = new Thread(() -> {
                try {
                    concurrent.rebuildIndex();
                } catch (final SearchException e) {
                    throw new IllegalStateException(e);
                }
            });
            rebuild.start();
            assertThat(readingSecond.await(10, TimeUnit.SECONDS)).isTrue();

            // When: FIRST changes and is updated while the rebuild is still running
            blocking.put(IndexedDocument.of(FIRST.path(), "First v2", "second version", List.of("alpha"),
                    Category.AREAS, null, null));
            final Thread update = new Thread(() -> concurrent.updateDocument(FIRST.path()));
            update.start();
            awaitBlockedOrDone(update);
            release.countDown();
            rebuild.join(10_000);
            update.join(10_000);

            // Then
            assertThat(concurrent.getDocument(FIRST.path())).map(IndexedDocument::title).contains("First v2");
            assertThat(concurrent.getIndexStats().documentCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("Searches during a rebuild see the previous index")
        void searchDuringRebuild() throws Exception {
            // Given: an index of both documents, then SECOND leaves the store
            final CountDownLatch listing = new CountDownLatch(1);
            final CountDownLatch listRelease = new CountDownLatch(1);
            final AtomicBoolean holdListing = new AtomicBoolean();
            final InMemoryDocumentStore slowList = new InMemoryDocumentStore(FIRST, SECOND) {
                @Override
                public List<String> list() {
                    if (holdListing.get()) {
                        listing.countDown();
                        try {
                            listRelease.await(10, TimeUnit.SECONDS);
                        } catch (final InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                    }
                    return super.list();
                }
            };
            final SearchEngine concurrent = new SearchEngine(slowList);
            concurrent.initialize();
            slowList.remove(SECOND.path());
            holdListing.set(true);

            // When: a search runs while the rebuild is in progress
            final Thread rebuild = new Thread(() -> {
                try {
                    concurrent.rebuildIndex();
                } catch (final SearchException e) {
                    throw new IllegalStateException(e);
                }
            });
            rebuild.start();
            assertThat(listing.await(10, TimeUnit.SECONDS)).isTrue();
            final SearchResults during = concurrent.search(SearchQuery.builder().tags("alpha").build());
            listRelease.countDown();
            rebuild.join(10_000);
            final SearchResults after = concurrent.search(SearchQuery.builder().tags("alpha").build());

            // Then
            assertThat(during.totalCount()).isEqualTo(2);
            assertThat(after.totalCount()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Directory removal")
    class DirectoryRemoval {

        @Test
        @DisplayName("Removes every document below a directory")
        void removeUnder() {
            assertThat(engine.removeDocumentsUnder("projects")).isEqualTo(1);
            assertThat(engine.removeDocumentsUnder("projects/")).isZero();
            assertThat(engine.removeDocumentsUnder("area")).isZero();
            assertThat(engine.getIndexStats().documentCount()).isEqualTo(3);
            assertThat(engine.getDocument(HEALTH.path())).isPresent();
        }
    }

    @Test
    @DisplayName("Runtime statistics count each search kind")
    void runtimeStats() throws SearchException {
        engine.search(SearchQuery.builder().tags("project").build());
        engine.advancedSearch(AdvancedSearchQuery.ofRawQuery("website"), SearchOptions.DEFAULTS);

        final SearchRuntimeStats stats = engine.getRuntimeStats();
        assertThat(stats.getTotalSearches()).isEqualTo(2);
        assertThat(stats.getSearches(SearchKind.SIMPLE)).isEqualTo(1);
        assertThat(stats.getSearches(SearchKind.ADVANCED)).isEqualTo(1);
        assertThat(stats.getTotalHitCount()).isGreaterThanOrEqualTo(4);
    }
}
