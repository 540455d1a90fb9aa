package de.mirkosertic.mcp.notesearch;

import de.mirkosertic.mcp.notesearch.config.BuildInfo;
import de.mirkosertic.mcp.notesearch.index.IndexedDocument;
import de.mirkosertic.mcp.notesearch.index.SearchEngine;
import de.mirkosertic.mcp.notesearch.index.SearchResults;
import de.mirkosertic.mcp.notesearch.mcp.SchemaGenerator;
import de.mirkosertic.mcp.notesearch.mcp.ToolResultHelper;
import de.mirkosertic.mcp.notesearch.mcp.dto.AdvancedSearchRequest;
import de.mirkosertic.mcp.notesearch.mcp.dto.FindSimilarRequest;
import de.mirkosertic.mcp.notesearch.mcp.dto.GetDocumentRequest;
import de.mirkosertic.mcp.notesearch.mcp.dto.GetDocumentResponse;
import de.mirkosertic.mcp.notesearch.mcp.dto.IndexStatsResponse;
import de.mirkosertic.mcp.notesearch.mcp.dto.PopularSearchesRequest;
import de.mirkosertic.mcp.notesearch.mcp.dto.RebuildIndexResponse;
import de.mirkosertic.mcp.notesearch.mcp.dto.SearchRequest;
import de.mirkosertic.mcp.notesearch.mcp.dto.SearchResponse;
import de.mirkosertic.mcp.notesearch.mcp.dto.SuggestRequest;
import de.mirkosertic.mcp.notesearch.mcp.dto.SuggestResponse;
import de.mirkosertic.mcp.notesearch.suggest.Suggestion;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * MCP tools for searching the markdown knowledge base.
 */
public class NoteSearchTools {

    private static final Logger logger = LoggerFactory.getLogger(NoteSearchTools.class);

    private static final String SEARCH_DESCRIPTION = """
            Search the markdown knowledge base (PARA layout: projects, areas, resources, archives) by tags, \
            title and content. Exact tag matches weigh most, then title matches, then content occurrences; \
            recently modified notes get a small boost. Filter by category and date range, combined with \
            operator 'and' (default) or 'or'. At least one criterion is required. \
            Returns: paginated results with relevance scores (0-100), optional snippets and facets.""";

    private static final String ADVANCED_SEARCH_DESCRIPTION = """
            Boolean and fuzzy search over the knowledge base. rawQuery supports -excluded terms, \
            "exact phrases", field prefixes (title:, content:, tags:), wildcards (proj*), AND/OR/NOT \
            and parentheses. Plain terms are fuzzy and tolerate typos, fuzzyTolerance sets how close \
            they must be. Alternatively pass similarTo with a note path to find related \
            notes. Supports multi-key sorting, facets, suggestions and the same filters as search.""";

    private final SearchEngine searchEngine;
    private final Path contextRoot;

    public NoteSearchTools(final SearchEngine searchEngine, final Path contextRoot) {
        this.searchEngine = searchEngine;
        this.contextRoot = contextRoot;
    }

    /**
     * Returns all MCP tool specifications for registration with the MCP server.
     */
    public List<McpServerFeatures.SyncToolSpecification> getToolSpecifications() {
        final List<McpServerFeatures.SyncToolSpecification> tools = new ArrayList<>();

        tools.add(tool("search", SEARCH_DESCRIPTION,
                SchemaGenerator.generateSchema(SearchRequest.class), this::search));

        tools.add(tool("advancedSearch", ADVANCED_SEARCH_DESCRIPTION,
                SchemaGenerator.generateSchema(AdvancedSearchRequest.class), this::advancedSearch));

        tools.add(tool("suggest",
                "Complete a partially typed query from note titles, tags and content phrases. "
                        + "Adds spelling corrections when few completions exist.",
                SchemaGenerator.generateSchema(SuggestRequest.class), this::suggest));

        tools.add(tool("popularSearches",
                "List the most frequent title words and tags of the knowledge base.",
                SchemaGenerator.generateSchema(PopularSearchesRequest.class), this::popularSearches));

        tools.add(tool("findSimilar",
                "Find notes similar to a given note by title, shared tags and content keywords.",
                SchemaGenerator.generateSchema(FindSimilarRequest.class), this::findSimilar));

        tools.add(tool("getDocument",
                "Get the full content and metadata of a note by its path.",
                SchemaGenerator.generateSchema(GetDocumentRequest.class), this::getDocument));

        tools.add(tool("getIndexStats",
                "Get the number of indexed notes per category, the server version and search performance statistics.",
                SchemaGenerator.emptySchema(), args -> getIndexStats()));

        tools.add(tool("rebuildIndex",
                "Re-read all notes from disk and rebuild the search index.",
                SchemaGenerator.emptySchema(), args -> rebuildIndex()));

        return tools;
    }

    private static McpServerFeatures.SyncToolSpecification tool(final String name, final String description,
            final McpSchema.JsonSchema schema,
            final Function<Map<String, Object>, McpSchema.CallToolResult> handler) {
        return McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name(name)
                        .description(description)
                        .inputSchema(schema)
                        .build())
                .callHandler((exchange, request) ->
                        handler.apply(request.arguments() != null ? request.arguments() : Map.of()))
                .build();
    }

    McpSchema.CallToolResult search(final Map<String, Object> args) {
        try {
            final SearchRequest request = SearchRequest.fromMap(args);
            logger.info("Search request: tags={}, title='{}', content='{}', category={}, limit={}, offset={}",
                    request.tags(), request.title(), request.content(), request.category(), request.limit(),
                    request.offset());

            final SearchResults results = searchEngine.search(request.toSearchQuery(),
                    request.toSearchOptions(searchEngine.getSettings().defaultOptions()));

            logger.info("Search completed in {}ms: {} total hits, returning {}",
                    results.executionTimeMs(), results.totalCount(), results.results().size());
            return ToolResultHelper.createResult(SearchResponse.success(results));

        } catch (final SearchException e) {
            logger.warn("Search rejected: {}", e.getMessage());
            return ToolResultHelper.createResult(SearchResponse.error(e.getMessage(), e.getKind()));
        } catch (final IllegalArgumentException e) {
            logger.warn("Invalid search request: {}", e.getMessage());
            return ToolResultHelper.createResult(
                    SearchResponse.error(e.getMessage(), SearchErrorKind.INVALID_QUERY));
        } catch (final RuntimeException e) {
            logger.error("Search error", e);
            return ToolResultHelper.createResult(SearchResponse.error("Search error: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult advancedSearch(final Map<String, Object> args) {
        try {
            final AdvancedSearchRequest request = AdvancedSearchRequest.fromMap(args);
            logger.info("Advanced search request: rawQuery='{}', similarTo={}, sortBy={}, limit={}, offset={}",
                    request.rawQuery(), request.similarTo(), request.sortBy(), request.limit(), request.offset());

            final SearchResults results = searchEngine.advancedSearch(request.toAdvancedSearchQuery(),
                    request.toSearchOptions(searchEngine.getSettings().defaultOptions()));

            logger.info("Advanced search completed in {}ms: {} total hits, returning {}",
                    results.executionTimeMs(), results.totalCount(), results.results().size());
            return ToolResultHelper.createResult(SearchResponse.success(results));

        } catch (final SearchException e) {
            logger.warn("Advanced search rejected: {}", e.getMessage());
            return ToolResultHelper.createResult(SearchResponse.error(e.getMessage(), e.getKind()));
        } catch (final IllegalArgumentException e) {
            logger.warn("Invalid advanced search request: {}", e.getMessage());
            return ToolResultHelper.createResult(
                    SearchResponse.error(e.getMessage(), SearchErrorKind.INVALID_QUERY));
        } catch (final RuntimeException e) {
            logger.error("Advanced search error", e);
            return ToolResultHelper.createResult(SearchResponse.error("Search error: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult suggest(final Map<String, Object> args) {
        try {
            final SuggestRequest request = SuggestRequest.fromMap(args);
            final List<Suggestion> suggestions = searchEngine.getSuggestions(request.prefix(),
                    request.effectiveLimit(searchEngine.getSettings().maxSuggestions()));
            logger.info("Suggest '{}': {} suggestions", request.prefix(), suggestions.size());
            return ToolResultHelper.createResult(SuggestResponse.success(suggestions));

        } catch (final RuntimeException e) {
            logger.error("Error computing suggestions", e);
            return ToolResultHelper.createResult(SuggestResponse.error("Error computing suggestions: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult popularSearches(final Map<String, Object> args) {
        try {
            final PopularSearchesRequest request = PopularSearchesRequest.fromMap(args);
            final List<Suggestion> popular = searchEngine.getPopularSearches(
                    request.effectiveLimit(searchEngine.getSettings().maxSuggestions()));
            logger.info("Popular searches: {} entries", popular.size());
            return ToolResultHelper.createResult(SuggestResponse.success(popular));

        } catch (final RuntimeException e) {
            logger.error("Error computing popular searches", e);
            return ToolResultHelper.createResult(
                    SuggestResponse.error("Error computing popular searches: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult findSimilar(final Map<String, Object> args) {
        try {
            final FindSimilarRequest request = FindSimilarRequest.fromMap(args);
            logger.info("Find similar request: path={}, limit={}", request.path(), request.limit());

            final SearchResults results = searchEngine.advancedSearch(request.toAdvancedSearchQuery(),
                    searchEngine.getSettings().defaultOptions());

            logger.info("Found {} notes similar to {}", results.totalCount(), request.path());
            return ToolResultHelper.createResult(SearchResponse.success(results));

        } catch (final SearchException e) {
            logger.warn("Find similar rejected: {}", e.getMessage());
            return ToolResultHelper.createResult(SearchResponse.error(e.getMessage(), e.getKind()));
        } catch (final RuntimeException e) {
            logger.error("Find similar error", e);
            return ToolResultHelper.createResult(SearchResponse.error("Search error: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult getDocument(final Map<String, Object> args) {
        try {
            final GetDocumentRequest request = GetDocumentRequest.fromMap(args);
            final Optional<IndexedDocument> document = searchEngine.getDocument(request.path());
            if (document.isEmpty()) {
                logger.info("Document not found: {}", request.path());
                return ToolResultHelper.createResult(GetDocumentResponse.error("Document not found: " + request.path()));
            }
            return ToolResultHelper.createResult(GetDocumentResponse.success(document.get()));

        } catch (final RuntimeException e) {
            logger.error("Error getting document", e);
            return ToolResultHelper.createResult(GetDocumentResponse.error("Error getting document: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult getIndexStats() {
        logger.info("Index stats request");

        try {
            final IndexStatsResponse response = IndexStatsResponse.success(
                    searchEngine.getIndexStats(),
                    contextRoot.toString(),
                    BuildInfo.getVersion(),
                    BuildInfo.getBuildTimestamp(),
                    IndexStatsResponse.SearchRuntimeMetrics.of(searchEngine.getRuntimeStats()));

            logger.info("Index stats: {} documents", response.documentCount());
            return ToolResultHelper.createResult(response);

        } catch (final RuntimeException e) {
            logger.error("Error getting index stats", e);
            return ToolResultHelper.createResult(IndexStatsResponse.error("Error getting index stats: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult rebuildIndex() {
        logger.info("Rebuild index request");

        try {
            final long start = System.nanoTime();
            final int documentCount = searchEngine.rebuildIndex();
            final long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            return ToolResultHelper.createResult(RebuildIndexResponse.success(documentCount, durationMs));

        } catch (final SearchException e) {
            logger.error("Error rebuilding index", e);
            return ToolResultHelper.createResult(RebuildIndexResponse.error(e.getMessage()));
        }
    }
}
