package de.mirkosertic.mcp.notesearch.mcp.dto;

import de.mirkosertic.mcp.notesearch.SearchRuntimeStats;
import de.mirkosertic.mcp.notesearch.index.Category;
import de.mirkosertic.mcp.notesearch.index.IndexStats;
import org.jspecify.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Response DTO for the getIndexStats tool.
 */
public record IndexStatsResponse(
        boolean success,
        int documentCount,
        @Nullable Map<String, Integer> categories,
        @Nullable String contextRoot,
        @Nullable String softwareVersion,
        @Nullable String buildTimestamp,
        @Nullable SearchRuntimeMetrics searchRuntimeMetrics,
        @Nullable String error
) {

    /**
     * Aggregate search performance statistics.
     */
    public record SearchRuntimeMetrics(
            long totalSearches,
            long simpleSearches,
            long advancedSearches,
            long similaritySearches,
            long rejectedSearches,
            String averageDurationMs,
            @Nullable Long minDurationMs,
            long maxDurationMs,
            String averageHitCount,
            @Nullable Long p50Ms,
            @Nullable Long p75Ms,
            @Nullable Long p90Ms,
            @Nullable Long p95Ms,
            @Nullable Long p99Ms
    ) {
        public static SearchRuntimeMetrics of(final SearchRuntimeStats stats) {
            final SearchRuntimeStats.Percentiles percentiles = stats.getPercentiles();
            final long total = stats.getTotalSearches();
            return new SearchRuntimeMetrics(
                    total,
                    stats.getSearches(SearchRuntimeStats.SearchKind.SIMPLE),
                    stats.getSearches(SearchRuntimeStats.SearchKind.ADVANCED),
                    stats.getSearches(SearchRuntimeStats.SearchKind.SIMILARITY),
                    stats.getRejectedSearches(),
                    String.format(Locale.ROOT, "%.2f", stats.getAverageDurationMs()),
                    total > 0 ? stats.getMinDurationMs() : null,
                    stats.getMaxDurationMs(),
                    String.format(Locale.ROOT, "%.2f", stats.getAverageHitCount()),
                    percentiles != null ? percentiles.p50() : null,
                    percentiles != null ? percentiles.p75() : null,
                    percentiles != null ? percentiles.p90() : null,
                    percentiles != null ? percentiles.p95() : null,
                    percentiles != null ? percentiles.p99() : null);
        }
    }

    public static IndexStatsResponse success(final IndexStats stats, final String contextRoot,
                                             final String softwareVersion, final String buildTimestamp,
                                             final SearchRuntimeMetrics searchRuntimeMetrics) {
        final Map<String, Integer> categories = new LinkedHashMap<>();
        for (final Category category : Category.values()) {
            categories.put(category.label(), stats.categories().getOrDefault(category, 0));
        }
        return new IndexStatsResponse(true, stats.documentCount(), categories, contextRoot, softwareVersion,
                buildTimestamp, searchRuntimeMetrics, null);
    }

    public static IndexStatsResponse error(final String errorMessage) {
        return new IndexStatsResponse(false, 0, null, null, null, null, null, errorMessage);
    }
}
