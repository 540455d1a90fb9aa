package de.mirkosertic.mcp.notesearch;

import org.jspecify.annotations.Nullable;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe aggregate statistics of executed searches.
 *
 * <p>Counters are atomic so recording stays lock-free on the hot path. The durations of the last
 * {@value #BUFFER_SIZE} searches are kept in a circular buffer, guarded by a dedicated lock, for
 * percentile computation.</p>
 */
public class SearchRuntimeStats {

    static final int BUFFER_SIZE = 1000;

    /**
     * How a search was answered.
     */
    public enum SearchKind {
        SIMPLE,
        ADVANCED,
        SIMILARITY
    }

    private final AtomicLong totalSearches = new AtomicLong(0);
    private final AtomicLong totalDurationMs = new AtomicLong(0);
    private final AtomicLong totalHitCount = new AtomicLong(0);
    private final AtomicLong minDurationMs = new AtomicLong(Long.MAX_VALUE);
    private final AtomicLong maxDurationMs = new AtomicLong(0);
    private final AtomicLong rejectedSearches = new AtomicLong(0);
    private final Map<SearchKind, AtomicLong> searchesByKind = new EnumMap<>(SearchKind.class);

    private final long[] buffer = new long[BUFFER_SIZE];
    private int bufferIndex = 0;
    private boolean bufferFilled = false;
    private final Object lock = new Object();

    public SearchRuntimeStats() {
        for (final SearchKind kind : SearchKind.values()) {
            searchesByKind.put(kind, new AtomicLong(0));
        }
    }

    /**
     * Percentiles of the last recorded search durations in milliseconds.
     */
    public record Percentiles(long p50, long p75, long p90, long p95, long p99) {
    }

    /**
     * Records a completed search.
     *
     * @param kind       how the search was answered
     * @param durationMs wall-clock duration in milliseconds
     * @param totalHits  number of matching documents before pagination
     */
    public void recordSearch(final SearchKind kind, final long durationMs, final long totalHits) {
        totalSearches.incrementAndGet();
        searchesByKind.get(kind).incrementAndGet();
        totalDurationMs.addAndGet(durationMs);
        totalHitCount.addAndGet(totalHits);

        long current;
        do {
            current = minDurationMs.get();
            if (durationMs >= current) break;
        } while (!minDurationMs.compareAndSet(current, durationMs));

        do {
            current = maxDurationMs.get();
            if (durationMs <= current) break;
        } while (!maxDurationMs.compareAndSet(current, durationMs));

        synchronized (lock) {
            buffer[bufferIndex] = durationMs;
            bufferIndex = (bufferIndex + 1) % BUFFER_SIZE;
            if (!bufferFilled && bufferIndex == 0) {
                bufferFilled = true;
            }
        }
    }

    /**
     * Records a search that failed validation or parsing.
     */
    public void recordRejected() {
        rejectedSearches.incrementAndGet();
    }

    /**
     * @return percentiles, or null if nothing has been recorded yet
     */
    public @Nullable Percentiles getPercentiles() {
        final long[] snapshot;
        final int count;

        synchronized (lock) {
            count = bufferFilled ? BUFFER_SIZE : bufferIndex;
            if (count == 0) {
                return null;
            }
            snapshot = Arrays.copyOf(buffer, count);
        }

        Arrays.sort(snapshot);
        return new Percentiles(
                percentileValue(snapshot, 50),
                percentileValue(snapshot, 75),
                percentileValue(snapshot, 90),
                percentileValue(snapshot, 95),
                percentileValue(snapshot, 99));
    }

    private static long percentileValue(final long[] sortedData, final int percentile) {
        final int index = (int) Math.ceil(percentile / 100.0 * sortedData.length) - 1;
        return sortedData[Math.max(0, Math.min(index, sortedData.length - 1))];
    }

    public void reset() {
        totalSearches.set(0);
        totalDurationMs.set(0);
        totalHitCount.set(0);
        minDurationMs.set(Long.MAX_VALUE);
        maxDurationMs.set(0);
        rejectedSearches.set(0);
        searchesByKind.values().forEach(counter -> counter.set(0));
        synchronized (lock) {
            bufferIndex = 0;
            bufferFilled = false;
            Arrays.fill(buffer, 0L);
        }
    }

    public long getTotalSearches() {
        return totalSearches.get();
    }

    public long getSearches(final SearchKind kind) {
        return searchesByKind.get(kind).get();
    }

    public long getRejectedSearches() {
        return rejectedSearches.get();
    }

    public long getTotalDurationMs() {
        return totalDurationMs.get();
    }

    public long getTotalHitCount() {
        return totalHitCount.get();
    }

    /**
     * {@link Long#MAX_VALUE} while nothing has been recorded.
     */
    public long getMinDurationMs() {
        return minDurationMs.get();
    }

    public long getMaxDurationMs() {
        return maxDurationMs.get();
    }

    public double getAverageDurationMs() {
        final long searches = totalSearches.get();
        if (searches == 0) {
            return 0.0;
        }
        return (double) totalDurationMs.get() / searches;
    }

    public double getAverageHitCount() {
        final long searches = totalSearches.get();
        if (searches == 0) {
            return 0.0;
        }
        return (double) totalHitCount.get() / searches;
    }
}
