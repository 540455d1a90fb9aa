package de.mirkosertic.mcp.notesearch.facet;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;

/**
 * Age buckets of the date range facet. Each bucket covers {@code [lowerDays, upperDays)} of age, a document
 * falls into the most recent bucket that contains its age. Future dates count as age 0.
 */
public enum DateBucket {

    TODAY("today", "Today", 0, 1),
    LAST_7_DAYS("last-7-days", "Last 7 days", 1, 7),
    LAST_30_DAYS("last-30-days", "Last 30 days", 7, 30),
    LAST_YEAR("last-year", "Last year", 30, 365),
    OLDER("older", "Older", 365, Double.POSITIVE_INFINITY);

    private static final double MILLIS_PER_DAY = 86_400_000.0;

    private final String key;
    private final String label;
    private final double lowerDays;
    private final double upperDays;

    DateBucket(final String key, final String label, final double lowerDays, final double upperDays) {
        this.key = key;
        this.label = label;
        this.lowerDays = lowerDays;
        this.upperDays = upperDays;
    }

    public String key() {
        return key;
    }

    public String label() {
        return label;
    }

    public static DateBucket of(final Instant date, final Instant now) {
        final double ageDays = Math.max(0.0, Duration.between(date, now).toMillis() / MILLIS_PER_DAY);
        for (final DateBucket bucket : values()) {
            if (ageDays >= bucket.lowerDays && ageDays < bucket.upperDays) {
                return bucket;
            }
        }
        return OLDER;
    }

    public static @Nullable DateBucket fromKey(final @Nullable String key) {
        if (key == null) {
            return null;
        }
        for (final DateBucket bucket : values()) {
            if (bucket.key.equalsIgnoreCase(key.trim())) {
                return bucket;
            }
        }
        return null;
    }
}
