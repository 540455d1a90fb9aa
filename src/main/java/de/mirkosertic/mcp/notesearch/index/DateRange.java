package de.mirkosertic.mcp.notesearch.index;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * Inclusive date interval, either bound may be open.
 */
public record DateRange(@Nullable Instant start, @Nullable Instant end) {

    public boolean isUnbounded() {
        return start == null && end == null;
    }

    public boolean contains(final Instant instant) {
        if (start != null && instant.isBefore(start)) {
            return false;
        }
        return end == null || !instant.isAfter(end);
    }
}
