package de.mirkosertic.mcp.notesearch.index;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Flat, field based query.
 *
 * @param tags      tags to match, case-insensitive
 * @param content   phrase searched in the document body
 * @param title     text matched against the title
 * @param category  restricts results to one PARA category
 * @param dateRange restricts results by modification (else creation) date
 * @param operator  combination of the category and date filters, AND when absent
 * @param limit     page size, defaults to {@link #DEFAULT_LIMIT}
 * @param offset    number of results to skip, defaults to 0
 */
public record SearchQuery(
        @Nullable List<String> tags,
        @Nullable String content,
        @Nullable String title,
        @Nullable Category category,
        @Nullable DateRange dateRange,
        @Nullable Operator operator,
        @Nullable Integer limit,
        @Nullable Integer offset
) {

    public static final int DEFAULT_LIMIT = 20;

    public SearchQuery {
        // null elements are kept so validation can reject them
        tags = tags != null ? Collections.unmodifiableList(new ArrayList<>(tags)) : null;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * True if tags, title or content carry something to score against.
     */
    public boolean hasTextCriteria() {
        return (tags != null && !tags.isEmpty())
                || (content != null && !content.isBlank())
                || (title != null && !title.isBlank());
    }

    public boolean hasFilterCriteria() {
        return category != null || (dateRange != null && !dateRange.isUnbounded());
    }

    public boolean hasCriteria() {
        return hasTextCriteria() || hasFilterCriteria();
    }

    public int effectiveLimit() {
        return limit != null ? limit : DEFAULT_LIMIT;
    }

    public int effectiveOffset() {
        return offset != null ? offset : 0;
    }

    public Operator effectiveOperator() {
        return operator != null ? operator : Operator.AND;
    }

    public static final class Builder {

        private List<String> tags;
        private String content;
        private String title;
        private Category category;
        private DateRange dateRange;
        private Operator operator;
        private Integer limit;
        private Integer offset;

        private Builder() {
        }

        public Builder tags(final List<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder tags(final String... tags) {
            this.tags = List.of(tags);
            return this;
        }

        public Builder content(final String content) {
            this.content = content;
            return this;
        }

        public Builder title(final String title) {
            this.title = title;
            return this;
        }

        public Builder category(final Category category) {
            this.category = category;
            return this;
        }

        public Builder dateRange(final DateRange dateRange) {
            this.dateRange = dateRange;
            return this;
        }

        public Builder operator(final Operator operator) {
            this.operator = operator;
            return this;
        }

        public Builder limit(final Integer limit) {
            this.limit = limit;
            return this;
        }

        public Builder offset(final Integer offset) {
            this.offset = offset;
            return this;
        }

        public SearchQuery build() {
            return new SearchQuery(tags, content, title, category, dateRange, operator, limit, offset);
        }
    }
}
