package de.mirkosertic.mcp.notesearch;

/**
 * Machine readable classification of a {@link SearchException}.
 */
public enum SearchErrorKind {

    /** No search criterion besides pagination was supplied. */
    INVALID_QUERY,

    /** Date range start is not before its end. */
    INVALID_DATE_RANGE,

    INVALID_LIMIT,

    INVALID_OFFSET,

    /** The raw query text violates the query grammar. */
    QUERY_SYNTAX,

    /** The index could not be built from the document store. */
    INDEX_ERROR
}
