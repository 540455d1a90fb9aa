package de.mirkosertic.mcp.notesearch.query;

import de.mirkosertic.mcp.notesearch.SearchErrorKind;
import de.mirkosertic.mcp.notesearch.SearchException;

/**
 * Signals a violation of the query grammar, for example an unmatched opening parenthesis.
 */
public class QuerySyntaxException extends SearchException {

    private final String query;
    private final int position;

    public QuerySyntaxException(final String message, final String query, final int position) {
        super(SearchErrorKind.QUERY_SYNTAX, message + " at position " + position + " in query: " + query);
        this.query = query;
        this.position = position;
    }

    public String getQuery() {
        return query;
    }

    /**
     * Character offset into the query where the problem was detected.
     */
    public int getPosition() {
        return position;
    }
}
