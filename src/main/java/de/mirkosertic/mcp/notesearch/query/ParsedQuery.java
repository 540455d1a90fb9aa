package de.mirkosertic.mcp.notesearch.query;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured boolean query.
 *
 * @param must    every clause is required
 * @param should  optional clauses contributing partial credit
 * @param mustNot any matching clause excludes the document
 */
public record ParsedQuery(List<Clause> must, List<Clause> should, List<Clause> mustNot) {

    private static final ParsedQuery EMPTY = new ParsedQuery(List.of(), List.of(), List.of());

    public ParsedQuery {
        must = must != null ? List.copyOf(must) : List.of();
        should = should != null ? List.copyOf(should) : List.of();
        mustNot = mustNot != null ? List.copyOf(mustNot) : List.of();
    }

    public static ParsedQuery empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return must.isEmpty() && should.isEmpty() && mustNot.isEmpty();
    }

    /**
     * All clauses in must, should, mustNot order.
     */
    public List<Clause> allClauses() {
        final List<Clause> all = new ArrayList<>(must.size() + should.size() + mustNot.size());
        all.addAll(must);
        all.addAll(should);
        all.addAll(mustNot);
        return all;
    }
}
