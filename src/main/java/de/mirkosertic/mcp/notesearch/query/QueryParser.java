package de.mirkosertic.mcp.notesearch.query;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the boolean query language into a {@link ParsedQuery}.
 *
 * <h2>Syntax</h2>
 * <ul>
 *   <li>Terms separated by whitespace are combined with an implicit {@code AND}</li>
 *   <li>{@code AND}, {@code OR} and {@code NOT} are operators only when written in uppercase</li>
 *   <li>A leading {@code -} negates the following term or group</li>
 *   <li>{@code "quoted text"} is a phrase, {@code \"} inside a phrase is a literal quote</li>
 *   <li>{@code title:}, {@code content:}, {@code tags:} and {@code tag:} restrict a term or phrase to one field.
 *       An unknown prefix or a value with further unescaped colons keeps the whole token as a literal,
 *       so {@code time:3:30pm} stays a single term</li>
 *   <li>Terms containing {@code *} or {@code ?} are wildcards, all other terms are fuzzy</li>
 *   <li>Parentheses group sub-expressions</li>
 * </ul>
 *
 * <h2>Flattening</h2>
 * The expression tree is flattened into must, should and mustNot clauses:
 * <pre>
 * javascript AND testing        must=[javascript, testing]
 * javascript -typescript        must=[javascript]  mustNot=[typescript]
 * guide AND (java OR kotlin)    must=[guide]       should=[java, kotlin]
 * javascript OR python          must=[javascript]  should=[javascript, python]
 * </pre>
 * Positive terms below an {@code OR} become should clauses, every negated term (including all terms of a
 * negated group) becomes a mustNot clause. If nothing ended up in must while should is populated, the first
 * should clause is also copied into must, so a plain {@code A OR B} still requires a match.
 *
 * <h2>Errors</h2>
 * An opening parenthesis without a matching closing one raises a {@link QuerySyntaxException}.
 * A stray closing parenthesis is ignored, as are dangling operators.
 */
public class QueryParser {

    private final double defaultFuzzyTolerance;

    public QueryParser() {
        this(Clause.DEFAULT_FUZZY_TOLERANCE);
    }

    /**
     * @param defaultFuzzyTolerance minimum similarity assigned to fuzzy clauses
     */
    public QueryParser(final double defaultFuzzyTolerance) {
        if (defaultFuzzyTolerance < 0.0 || defaultFuzzyTolerance > 1.0) {
            throw new IllegalArgumentException("Fuzzy tolerance must be within [0,1], was " + defaultFuzzyTolerance);
        }
        this.defaultFuzzyTolerance = defaultFuzzyTolerance;
    }

    /**
     * Parse a query using the default fuzzy tolerance of this parser.
     *
     * @param text raw query, may be null or blank
     * @return the structured query, empty for blank input
     * @throws QuerySyntaxException if a parenthesized group is not closed
     */
    public ParsedQuery parse(final @Nullable String text) throws QuerySyntaxException {
        return parse(text, defaultFuzzyTolerance);
    }

    /**
     * Parse a query, assigning the given tolerance to every fuzzy clause.
     */
    public ParsedQuery parse(final @Nullable String text, final double fuzzyTolerance) throws QuerySyntaxException {
        if (text == null || text.isBlank()) {
            return ParsedQuery.empty();
        }

        final Cursor cursor = new Cursor(text, tokenize(text), fuzzyTolerance);
        final Node root = parseExpression(cursor, false);

        final List<Clause> must = new ArrayList<>();
        final List<Clause> should = new ArrayList<>();
        final List<Clause> mustNot = new ArrayList<>();

        if (root instanceof OrNode or) {
            for (final Node branch : or.children()) {
                collect(branch, false, should, should, mustNot);
            }
        } else if (root != null) {
            collect(root, false, must, should, mustNot);
        }

        if (must.isEmpty() && !should.isEmpty()) {
            must.add(should.get(0));
        }

        return new ParsedQuery(must, should, mustNot);
    }

    /**
     * Render a parsed query back into query syntax. Parsing the result yields an equivalent query.
     */
    public static String normalize(final ParsedQuery query) {
        final boolean promotedOr = query.must().size() == 1
                && !query.should().isEmpty()
                && query.must().get(0).equals(query.should().get(0));
        final List<Clause> must = promotedOr ? List.of() : query.must();

        final List<String> parts = new ArrayList<>();
        if (!must.isEmpty()) {
            parts.add(join(must, " AND "));
        }
        if (!query.should().isEmpty()) {
            final String alternatives = join(query.should(), " OR ");
            parts.add(must.isEmpty() ? alternatives : "(" + alternatives + ")");
        }
        for (final Clause clause : query.mustNot()) {
            parts.add("NOT " + render(clause));
        }
        return String.join(" AND ", parts);
    }

    private static String join(final List<Clause> clauses, final String separator) {
        final List<String> rendered = new ArrayList<>(clauses.size());
        for (final Clause clause : clauses) {
            rendered.add(render(clause));
        }
        return String.join(separator, rendered);
    }

    private static String render(final Clause clause) {
        final QueryField field = clause.field();
        final String prefix = field != null ? field.key() + ":" : "";
        return switch (clause.type()) {
            case PHRASE -> prefix + '"' + clause.value().replace("\"", "\\\"") + '"';
            case REGEX -> prefix + "/" + clause.value() + "/";
            default -> prefix + clause.value().replace(":", "\\:");
        };
    }

    // Grammar: expression := and (OR and)* ; and := unary ((AND)? unary)* ; unary := NOT unary | '(' expression ')' | term

    private @Nullable Node parseExpression(final Cursor cursor, final boolean nested) throws QuerySyntaxException {
        final List<Node> branches = new ArrayList<>();
        final Node first = parseAnd(cursor, nested);
        if (first != null) {
            branches.add(first);
        }
        while (cursor.hasNext() && cursor.peek().kind() == TokenKind.OR) {
            cursor.next();
            final Node next = parseAnd(cursor, nested);
            if (next != null) {
                branches.add(next);
            }
        }
        if (branches.isEmpty()) {
            return null;
        }
        return branches.size() == 1 ? branches.get(0) : new OrNode(branches);
    }

    private @Nullable Node parseAnd(final Cursor cursor, final boolean nested) throws QuerySyntaxException {
        final List<Node> children = new ArrayList<>();
        while (cursor.hasNext()) {
            final Token token = cursor.peek();
            if (token.kind() == TokenKind.OR) {
                break;
            }
            if (token.kind() == TokenKind.RPAREN) {
                if (nested) {
                    break;
                }
                // stray closing parenthesis
                cursor.next();
                continue;
            }
            if (token.kind() == TokenKind.AND) {
                cursor.next();
                continue;
            }
            final Node unary = parseUnary(cursor, nested);
            if (unary != null) {
                children.add(unary);
            }
        }
        if (children.isEmpty()) {
            return null;
        }
        return children.size() == 1 ? children.get(0) : new AndNode(children);
    }

    private @Nullable Node parseUnary(final Cursor cursor, final boolean nested) throws QuerySyntaxException {
        final Token token = cursor.next();
        switch (token.kind()) {
            case NOT -> {
                if (!cursor.hasNext() || cursor.peek().isOperatorOrClose()) {
                    return null;
                }
                final Node operand = parseUnary(cursor, nested);
                return operand != null ? new NotNode(operand) : null;
            }
            case LPAREN -> {
                final Node inner = parseExpression(cursor, true);
                if (!cursor.hasNext() || cursor.peek().kind() != TokenKind.RPAREN) {
                    throw new QuerySyntaxException("Expected closing parenthesis for group opened",
                            cursor.text(), token.position());
                }
                cursor.next();
                return inner;
            }
            case PHRASE -> {
                return new TermNode(Clause.phrase(token.field(), token.text()));
            }
            case TERM -> {
                return new TermNode(termClause(token.text(), cursor.fuzzyTolerance()));
            }
            default -> {
                return null;
            }
        }
    }

    private static void collect(final Node node, final boolean negated, final List<Clause> target,
                                final List<Clause> should, final List<Clause> mustNot) {
        if (node instanceof TermNode term) {
            (negated ? mustNot : target).add(term.clause());
        } else if (node instanceof NotNode not) {
            collect(not.operand(), !negated, target, should, mustNot);
        } else if (node instanceof AndNode and) {
            for (final Node child : and.children()) {
                collect(child, negated, target, should, mustNot);
            }
        } else if (node instanceof OrNode or) {
            for (final Node child : or.children()) {
                collect(child, negated, should, should, mustNot);
            }
        }
    }

    private static Clause termClause(final String raw, final double fuzzyTolerance) {
        final int colon = indexOfUnescapedColon(raw);
        if (colon > 0) {
            final QueryField field = QueryField.fromName(raw.substring(0, colon));
            final String rest = raw.substring(colon + 1);
            if (field != null && !rest.isEmpty() && indexOfUnescapedColon(rest) < 0) {
                return valueClause(field, unescapeColons(rest), fuzzyTolerance);
            }
        }
        return valueClause(null, unescapeColons(raw), fuzzyTolerance);
    }

    private static Clause valueClause(final @Nullable QueryField field, final String value, final double fuzzyTolerance) {
        if (value.indexOf('*') >= 0 || value.indexOf('?') >= 0) {
            return Clause.wildcard(field, value);
        }
        return Clause.fuzzy(field, value, fuzzyTolerance);
    }

    private static int indexOfUnescapedColon(final String value) {
        for (int i = 0; i < value.length(); i++) {
            final char c = value.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == ':') {
                return i;
            }
        }
        return -1;
    }

    private static String unescapeColons(final String value) {
        return value.replace("\\:", ":");
    }

    static List<Token> tokenize(final String text) {
        final List<Token> tokens = new ArrayList<>();
        final int length = text.length();
        int i = 0;
        while (i < length) {
            final char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '(') {
                tokens.add(new Token(TokenKind.LPAREN, "(", null, i));
                i++;
            } else if (c == ')') {
                tokens.add(new Token(TokenKind.RPAREN, ")", null, i));
                i++;
            } else if (c == '"') {
                i = readPhrase(text, i, null, tokens);
            } else if (c == '-') {
                tokens.add(new Token(TokenKind.NOT, "-", null, i));
                i++;
            } else {
                final int start = i;
                final StringBuilder word = new StringBuilder();
                while (i < length) {
                    final char ch = text.charAt(i);
                    if (Character.isWhitespace(ch) || ch == '(' || ch == ')' || ch == '"') {
                        break;
                    }
                    if (ch == '\\' && i + 1 < length) {
                        word.append(ch).append(text.charAt(i + 1));
                        i += 2;
                        continue;
                    }
                    word.append(ch);
                    i++;
                }
                final String raw = word.toString();

                if (i < length && text.charAt(i) == '"' && raw.endsWith(":")) {
                    final QueryField field = QueryField.fromName(raw.substring(0, raw.length() - 1));
                    if (field != null) {
                        i = readPhrase(text, i, field, tokens);
                        continue;
                    }
                }

                switch (raw) {
                    case "AND" -> tokens.add(new Token(TokenKind.AND, raw, null, start));
                    case "OR" -> tokens.add(new Token(TokenKind.OR, raw, null, start));
                    case "NOT" -> tokens.add(new Token(TokenKind.NOT, raw, null, start));
                    default -> tokens.add(new Token(TokenKind.TERM, raw, null, start));
                }
            }
        }
        return tokens;
    }

    /**
     * Reads a quoted phrase starting at the opening quote. An unterminated phrase extends to the end of input.
     *
     * @return index after the closing quote
     */
    private static int readPhrase(final String text, final int quoteIndex, final @Nullable QueryField field,
                                  final List<Token> tokens) {
        final StringBuilder phrase = new StringBuilder();
        int i = quoteIndex + 1;
        while (i < text.length()) {
            final char c = text.charAt(i);
            if (c == '\\' && i + 1 < text.length() && text.charAt(i + 1) == '"') {
                phrase.append('"');
                i += 2;
                continue;
            }
            if (c == '"') {
                i++;
                break;
            }
            phrase.append(c);
            i++;
        }
        final String value = phrase.toString().trim();
        if (!value.isEmpty()) {
            tokens.add(new Token(TokenKind.PHRASE, value, field, quoteIndex));
        }
        return i;
    }

    enum TokenKind {
        TERM, PHRASE, LPAREN, RPAREN, AND, OR, NOT
    }

    record Token(TokenKind kind, String text, @Nullable QueryField field, int position) {

        boolean isOperatorOrClose() {
            return kind == TokenKind.AND || kind == TokenKind.OR || kind == TokenKind.RPAREN;
        }
    }

    private static final class Cursor {

        private final String text;
        private final List<Token> tokens;
        private final double fuzzyTolerance;
        private int index;

        Cursor(final String text, final List<Token> tokens, final double fuzzyTolerance) {
            this.text = text;
            this.tokens = tokens;
            this.fuzzyTolerance = fuzzyTolerance;
        }

        boolean hasNext() {
            return index < tokens.size();
        }

        Token peek() {
            return tokens.get(index);
        }

        Token next() {
            return tokens.get(index++);
        }

        String text() {
            return text;
        }

        double fuzzyTolerance() {
            return fuzzyTolerance;
        }
    }

    private interface Node {
    }

    private record TermNode(Clause clause) implements Node {
    }

    private record NotNode(Node operand) implements Node {
    }

    private record AndNode(List<Node> children) implements Node {
    }

    private record OrNode(List<Node> children) implements Node {
    }
}
