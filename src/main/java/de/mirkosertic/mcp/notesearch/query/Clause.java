package de.mirkosertic.mcp.notesearch.query;

import org.jspecify.annotations.Nullable;

import java.util.Objects;

/**
 * One atomic query term. The concrete record determines how the value is matched,
 * {@link #field()} optionally restricts matching to a single document attribute.
 */
public sealed interface Clause permits Clause.Exact, Clause.Fuzzy, Clause.Phrase, Clause.Wildcard, Clause.Regex {

    /**
     * Minimum similarity a fuzzy clause demands unless configured otherwise.
     */
    double DEFAULT_FUZZY_TOLERANCE = 0.8;

    /**
     * Field restriction, {@code null} searches title, content and tags.
     */
    @Nullable QueryField field();

    String value();

    ClauseType type();

    static Clause exact(final @Nullable QueryField field, final String value) {
        return new Exact(field, value);
    }

    static Clause fuzzy(final @Nullable QueryField field, final String value) {
        return new Fuzzy(field, value, DEFAULT_FUZZY_TOLERANCE);
    }

    static Clause fuzzy(final @Nullable QueryField field, final String value, final double tolerance) {
        return new Fuzzy(field, value, tolerance);
    }

    static Clause phrase(final @Nullable QueryField field, final String value) {
        return new Phrase(field, value);
    }

    static Clause wildcard(final @Nullable QueryField field, final String value) {
        return new Wildcard(field, value);
    }

    static Clause regex(final @Nullable QueryField field, final String value) {
        return new Regex(field, value);
    }

    /**
     * Case-insensitive equality or containment.
     */
    record Exact(@Nullable QueryField field, String value) implements Clause {
        public Exact {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public ClauseType type() {
            return ClauseType.EXACT;
        }
    }

    /**
     * Edit-distance based match. {@code tolerance} is the minimum similarity in {@code [0,1]}.
     */
    record Fuzzy(@Nullable QueryField field, String value, double tolerance) implements Clause {
        public Fuzzy {
            Objects.requireNonNull(value, "value");
            if (tolerance < 0.0 || tolerance > 1.0) {
                throw new IllegalArgumentException("Fuzzy tolerance must be within [0,1], was " + tolerance);
            }
        }

        @Override
        public ClauseType type() {
            return ClauseType.FUZZY;
        }
    }

    /**
     * Literal, case-insensitive substring.
     */
    record Phrase(@Nullable QueryField field, String value) implements Clause {
        public Phrase {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public ClauseType type() {
            return ClauseType.PHRASE;
        }
    }

    /**
     * Glob with {@code *} and {@code ?}, matched against the whole value.
     */
    record Wildcard(@Nullable QueryField field, String value) implements Clause {
        public Wildcard {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public ClauseType type() {
            return ClauseType.WILDCARD;
        }
    }

    record Regex(@Nullable QueryField field, String value) implements Clause {
        public Regex {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public ClauseType type() {
            return ClauseType.REGEX;
        }
    }
}
