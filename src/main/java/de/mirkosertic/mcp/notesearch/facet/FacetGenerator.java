package de.mirkosertic.mcp.notesearch.facet;

import de.mirkosertic.mcp.notesearch.index.Category;
import de.mirkosertic.mcp.notesearch.index.IndexedDocument;
import org.jspecify.annotations.Nullable;

import java.time.Clock;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregates documents into facets and filters documents by facet value.
 *
 * <p>Facets with no values are left out of the result. Category, tag and date range values are ordered by
 * descending count (ties keep their natural order), year and month values from the most recent backwards.
 * Date based facets use {@code modified}, else {@code created}, evaluated in the zone of the given clock;
 * documents with neither date do not take part.</p>
 */
public final class FacetGenerator {

    static final int MAX_TAG_VALUES = 20;
    static final int MAX_MONTH_VALUES = 12;

    private static final DateTimeFormatter MONTH_LABEL = DateTimeFormatter.ofPattern("MMM yyyy", Locale.ENGLISH);

    private FacetGenerator() {
    }

    public static List<Facet> generateFacets(final Collection<IndexedDocument> documents,
                                             final Collection<FacetType> facetTypes) {
        return generateFacets(documents, facetTypes, Clock.systemUTC());
    }

    /**
     * Computes the requested facets in request order.
     */
    public static List<Facet> generateFacets(final Collection<IndexedDocument> documents,
                                             final Collection<FacetType> facetTypes,
                                             final Clock clock) {
        final List<Facet> facets = new ArrayList<>();
        for (final FacetType type : facetTypes) {
            final Facet facet = switch (type) {
                case CATEGORY -> categoryFacet(documents);
                case TAGS -> tagFacet(documents);
                case DATE_RANGE -> dateRangeFacet(documents, clock);
                case YEAR -> yearFacet(documents, clock.getZone());
                case MONTH -> monthFacet(documents, clock.getZone());
            };
            if (facet != null) {
                facets.add(facet);
            }
        }
        return facets;
    }

    /**
     * Filters by a facet type given as text. An unknown type leaves the documents unchanged.
     */
    public static List<IndexedDocument> applyFacetFilter(final List<IndexedDocument> documents,
                                                         final String type, final String value) {
        final FacetType facetType = FacetType.fromString(type);
        if (facetType == null) {
            return documents;
        }
        return applyFacetFilter(documents, facetType, value, Clock.systemUTC());
    }

    public static List<IndexedDocument> applyFacetFilter(final List<IndexedDocument> documents,
                                                         final FacetType type, final String value) {
        return applyFacetFilter(documents, type, value, Clock.systemUTC());
    }

    /**
     * Keeps the documents that fall into the facet bucket {@code value}, using the same bucketing as
     * {@link #generateFacets}. An unknown date range key leaves the documents unchanged.
     */
    public static List<IndexedDocument> applyFacetFilter(final List<IndexedDocument> documents,
                                                         final FacetType type, final String value,
                                                         final Clock clock) {
        final ZoneId zone = clock.getZone();
        switch (type) {
            case CATEGORY -> {
                final Category category = Category.fromString(value);
                return documents.stream()
                        .filter(document -> document.category() == category)
                        .toList();
            }
            case TAGS -> {
                return documents.stream()
                        .filter(document -> document.tags().stream().anyMatch(tag -> tag.equalsIgnoreCase(value)))
                        .toList();
            }
            case DATE_RANGE -> {
                final DateBucket bucket = DateBucket.fromKey(value);
                if (bucket == null) {
                    return documents;
                }
                final Instant now = clock.instant();
                return documents.stream()
                        .filter(document -> document.effectiveDate() != null
                                && DateBucket.of(document.effectiveDate(), now) == bucket)
                        .toList();
            }
            case YEAR -> {
                return documents.stream()
                        .filter(document -> document.effectiveDate() != null
                                && String.valueOf(yearMonth(document.effectiveDate(), zone).getYear()).equals(value.trim()))
                        .toList();
            }
            case MONTH -> {
                return documents.stream()
                        .filter(document -> document.effectiveDate() != null
                                && yearMonth(document.effectiveDate(), zone).toString().equals(value.trim()))
                        .toList();
            }
            default -> {
                return documents;
            }
        }
    }

    private static @Nullable Facet categoryFacet(final Collection<IndexedDocument> documents) {
        final Map<Category, Integer> counts = new EnumMap<>(Category.class);
        for (final IndexedDocument document : documents) {
            counts.merge(document.category(), 1, Integer::sum);
        }

        final List<FacetValue> values = new ArrayList<>();
        for (final Map.Entry<Category, Integer> entry : counts.entrySet()) {
            values.add(new FacetValue(entry.getKey().key(), entry.getKey().label(), entry.getValue()));
        }
        values.sort(byCountDescending());
        return values.isEmpty() ? null : new Facet(FacetType.CATEGORY, values, documents.size());
    }

    private static @Nullable Facet tagFacet(final Collection<IndexedDocument> documents) {
        final Map<String, Integer> counts = new LinkedHashMap<>();
        for (final IndexedDocument document : documents) {
            for (final String tag : document.tags()) {
                counts.merge(tag, 1, Integer::sum);
            }
        }

        final List<FacetValue> values = new ArrayList<>();
        for (final Map.Entry<String, Integer> entry : counts.entrySet()) {
            values.add(new FacetValue(entry.getKey(), entry.getKey(), entry.getValue()));
        }
        values.sort(byCountDescending());
        return toFacet(FacetType.TAGS, values.size() > MAX_TAG_VALUES ? values.subList(0, MAX_TAG_VALUES) : values);
    }

    private static @Nullable Facet dateRangeFacet(final Collection<IndexedDocument> documents, final Clock clock) {
        final Instant now = clock.instant();
        final Map<DateBucket, Integer> counts = new EnumMap<>(DateBucket.class);
        for (final IndexedDocument document : documents) {
            final Instant date = document.effectiveDate();
            if (date != null) {
                counts.merge(DateBucket.of(date, now), 1, Integer::sum);
            }
        }

        final List<FacetValue> values = new ArrayList<>();
        for (final Map.Entry<DateBucket, Integer> entry : counts.entrySet()) {
            values.add(new FacetValue(entry.getKey().key(), entry.getKey().label(), entry.getValue()));
        }
        values.sort(byCountDescending());
        return toFacet(FacetType.DATE_RANGE, values);
    }

    private static @Nullable Facet yearFacet(final Collection<IndexedDocument> documents, final ZoneId zone) {
        final Map<Integer, Integer> counts = new TreeMap<>(Comparator.reverseOrder());
        for (final IndexedDocument document : documents) {
            final Instant date = document.effectiveDate();
            if (date != null) {
                counts.merge(yearMonth(date, zone).getYear(), 1, Integer::sum);
            }
        }

        final List<FacetValue> values = new ArrayList<>();
        for (final Map.Entry<Integer, Integer> entry : counts.entrySet()) {
            final String year = String.valueOf(entry.getKey());
            values.add(new FacetValue(year, year, entry.getValue()));
        }
        return toFacet(FacetType.YEAR, values);
    }

    private static @Nullable Facet monthFacet(final Collection<IndexedDocument> documents, final ZoneId zone) {
        final Map<YearMonth, Integer> counts = new TreeMap<>(Comparator.reverseOrder());
        for (final IndexedDocument document : documents) {
            final Instant date = document.effectiveDate();
            if (date != null) {
                counts.merge(yearMonth(date, zone), 1, Integer::sum);
            }
        }

        final List<FacetValue> values = new ArrayList<>();
        for (final Map.Entry<YearMonth, Integer> entry : counts.entrySet()) {
            if (values.size() == MAX_MONTH_VALUES) {
                break;
            }
            values.add(new FacetValue(entry.getKey().toString(), MONTH_LABEL.format(entry.getKey()), entry.getValue()));
        }
        return toFacet(FacetType.MONTH, values);
    }

    private static @Nullable Facet toFacet(final FacetType type, final List<FacetValue> values) {
        if (values.isEmpty()) {
            return null;
        }
        int total = 0;
        for (final FacetValue value : values) {
            total += value.count();
        }
        return new Facet(type, values, total);
    }

    private static Comparator<FacetValue> byCountDescending() {
        return Comparator.comparingInt(FacetValue::count).reversed();
    }

    private static YearMonth yearMonth(final Instant instant, final ZoneId zone) {
        return YearMonth.from(instant.atZone(zone));
    }
}
