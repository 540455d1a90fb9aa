package de.mirkosertic.mcp.notesearch.mcp.dto;

import de.mirkosertic.mcp.notesearch.index.Category;
import de.mirkosertic.mcp.notesearch.index.DateRange;
import org.jspecify.annotations.Nullable;

import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Conversions of loosely typed tool arguments.
 */
final class RequestValues {

    private RequestValues() {
    }

    static @Nullable String string(final Map<String, Object> args, final String key) {
        final Object value = args.get(key);
        return value != null ? value.toString() : null;
    }

    static @Nullable Integer integer(final Map<String, Object> args, final String key) {
        final Object value = args.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return exactInt(key, number);
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, was '" + value + "'", e);
        }
    }

    /**
     * Integral numbers within {@code int} range only, {@code 2.0} is accepted, {@code 2.7} is not.
     */
    private static int exactInt(final String key, final Number number) {
        final long longValue;
        if (number instanceof Byte || number instanceof Short || number instanceof Integer || number instanceof Long) {
            longValue = number.longValue();
        } else if (number instanceof BigInteger bigInteger) {
            if (bigInteger.bitLength() >= Long.SIZE) {
                throw new IllegalArgumentException(key + " is out of range, was " + number);
            }
            longValue = bigInteger.longValue();
        } else {
            final double doubleValue = number.doubleValue();
            if (!Double.isFinite(doubleValue) || doubleValue != Math.rint(doubleValue)) {
                throw new IllegalArgumentException(key + " must be an integer, was " + number);
            }
            if (doubleValue < Integer.MIN_VALUE || doubleValue > Integer.MAX_VALUE) {
                throw new IllegalArgumentException(key + " is out of range, was " + number);
            }
            longValue = (long) doubleValue;
        }
        try {
            return Math.toIntExact(longValue);
        } catch (final ArithmeticException e) {
            throw new IllegalArgumentException(key + " is out of range, was " + number, e);
        }
    }

    static @Nullable Double decimal(final Map<String, Object> args, final String key) {
        final Object value = args.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number, was '" + value + "'", e);
        }
    }

    static @Nullable Boolean bool(final Map<String, Object> args, final String key) {
        final Object value = args.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        return Boolean.parseBoolean(value.toString().trim());
    }

    /**
     * A JSON array, or a single comma separated string.
     */
    static @Nullable List<String> strings(final Map<String, Object> args, final String key) {
        final Object value = args.get(key);
        if (value == null) {
            return null;
        }
        final List<String> result = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (final Object element : list) {
                if (element != null) {
                    result.add(element.toString());
                }
            }
        } else {
            for (final String part : value.toString().split(",")) {
                result.add(part.trim());
            }
        }
        return result;
    }

    static @Nullable Category category(final @Nullable String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        final Category category = Category.fromString(value);
        if (category == null) {
            throw new IllegalArgumentException("Unknown category '" + value
                    + "', expected one of projects, areas, resources, archives");
        }
        return category;
    }

    static @Nullable DateRange dateRange(final @Nullable String startDate, final @Nullable String endDate) {
        final Instant start = instant("startDate", startDate, false);
        final Instant end = instant("endDate", endDate, true);
        if (start == null && end == null) {
            return null;
        }
        return new DateRange(start, end);
    }

    /**
     * ISO-8601 timestamp, local date-time (UTC) or date. A date alone means the start of that day, or its last
     * instant when it closes a range.
     */
    static @Nullable Instant instant(final String key, final @Nullable String value, final boolean endOfDay) {
        if (value == null || value.isBlank()) {
            return null;
        }
        final String text = value.trim();
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (final DateTimeParseException ignored) {
            // not a timestamp with offset
        }
        try {
            return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
        } catch (final DateTimeParseException ignored) {
            // not a local timestamp
        }
        try {
            final LocalDate date = LocalDate.parse(text);
            return endOfDay
                    ? date.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant().minusNanos(1)
                    : date.atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (final DateTimeParseException e) {
            throw new IllegalArgumentException(key + " must be an ISO-8601 date or timestamp, was '" + value + "'", e);
        }
    }

    static @Nullable String iso(final @Nullable Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}
