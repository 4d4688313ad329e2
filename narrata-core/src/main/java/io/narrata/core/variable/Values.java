package io.narrata.core.variable;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/// Coercion helpers for the loosely typed values held by variables.
///
/// Numbers are normalized so that integral results are {@link Long} and
/// fractional results are {@link Double}. This keeps `50 - 10` rendering as
/// `40` rather than `40.0` in the console.
public final class Values {

    /// Largest decimal exponent accepted from text, either direction.
    static final int MAX_SCALE = 400;

    private Values() {}

    /// Coerces a value to a number.
    ///
    /// @param value a {@link Number} or a numeric string, may be null
    /// @return the numeric value, or empty if the value is not numeric or
    ///     lies outside the range of a double
    public static Optional<BigDecimal> toNumber(Object value) {
        if (value instanceof BigDecimal decimal) {
            return inRange(decimal);
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short
                || value instanceof Byte) {
            return Optional.of(BigDecimal.valueOf(((Number) value).longValue()));
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return Optional.empty();
            }
            return Optional.of(BigDecimal.valueOf(d));
        }
        if (value instanceof String text) {
            String trimmed = text.trim();
            if (trimmed.isEmpty()) {
                return Optional.empty();
            }
            try {
                return inRange(new BigDecimal(trimmed));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static Optional<BigDecimal> inRange(BigDecimal decimal) {
        if (Math.abs((long) decimal.scale()) > MAX_SCALE
                || Double.isInfinite(decimal.doubleValue())) {
            return Optional.empty();
        }
        return Optional.of(decimal);
    }

    /// Converts a decimal to {@link Long} when integral, {@link Double} otherwise.
    public static Object normalizeNumber(BigDecimal number) {
        BigDecimal stripped = number.stripTrailingZeros();
        if (stripped.scale() <= 0) {
            try {
                return stripped.longValueExact();
            } catch (ArithmeticException e) {
                return number.doubleValue();
            }
        }
        return number.doubleValue();
    }

    /// Normalizes numeric values and copies collections; other values pass through.
    public static Object normalize(Object value) {
        if (value instanceof Number) {
            return toNumber(value).map(Values::normalizeNumber).orElse(value);
        }
        if (value instanceof Collection<?> collection) {
            return List.copyOf(collection);
        }
        return value;
    }

    /// Coerces a value to a boolean. Accepts booleans and `"true"`/`"false"` strings.
    public static Optional<Boolean> toBoolean(Object value) {
        if (value instanceof Boolean bool) {
            return Optional.of(bool);
        }
        if (value instanceof String text) {
            String normalized = text.trim().toLowerCase(Locale.ROOT);
            if (normalized.equals("true")) {
                return Optional.of(Boolean.TRUE);
            }
            if (normalized.equals("false")) {
                return Optional.of(Boolean.FALSE);
            }
        }
        return Optional.empty();
    }

    /// Coerces a value to an ISO-8601 calendar date.
    public static Optional<LocalDate> toDate(Object value) {
        if (value instanceof LocalDate date) {
            return Optional.of(date);
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Optional.of(LocalDate.parse(text.trim()));
            } catch (DateTimeParseException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /// Renders a value for string comparison. `null` becomes the empty string.
    public static String toText(Object value) {
        if (value == null) {
            return "";
        }
        Object normalized = normalize(value);
        if (normalized instanceof Collection<?> collection) {
            return collection.stream().map(Values::toText).collect(Collectors.joining(","));
        }
        return String.valueOf(normalized);
    }

    /// Renders a value for console messages: strings quoted, `null` as `null`.
    public static String display(Object value) {
        if (value == null) {
            return "null";
        }
        Object normalized = normalize(value);
        if (normalized instanceof String text) {
            return "\"" + text + "\"";
        }
        if (normalized instanceof Collection<?> collection) {
            return collection.stream()
                    .map(Values::display)
                    .collect(Collectors.joining(", ", "[", "]"));
        }
        return String.valueOf(normalized);
    }

    /// Coerces a non-null value to a variable type.
    ///
    /// Numbers and booleans must parse, dates must be a {@link LocalDate} or
    /// ISO-8601 text and are stored as {@link LocalDate}, multi select accepts a collection or comma-separated text, and the
    /// text types accept anything.
    ///
    /// @param type target type, not null
    /// @param value value to coerce, not null
    /// @return the coerced value, empty when the value does not fit the type
    public static Optional<Object> coerce(VariableType type, Object value) {
        return switch (type) {
            case NUMBER -> toNumber(value).map(Values::normalizeNumber);
            case BOOLEAN -> toBoolean(value).map(Object.class::cast);
            case MULTI_SELECT -> Optional.of(toSelection(value));
            case DATE -> value instanceof String text && text.isBlank()
                    ? Optional.of(value)
                    : toDate(value).map(Object.class::cast);
            case TEXT, RICH_TEXT, SELECT -> Optional.of(toText(value));
        };
    }

    private static List<String> toSelection(Object value) {
        if (value instanceof Collection<?> collection) {
            return collection.stream().map(Values::toText).toList();
        }
        String text = toText(value).trim();
        if (text.isEmpty()) {
            return List.of();
        }
        return Arrays.stream(text.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
    }
}
