package org.boring.semantic.filter;

import org.boring.semantic.plan.Expression;
import org.boring.semantic.plan.Literal;
import org.boring.semantic.store.SqlDataType;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * Converts filter values into SQL literals using the declared type of the compared
 * expression.
 *
 * A string compared with a DATE expression becomes a DATE literal and one compared
 * with a TIMESTAMP expression becomes a TIMESTAMP literal, so backends that reject
 * implicit string/date comparisons accept the predicate. Everything else is
 * converted by its Java type.
 */
public final class LiteralConverter {

    private LiteralConverter() {
    }

    public static Literal convert(Object value, Expression target) {
        SqlDataType targetType = target == null ? SqlDataType.UNKNOWN : target.type();
        if (targetType == SqlDataType.DATE) {
            Literal date = toDate(value);
            if (date != null) {
                return date;
            }
        } else if (targetType == SqlDataType.TIMESTAMP) {
            Literal timestamp = toTimestamp(value);
            if (timestamp != null) {
                return timestamp;
            }
        }
        return fromValue(value);
    }

    /**
     * Converts a value by its Java type alone.
     */
    public static Literal fromValue(Object value) {
        if (value == null) {
            return Literal.nullValue();
        }
        if (value instanceof String s) {
            return Literal.string(s);
        }
        if (value instanceof Boolean b) {
            return Literal.bool(b);
        }
        if (value instanceof Integer || value instanceof Long
                || value instanceof Short || value instanceof Byte) {
            return Literal.integer(((Number) value).longValue());
        }
        if (value instanceof BigInteger big) {
            return Literal.decimal(new BigDecimal(big));
        }
        if (value instanceof Number n) {
            return Literal.decimal(n);
        }
        if (value instanceof LocalDate d) {
            return Literal.date(d.toString());
        }
        if (value instanceof LocalDateTime ts) {
            return Literal.timestamp(ts.toString().replace('T', ' '));
        }
        if (value instanceof java.sql.Date d) {
            return Literal.date(d.toString());
        }
        if (value instanceof java.sql.Timestamp ts) {
            return Literal.timestamp(ts.toString());
        }
        return Literal.string(value.toString());
    }

    private static Literal toDate(Object value) {
        if (value instanceof LocalDate d) {
            return Literal.date(d.toString());
        }
        if (value instanceof LocalDateTime ts) {
            return Literal.date(ts.toLocalDate().toString());
        }
        if (value instanceof String s) {
            String trimmed = s.trim();
            try {
                return Literal.date(LocalDate.parse(trimmed).toString());
            } catch (DateTimeParseException e) {
                // a timestamp string compared with a date column keeps its date part
                LocalDateTime ts = parseTimestamp(trimmed);
                return ts == null ? null : Literal.date(ts.toLocalDate().toString());
            }
        }
        return null;
    }

    private static Literal toTimestamp(Object value) {
        if (value instanceof LocalDateTime ts) {
            return Literal.timestamp(ts.toString().replace('T', ' '));
        }
        if (value instanceof LocalDate d) {
            return Literal.timestamp(d + " 00:00:00");
        }
        if (value instanceof String s) {
            String trimmed = s.trim();
            if (parseTimestamp(trimmed) != null) {
                return Literal.timestamp(trimmed.replace('T', ' '));
            }
            try {
                return Literal.timestamp(LocalDate.parse(trimmed) + " 00:00:00");
            } catch (DateTimeParseException e) {
                return null;
            }
        }
        return null;
    }

    private static LocalDateTime parseTimestamp(String text) {
        String normalized = text.replace(' ', 'T');
        try {
            return LocalDateTime.parse(normalized);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(normalized).toLocalDateTime();
            } catch (DateTimeParseException nested) {
                return null;
            }
        }
    }
}
