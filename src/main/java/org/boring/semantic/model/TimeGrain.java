package org.boring.semantic.model;

import org.boring.semantic.plan.DateTruncExpression;

import java.util.Arrays;
import java.util.Locale;

/**
 * Time resolutions, ordered from finest to coarsest.
 */
public enum TimeGrain {
    SECOND(DateTruncExpression.TruncPart.SECOND),
    MINUTE(DateTruncExpression.TruncPart.MINUTE),
    HOUR(DateTruncExpression.TruncPart.HOUR),
    DAY(DateTruncExpression.TruncPart.DAY),
    WEEK(DateTruncExpression.TruncPart.WEEK),
    MONTH(DateTruncExpression.TruncPart.MONTH),
    QUARTER(DateTruncExpression.TruncPart.QUARTER),
    YEAR(DateTruncExpression.TruncPart.YEAR);

    private static final String PREFIX = "TIME_GRAIN_";

    private final DateTruncExpression.TruncPart truncPart;

    TimeGrain(DateTruncExpression.TruncPart truncPart) {
        this.truncPart = truncPart;
    }

    /**
     * @return The truncation unit used to bring a timestamp to this grain
     */
    public DateTruncExpression.TruncPart truncPart() {
        return truncPart;
    }

    /**
     * @return true if this grain is strictly finer than {@code other}
     */
    public boolean isFinerThan(TimeGrain other) {
        return compareTo(other) < 0;
    }

    /**
     * Parses a grain name, case-insensitively. Accepts both {@code month} and {@code TIME_GRAIN_MONTH}.
     *
     * @throws IllegalArgumentException for an unknown grain
     */
    public static TimeGrain parse(String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if (normalized.startsWith(PREFIX)) {
            normalized = normalized.substring(PREFIX.length());
        }
        for (TimeGrain grain : values()) {
            if (grain.name().equals(normalized)) {
                return grain;
            }
        }
        throw new IllegalArgumentException("Invalid time grain: " + value
                + ". Must be one of " + Arrays.toString(values()));
    }
}
