package org.boring.semantic.ir;

import java.util.Locale;
import java.util.Objects;

/**
 * One ordering key: a field name and a direction.
 */
public record SortKey(String field, Direction direction) {

    public enum Direction {
        ASC,
        DESC
    }

    public SortKey {
        Objects.requireNonNull(field, "Sort field cannot be null");
        Objects.requireNonNull(direction, "Sort direction cannot be null");
    }

    public static SortKey asc(String field) {
        return new SortKey(field, Direction.ASC);
    }

    public static SortKey desc(String field) {
        return new SortKey(field, Direction.DESC);
    }

    /**
     * Builds a key from a direction name, case-insensitively ("asc" or "desc").
     */
    public static SortKey of(String field, String direction) {
        String normalized = direction.trim().toUpperCase(Locale.ROOT);
        if (!normalized.equals("ASC") && !normalized.equals("DESC")) {
            throw new IllegalArgumentException("Invalid sort direction '" + direction + "' for field " + field);
        }
        return new SortKey(field, Direction.valueOf(normalized));
    }
}
