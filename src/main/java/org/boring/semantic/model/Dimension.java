package org.boring.semantic.model;

import org.boring.semantic.plan.Expression;

import java.util.Objects;

/**
 * A named, row-level attribute of a semantic table.
 *
 * @param name              The dimension name, unique on its table
 * @param expr              Builds the dimension's expression over a row of the table
 * @param description       Free-form documentation, never null
 * @param timeDimension     Whether the dimension can be grouped at a time grain
 * @param smallestTimeGrain The finest grain the data supports, null when unknown
 */
public record Dimension(
        String name,
        RowExpr expr,
        String description,
        boolean timeDimension,
        TimeGrain smallestTimeGrain) {

    public Dimension {
        Objects.requireNonNull(name, "Dimension name cannot be null");
        Objects.requireNonNull(expr, "Dimension expression cannot be null");
        if (name.isBlank() || name.contains(".")) {
            throw new IllegalArgumentException("Invalid dimension name '" + name + "': must be non-blank without '.'");
        }
        if (smallestTimeGrain != null && !timeDimension) {
            throw new IllegalArgumentException("Dimension '" + name + "' declares a smallest time grain "
                    + "but is not a time dimension");
        }
        description = description == null ? "" : description;
    }

    /**
     * A dimension computed by an arbitrary row expression.
     */
    public static Dimension of(String name, RowExpr expr) {
        return new Dimension(name, expr, "", false, null);
    }

    /**
     * A dimension exposing the backing column of the same name.
     */
    public static Dimension column(String name) {
        return column(name, name);
    }

    /**
     * A dimension exposing a backing column under another name.
     */
    public static Dimension column(String name, String column) {
        return of(name, row -> row.column(column));
    }

    /**
     * A time dimension.
     *
     * @param smallestTimeGrain The finest supported grain, null when unknown
     */
    public static Dimension time(String name, RowExpr expr, TimeGrain smallestTimeGrain) {
        return new Dimension(name, expr, "", true, smallestTimeGrain);
    }

    public Dimension withDescription(String newDescription) {
        return new Dimension(name, expr, newDescription, timeDimension, smallestTimeGrain);
    }

    /**
     * Builds the dimension's expression for one row scope.
     */
    public Expression evaluate(TableScope row) {
        return expr.apply(row);
    }
}
