package org.boring.semantic.model;

import org.boring.semantic.plan.AggregateExpression;

import java.util.Objects;

/**
 * A named aggregation of a semantic table.
 *
 * A BASE measure aggregates rows of its own table; a CALCULATED measure combines other
 * measures by name and is bound to them only when the query is lowered.
 *
 * @param name           The measure name, unique on its table
 * @param kind           BASE or CALCULATED
 * @param baseExpr       The aggregation over a row of the table (BASE only)
 * @param calculatedExpr The expression over other measures (CALCULATED only)
 * @param description    Free-form documentation, never null
 */
public record Measure(
        String name,
        Kind kind,
        RowExpr baseExpr,
        MeasureExpr calculatedExpr,
        String description) {

    public enum Kind {
        BASE,
        CALCULATED
    }

    public Measure {
        Objects.requireNonNull(name, "Measure name cannot be null");
        Objects.requireNonNull(kind, "Measure kind cannot be null");
        if (name.isBlank() || name.contains(".")) {
            throw new IllegalArgumentException("Invalid measure name '" + name + "': must be non-blank without '.'");
        }
        if (kind == Kind.BASE && (baseExpr == null || calculatedExpr != null)) {
            throw new IllegalArgumentException("Base measure '" + name + "' requires a row expression only");
        }
        if (kind == Kind.CALCULATED && (calculatedExpr == null || baseExpr != null)) {
            throw new IllegalArgumentException("Calculated measure '" + name + "' requires a measure expression only");
        }
        description = description == null ? "" : description;
    }

    public static Measure base(String name, RowExpr expr) {
        return new Measure(name, Kind.BASE, expr, null, "");
    }

    public static Measure calculated(String name, MeasureExpr expr) {
        return new Measure(name, Kind.CALCULATED, null, expr, "");
    }

    // ==================== Shorthands ====================

    public static Measure sum(String name, String column) {
        return base(name, row -> AggregateExpression.sum(row.column(column)));
    }

    public static Measure avg(String name, String column) {
        return base(name, row -> AggregateExpression.avg(row.column(column)));
    }

    public static Measure min(String name, String column) {
        return base(name, row -> AggregateExpression.min(row.column(column)));
    }

    public static Measure max(String name, String column) {
        return base(name, row -> AggregateExpression.max(row.column(column)));
    }

    /**
     * COUNT(*) over the table's rows.
     */
    public static Measure count(String name) {
        return base(name, row -> AggregateExpression.countAll());
    }

    public static Measure countDistinct(String name, String column) {
        return base(name, row -> AggregateExpression.countDistinct(row.column(column)));
    }

    public Measure withDescription(String newDescription) {
        return new Measure(name, kind, baseExpr, calculatedExpr, newDescription);
    }

    public boolean isCalculated() {
        return kind == Kind.CALCULATED;
    }
}
