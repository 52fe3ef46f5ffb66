package org.boring.semantic.plan;

import org.boring.semantic.store.SqlDataType;

import java.util.Objects;

/**
 * Represents a date truncation function in the relational plan.
 * Maps to SQL DATE_TRUNC(part, column) syntax.
 * 
 * SQL output: date_trunc('month', column)
 */
public record DateTruncExpression(
        TruncPart part,
        Expression argument) implements Expression {

    /**
     * Supported date truncation parts.
     */
    public enum TruncPart {
        YEAR("year"),
        QUARTER("quarter"),
        MONTH("month"),
        WEEK("week"),
        DAY("day"),
        HOUR("hour"),
        MINUTE("minute"),
        SECOND("second");

        private final String sql;

        TruncPart(String sql) {
            this.sql = sql;
        }

        public String sql() {
            return sql;
        }
    }

    public DateTruncExpression {
        Objects.requireNonNull(part, "Trunc part cannot be null");
        Objects.requireNonNull(argument, "Argument cannot be null");
    }

    @Override
    public SqlDataType type() {
        return argument.type() == SqlDataType.UNKNOWN ? SqlDataType.TIMESTAMP : argument.type();
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitDateTrunc(this);
    }

    @Override
    public String toString() {
        return "date_trunc('" + part.sql() + "', " + argument + ")";
    }
}
