package org.boring.semantic.plan;

import org.boring.semantic.store.SqlDataType;

import java.util.Objects;

/**
 * Represents an aggregate expression for use in GROUP BY operations.
 * Maps to SQL aggregate functions like SUM, COUNT, AVG, MIN, MAX.
 * 
 * A null argument is only allowed for COUNT and renders as COUNT(*).
 *
 * @param function The aggregate function
 * @param argument The aggregated expression, null for COUNT(*)
 */
public record AggregateExpression(
        AggregateFunction function,
        Expression argument) implements Expression {

    /**
     * Supported aggregate functions that can be pushed to SQL.
     */
    public enum AggregateFunction {
        SUM("SUM"),
        COUNT("COUNT"),
        AVG("AVG"),
        MIN("MIN"),
        MAX("MAX"),
        COUNT_DISTINCT("COUNT");

        private final String sql;

        AggregateFunction(String sql) {
            this.sql = sql;
        }

        public String sql() {
            return sql;
        }
    }

    public AggregateExpression {
        Objects.requireNonNull(function, "Aggregate function cannot be null");
        if (argument == null && function != AggregateFunction.COUNT) {
            throw new IllegalArgumentException(function + " requires an argument");
        }
    }

    public static AggregateExpression sum(Expression argument) {
        return new AggregateExpression(AggregateFunction.SUM, argument);
    }

    public static AggregateExpression count(Expression argument) {
        return new AggregateExpression(AggregateFunction.COUNT, argument);
    }

    /**
     * COUNT(*)
     */
    public static AggregateExpression countAll() {
        return new AggregateExpression(AggregateFunction.COUNT, null);
    }

    public static AggregateExpression countDistinct(Expression argument) {
        return new AggregateExpression(AggregateFunction.COUNT_DISTINCT, argument);
    }

    public static AggregateExpression avg(Expression argument) {
        return new AggregateExpression(AggregateFunction.AVG, argument);
    }

    public static AggregateExpression min(Expression argument) {
        return new AggregateExpression(AggregateFunction.MIN, argument);
    }

    public static AggregateExpression max(Expression argument) {
        return new AggregateExpression(AggregateFunction.MAX, argument);
    }

    /**
     * @return true for COUNT(*)
     */
    public boolean isCountAll() {
        return argument == null;
    }

    @Override
    public SqlDataType type() {
        return switch (function) {
            case COUNT, COUNT_DISTINCT -> SqlDataType.BIGINT;
            case AVG -> SqlDataType.DOUBLE;
            case SUM, MIN, MAX -> argument.type();
        };
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitAggregate(this);
    }

    @Override
    public String toString() {
        if (argument == null) {
            return "COUNT(*)";
        }
        if (function == AggregateFunction.COUNT_DISTINCT) {
            return "COUNT(DISTINCT " + argument + ")";
        }
        return function.sql() + "(" + argument + ")";
    }
}
