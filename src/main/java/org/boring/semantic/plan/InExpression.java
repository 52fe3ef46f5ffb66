package org.boring.semantic.plan;

import org.boring.semantic.store.SqlDataType;

import java.util.List;
import java.util.Objects;

/**
 * Represents an IN expression: expr IN (value1, value2, ...)
 *
 * @param operand The tested expression
 * @param values  The candidate values
 * @param negated true for NOT IN
 */
public record InExpression(
        Expression operand,
        List<Expression> values,
        boolean negated) implements Expression {

    public InExpression {
        Objects.requireNonNull(operand, "Operand cannot be null");
        Objects.requireNonNull(values, "Values cannot be null");
        values = List.copyOf(values);
    }

    public static InExpression of(Expression operand, List<Expression> values) {
        return new InExpression(operand, values, false);
    }

    public static InExpression notIn(Expression operand, List<Expression> values) {
        return new InExpression(operand, values, true);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitIn(this);
    }

    @Override
    public SqlDataType type() {
        return SqlDataType.BOOLEAN;
    }
}
