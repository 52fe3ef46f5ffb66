package org.boring.semantic.plan;

import org.boring.semantic.store.SqlDataType;

import java.util.Objects;

/**
 * Represents an arithmetic expression in SQL.
 * 
 * Supports: +, -, *, /
 * 
 * @param left     The left operand
 * @param operator The arithmetic operator
 * @param right    The right operand
 */
public record ArithmeticExpression(
        Expression left,
        Operator operator,
        Expression right) implements Expression {

    public enum Operator {
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*"),
        DIVIDE("/");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    public ArithmeticExpression {
        Objects.requireNonNull(left, "Left operand cannot be null");
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(right, "Right operand cannot be null");
    }

    public static ArithmeticExpression add(Expression left, Expression right) {
        return new ArithmeticExpression(left, Operator.ADD, right);
    }

    public static ArithmeticExpression subtract(Expression left, Expression right) {
        return new ArithmeticExpression(left, Operator.SUBTRACT, right);
    }

    public static ArithmeticExpression multiply(Expression left, Expression right) {
        return new ArithmeticExpression(left, Operator.MULTIPLY, right);
    }

    public static ArithmeticExpression divide(Expression left, Expression right) {
        return new ArithmeticExpression(left, Operator.DIVIDE, right);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitArithmetic(this);
    }

    @Override
    public SqlDataType type() {
        // Integer arithmetic stays integral, except division
        boolean integral = (left.type() == SqlDataType.INTEGER || left.type() == SqlDataType.BIGINT)
                && (right.type() == SqlDataType.INTEGER || right.type() == SqlDataType.BIGINT);
        if (integral && operator != Operator.DIVIDE) {
            return SqlDataType.BIGINT;
        }
        return SqlDataType.DOUBLE;
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.symbol() + " " + right + ")";
    }
}
