package org.boring.semantic.plan;

import org.boring.semantic.store.SqlDataType;

/**
 * Sealed interface representing expressions in the relational plan.
 * Expressions are used in filters, projections, grouping keys and aggregates.
 * 
 * Includes:
 * - ColumnReference: reference to a column
 * - Literal: constant value
 * - ComparisonExpression: comparison operators (=, <, >, LIKE, IS NULL, etc.)
 * - LogicalExpression: boolean operators (AND, OR, NOT)
 * - AggregateExpression: SUM, COUNT, AVG, MIN, MAX, COUNT DISTINCT
 */
public sealed interface Expression
        permits ColumnReference, Literal, ComparisonExpression, LogicalExpression, InExpression,
        AggregateExpression, ArithmeticExpression, SqlFunctionCall, DateTruncExpression {

    /**
     * Accept method for the expression visitor pattern.
     * 
     * @param visitor The visitor to accept
     * @param <T>     The return type of the visitor
     * @return The result of visiting this expression
     */
    <T> T accept(ExpressionVisitor<T> visitor);

    /**
     * Returns the SQL type of this expression.
     * Used for type-aware literal conversion in filters.
     * 
     * @return The SQL type, UNKNOWN when it cannot be inferred
     */
    SqlDataType type();
}
