package org.boring.semantic.plan;

/**
 * Visitor interface for traversing Expression trees.
 * 
 * @param <T> The return type of the visitor methods
 */
public interface ExpressionVisitor<T> {

    /**
     * Visit a column reference expression.
     */
    T visitColumnReference(ColumnReference columnRef);

    /**
     * Visit a literal expression.
     */
    T visitLiteral(Literal literal);

    /**
     * Visit a comparison expression.
     */
    T visitComparison(ComparisonExpression comparison);

    /**
     * Visit a logical expression.
     */
    T visitLogical(LogicalExpression logical);

    /**
     * Visit an IN expression (operand IN (values)).
     */
    T visitIn(InExpression in);

    /**
     * Visit an aggregate expression (SUM, COUNT, etc.).
     */
    T visitAggregate(AggregateExpression aggregate);

    /**
     * Visit an arithmetic expression.
     */
    T visitArithmetic(ArithmeticExpression arithmetic);

    /**
     * Visit a SQL function call expression.
     */
    T visitFunctionCall(SqlFunctionCall functionCall);

    /**
     * Visit a date truncation expression.
     */
    T visitDateTrunc(DateTruncExpression dateTrunc);
}
