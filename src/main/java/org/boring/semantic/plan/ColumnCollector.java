package org.boring.semantic.plan;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Collects every qualified column reference in an expression or relation tree,
 * grouped by the table alias it is qualified with.
 *
 * Unqualified references (output columns of a nested query) are ignored.
 */
public final class ColumnCollector implements ExpressionVisitor<Void>, RelationNodeVisitor<Void> {

    private final Map<String, Set<String>> columnsByAlias = new LinkedHashMap<>();

    /**
     * @return The referenced column names per table alias, in first-seen order
     */
    public static Map<String, Set<String>> collect(Expression expression) {
        ColumnCollector collector = new ColumnCollector();
        expression.accept(collector);
        return collector.columnsByAlias;
    }

    /**
     * @return The referenced column names per table alias, in first-seen order
     */
    public static Map<String, Set<String>> collect(RelationNode node) {
        ColumnCollector collector = new ColumnCollector();
        node.accept(collector);
        return collector.columnsByAlias;
    }

    /**
     * @return The columns of {@code alias} referenced by the expression
     */
    public static Set<String> columnsOf(Expression expression, String alias) {
        return collect(expression).getOrDefault(alias, Set.of());
    }

    private void visitAll(Iterable<? extends Expression> expressions) {
        for (Expression expression : expressions) {
            expression.accept(this);
        }
    }

    private void visitProjections(Iterable<Projection> projections) {
        for (Projection projection : projections) {
            projection.expression().accept(this);
        }
    }

    // ==================== Expressions ====================

    @Override
    public Void visitColumnReference(ColumnReference columnRef) {
        if (columnRef.isQualified()) {
            columnsByAlias.computeIfAbsent(columnRef.tableAlias(), k -> new LinkedHashSet<>())
                    .add(columnRef.columnName());
        }
        return null;
    }

    @Override
    public Void visitLiteral(Literal literal) {
        return null;
    }

    @Override
    public Void visitComparison(ComparisonExpression comparison) {
        comparison.left().accept(this);
        if (comparison.right() != null) {
            comparison.right().accept(this);
        }
        return null;
    }

    @Override
    public Void visitLogical(LogicalExpression logical) {
        visitAll(logical.operands());
        return null;
    }

    @Override
    public Void visitIn(InExpression in) {
        in.operand().accept(this);
        visitAll(in.values());
        return null;
    }

    @Override
    public Void visitAggregate(AggregateExpression aggregate) {
        if (aggregate.argument() != null) {
            aggregate.argument().accept(this);
        }
        return null;
    }

    @Override
    public Void visitArithmetic(ArithmeticExpression arithmetic) {
        arithmetic.left().accept(this);
        arithmetic.right().accept(this);
        return null;
    }

    @Override
    public Void visitFunctionCall(SqlFunctionCall functionCall) {
        visitAll(functionCall.arguments());
        return null;
    }

    @Override
    public Void visitDateTrunc(DateTruncExpression dateTrunc) {
        dateTrunc.argument().accept(this);
        return null;
    }

    // ==================== Relations ====================

    @Override
    public Void visit(TableNode table) {
        return null;
    }

    @Override
    public Void visit(SubqueryNode subquery) {
        subquery.source().accept(this);
        return null;
    }

    @Override
    public Void visit(JoinNode join) {
        join.left().accept(this);
        join.right().accept(this);
        if (join.condition() != null) {
            join.condition().accept(this);
        }
        return null;
    }

    @Override
    public Void visit(FilterNode filter) {
        filter.source().accept(this);
        filter.condition().accept(this);
        return null;
    }

    @Override
    public Void visit(ProjectNode project) {
        project.source().accept(this);
        visitProjections(project.projections());
        return null;
    }

    @Override
    public Void visit(GroupByNode groupBy) {
        groupBy.source().accept(this);
        visitProjections(groupBy.groupings());
        visitProjections(groupBy.aggregations());
        return null;
    }

    @Override
    public Void visit(SortNode sort) {
        sort.source().accept(this);
        for (SortNode.SortColumn column : sort.columns()) {
            column.expression().accept(this);
        }
        return null;
    }

    @Override
    public Void visit(LimitNode limit) {
        limit.source().accept(this);
        return null;
    }
}
