package org.boring.semantic.transpiler;

import org.boring.semantic.plan.AggregateExpression;
import org.boring.semantic.plan.ArithmeticExpression;
import org.boring.semantic.plan.ColumnReference;
import org.boring.semantic.plan.ComparisonExpression;
import org.boring.semantic.plan.DateTruncExpression;
import org.boring.semantic.plan.Expression;
import org.boring.semantic.plan.ExpressionVisitor;
import org.boring.semantic.plan.FilterNode;
import org.boring.semantic.plan.GroupByNode;
import org.boring.semantic.plan.InExpression;
import org.boring.semantic.plan.JoinNode;
import org.boring.semantic.plan.LimitNode;
import org.boring.semantic.plan.Literal;
import org.boring.semantic.plan.LogicalExpression;
import org.boring.semantic.plan.ProjectNode;
import org.boring.semantic.plan.Projection;
import org.boring.semantic.plan.RelationNode;
import org.boring.semantic.plan.RelationNodeVisitor;
import org.boring.semantic.plan.SortNode;
import org.boring.semantic.plan.SqlFunctionCall;
import org.boring.semantic.plan.SubqueryNode;
import org.boring.semantic.plan.TableNode;
import org.boring.semantic.store.Table;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Transpiles a RelationNode tree into a SQL string.
 * 
 * Row-level trees (tables, joins and named subqueries, optionally filtered) are fused
 * into a single SELECT ... FROM ... WHERE; any other node used as an input is nested
 * as a subquery. ORDER BY and LIMIT are appended to the statement they sit on.
 */
public final class SQLGenerator implements RelationNodeVisitor<String>, ExpressionVisitor<String> {

    private static final String SUBQUERY_ALIAS = "subq";

    private final SQLDialect dialect;

    public SQLGenerator(SQLDialect dialect) {
        this.dialect = Objects.requireNonNull(dialect, "Dialect cannot be null");
    }

    /**
     * Generates SQL from a relation node tree.
     * 
     * @param node The root node of the plan
     * @return The generated SQL string
     */
    public String generate(RelationNode node) {
        return node.accept(this);
    }

    /**
     * Generates SQL from an expression.
     * 
     * @param expression The expression to generate SQL for
     * @return The generated SQL string
     */
    public String generateExpression(Expression expression) {
        return expression.accept(this);
    }

    // ==================== RelationNode Visitors ====================

    @Override
    public String visit(TableNode table) {
        return "SELECT * FROM " + fromItem(table);
    }

    @Override
    public String visit(SubqueryNode subquery) {
        return "SELECT * FROM " + fromItem(subquery);
    }

    @Override
    public String visit(JoinNode join) {
        return "SELECT * FROM " + fromItem(join);
    }

    @Override
    public String visit(FilterNode filter) {
        return "SELECT * " + fromClause(filter);
    }

    @Override
    public String visit(ProjectNode project) {
        return "SELECT " + (project.distinct() ? "DISTINCT " : "")
                + formatProjections(project.projections())
                + " " + fromClause(project.source());
    }

    @Override
    public String visit(GroupByNode groupBy) {
        List<Projection> selected = new ArrayList<>(groupBy.groupings());
        selected.addAll(groupBy.aggregations());

        var sb = new StringBuilder("SELECT ");
        sb.append(formatProjections(selected));
        sb.append(" ").append(fromClause(groupBy.source()));
        if (!groupBy.groupings().isEmpty()) {
            sb.append(" GROUP BY ");
            sb.append(groupBy.groupings().stream()
                    .map(p -> p.expression().accept(this))
                    .collect(Collectors.joining(", ")));
        }
        return sb.toString();
    }

    @Override
    public String visit(SortNode sort) {
        String orderBy = sort.columns().stream()
                .map(c -> c.expression().accept(this) + " " + c.direction().name())
                .collect(Collectors.joining(", "));
        RelationNode source = sort.source();
        if (source instanceof SortNode || source instanceof LimitNode) {
            return "SELECT * " + nestedFrom(source) + " ORDER BY " + orderBy;
        }
        return source.accept(this) + " ORDER BY " + orderBy;
    }

    @Override
    public String visit(LimitNode limit) {
        RelationNode source = limit.source();
        String base = source instanceof LimitNode
                ? "SELECT * " + nestedFrom(source)
                : source.accept(this);

        var sb = new StringBuilder(base);
        if (limit.limit() != null) {
            sb.append(" LIMIT ").append(limit.limit());
        }
        if (limit.offset() > 0) {
            sb.append(" OFFSET ").append(limit.offset());
        }
        return sb.toString();
    }

    // ==================== FROM clause ====================

    /**
     * Renders the FROM (and WHERE) clause that reads from the given node.
     */
    private String fromClause(RelationNode node) {
        List<Expression> conditions = FilterNode.conditionChain(node);
        RelationNode base = FilterNode.unfiltered(node);

        String from = isFromItem(base) ? "FROM " + fromItem(base) : nestedFrom(base);
        if (conditions.isEmpty()) {
            return from;
        }
        return from + " WHERE " + conditions.stream()
                .map(c -> c.accept(this))
                .collect(Collectors.joining(" AND "));
    }

    private String nestedFrom(RelationNode node) {
        return "FROM (" + node.accept(this) + ") AS " + dialect.quoteIdentifier(SUBQUERY_ALIAS);
    }

    private static boolean isFromItem(RelationNode node) {
        return node instanceof TableNode || node instanceof SubqueryNode || node instanceof JoinNode;
    }

    private String fromItem(RelationNode node) {
        if (node instanceof TableNode table) {
            String tableName = quoteTable(table.table());
            if (table.isPruned()) {
                String columns = table.columns().stream()
                        .map(dialect::quoteIdentifier)
                        .collect(Collectors.joining(", "));
                tableName = "(SELECT " + columns + " FROM " + tableName + ")";
            }
            return tableName + " AS " + dialect.quoteIdentifier(table.alias());
        }
        if (node instanceof SubqueryNode subquery) {
            return "(" + subquery.source().accept(this) + ") AS " + dialect.quoteIdentifier(subquery.alias());
        }
        if (node instanceof JoinNode join) {
            String right = join.right() instanceof JoinNode
                    ? "(" + fromItem(join.right()) + ")"
                    : fromItem(join.right());
            String sql = fromItem(join.left()) + " " + join.joinType().toSql() + " " + right;
            if (join.condition() != null) {
                sql += " ON " + join.condition().accept(this);
            }
            return sql;
        }
        return "(" + node.accept(this) + ") AS " + dialect.quoteIdentifier(SUBQUERY_ALIAS);
    }

    private String quoteTable(Table table) {
        if (table.schemaName().isEmpty()) {
            return dialect.quoteIdentifier(table.name());
        }
        return dialect.quoteIdentifier(table.schemaName()) + "." + dialect.quoteIdentifier(table.name());
    }

    private String formatProjections(List<Projection> projections) {
        return projections.stream()
                .map(p -> p.expression().accept(this) + " AS " + dialect.quoteIdentifier(p.alias()))
                .collect(Collectors.joining(", "));
    }

    // ==================== Expression Visitors ====================

    @Override
    public String visitColumnReference(ColumnReference columnRef) {
        if (!columnRef.isQualified()) {
            return dialect.quoteIdentifier(columnRef.columnName());
        }
        return dialect.quoteIdentifier(columnRef.tableAlias()) + "."
                + dialect.quoteIdentifier(columnRef.columnName());
    }

    @Override
    public String visitLiteral(Literal literal) {
        if (literal.value() == null) {
            return dialect.formatNull();
        }
        return switch (literal.literalType()) {
            case STRING -> dialect.quoteStringLiteral((String) literal.value());
            case DATE -> dialect.formatDateLiteral((String) literal.value());
            case TIMESTAMP -> dialect.formatTimestampLiteral((String) literal.value());
            case BOOLEAN -> dialect.formatBoolean((Boolean) literal.value());
            case NULL -> dialect.formatNull();
            case INTEGER, DECIMAL -> literal.value() instanceof BigDecimal decimal
                    ? decimal.toPlainString()
                    : String.valueOf(literal.value());
        };
    }

    @Override
    public String visitComparison(ComparisonExpression comparison) {
        String left = comparison.left().accept(this);
        if (comparison.operator().isUnary()) {
            return left + " " + comparison.operator().toSql();
        }
        return left + " " + comparison.operator().toSql() + " " + comparison.right().accept(this);
    }

    @Override
    public String visitLogical(LogicalExpression logical) {
        if (logical.operator() == LogicalExpression.LogicalOperator.NOT) {
            return "NOT (" + logical.operands().get(0).accept(this) + ")";
        }
        return "(" + logical.operands().stream()
                .map(o -> o.accept(this))
                .collect(Collectors.joining(" " + logical.operator().name() + " ")) + ")";
    }

    @Override
    public String visitIn(InExpression in) {
        if (in.values().isEmpty()) {
            // x IN () is never true
            return dialect.formatBoolean(in.negated());
        }
        return in.operand().accept(this) + (in.negated() ? " NOT IN (" : " IN (")
                + in.values().stream().map(v -> v.accept(this)).collect(Collectors.joining(", "))
                + ")";
    }

    @Override
    public String visitAggregate(AggregateExpression aggregate) {
        if (aggregate.isCountAll()) {
            return "COUNT(*)";
        }
        String argument = aggregate.argument().accept(this);
        if (aggregate.function() == AggregateExpression.AggregateFunction.COUNT_DISTINCT) {
            return "COUNT(DISTINCT " + argument + ")";
        }
        return aggregate.function().sql() + "(" + argument + ")";
    }

    @Override
    public String visitArithmetic(ArithmeticExpression arithmetic) {
        return "(" + arithmetic.left().accept(this) + " " + arithmetic.operator().symbol() + " "
                + arithmetic.right().accept(this) + ")";
    }

    @Override
    public String visitFunctionCall(SqlFunctionCall functionCall) {
        return functionCall.sqlFunctionName() + "("
                + functionCall.arguments().stream().map(a -> a.accept(this)).collect(Collectors.joining(", "))
                + ")";
    }

    @Override
    public String visitDateTrunc(DateTruncExpression dateTrunc) {
        return dialect.formatDateTrunc(dateTrunc.part().sql(), dateTrunc.argument().accept(this));
    }
}
