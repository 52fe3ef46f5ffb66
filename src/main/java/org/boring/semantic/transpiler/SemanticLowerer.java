package org.boring.semantic.transpiler;

import org.boring.semantic.execution.Backend;
import org.boring.semantic.execution.BackendQuery;
import org.boring.semantic.filter.CompiledFilter;
import org.boring.semantic.ir.LoweringException;
import org.boring.semantic.ir.MutateExpr;
import org.boring.semantic.ir.SemanticAggregate;
import org.boring.semantic.ir.SemanticFilter;
import org.boring.semantic.ir.SemanticGroupBy;
import org.boring.semantic.ir.SemanticJoin;
import org.boring.semantic.ir.SemanticLimit;
import org.boring.semantic.ir.SemanticMutate;
import org.boring.semantic.ir.SemanticNode;
import org.boring.semantic.ir.SemanticNodeVisitor;
import org.boring.semantic.ir.SemanticOrderBy;
import org.boring.semantic.ir.SemanticPreAggregate;
import org.boring.semantic.ir.SemanticProject;
import org.boring.semantic.ir.SemanticSource;
import org.boring.semantic.ir.SortKey;
import org.boring.semantic.model.FieldScope;
import org.boring.semantic.model.TimeGrain;
import org.boring.semantic.plan.ColumnReference;
import org.boring.semantic.plan.ComparisonExpression;
import org.boring.semantic.plan.DateTruncExpression;
import org.boring.semantic.plan.Expression;
import org.boring.semantic.plan.FilterNode;
import org.boring.semantic.plan.GroupByNode;
import org.boring.semantic.plan.JoinNode;
import org.boring.semantic.plan.LimitNode;
import org.boring.semantic.plan.LogicalExpression;
import org.boring.semantic.plan.ProjectNode;
import org.boring.semantic.plan.Projection;
import org.boring.semantic.plan.RelationNode;
import org.boring.semantic.plan.SortNode;
import org.boring.semantic.plan.SubqueryNode;
import org.boring.semantic.plan.TableNode;
import org.boring.semantic.planner.AggregateDecomposition;
import org.boring.semantic.planner.AggregatePlan;
import org.boring.semantic.planner.JoinPlanner;
import org.boring.semantic.planner.ProjectionPushdown;
import org.boring.semantic.planner.TimeDimensionPass;
import org.boring.semantic.resolve.FieldResolution;
import org.boring.semantic.resolve.OutputColumnScope;
import org.boring.semantic.resolve.RowFieldScope;
import org.boring.semantic.resolve.UnknownFieldException;
import org.boring.semantic.store.Column;
import org.boring.semantic.store.SqlDataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Lowers a semantic plan to a relational plan, one case per node type.
 *
 * {@link #lower(SemanticNode)} first runs the rewrite passes (time-grain validation,
 * join planning, projection pushdown), then lowers the rewritten plan bottom-up:
 * <ul>
 *   <li>sources, filters and joins stay row-level, referenced as {@code "table"."column"}</li>
 *   <li>aggregation produces a result whose columns are referenced by output name; a
 *       pre-aggregated aggregate computes each arm's values per group separately and
 *       merges the arms on the group keys</li>
 *   <li>mutate, and filters after aggregation, see only the aggregated output columns</li>
 * </ul>
 *
 * Example:
 * <pre>
 * Aggregate({revenue}, GroupBy([customers.country], Join[MANY](Source(customers), Source(orders))))
 * </pre>
 * lowers to a join of a customers scan with an orders arm pre-aggregated by customer_id,
 * grouped by {@code "customers"."country"}.
 */
public final class SemanticLowerer implements SemanticNodeVisitor<Lowered> {

    private static final Logger LOGGER = LoggerFactory.getLogger(SemanticLowerer.class);

    private static final String SUBQUERY_ALIAS = "subq";
    private static final String KEY_PREFIX = "__key_";
    private static final String ARM_PREFIX = "__arm";

    private final LoweringOptions options;

    public SemanticLowerer(LoweringOptions options) {
        this.options = Objects.requireNonNull(options, "Options cannot be null");
    }

    public SemanticLowerer() {
        this(LoweringOptions.defaults());
    }

    public LoweringOptions options() {
        return options;
    }

    // ==================== Entry points ====================

    /**
     * Rewrites and lowers a plan into a query that can be rendered but not executed.
     */
    public BackendQuery lower(SemanticNode node) {
        return new BackendQuery(plan(node), options.dialect(), null);
    }

    /**
     * Rewrites and lowers a plan into a query for a backend.
     */
    public BackendQuery lower(SemanticNode node, Backend backend) {
        return new BackendQuery(plan(node), backend.dialect(), backend);
    }

    /**
     * Rewrites and lowers a plan to its relational form.
     */
    public RelationNode plan(SemanticNode node) {
        RelationNode relation = lowerRewritten(rewrite(node));
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Lowered {} to SQL: {}", node, new SQLGenerator(options.dialect()).generate(relation));
        }
        return relation;
    }

    /**
     * Runs the rewrite passes only.
     */
    public SemanticNode rewrite(SemanticNode node) {
        SemanticNode rewritten = TimeDimensionPass.apply(node);
        rewritten = new JoinPlanner(options.allowUndeclaredJoinCardinality()).apply(rewritten);
        if (options.projectionPushdown()) {
            SemanticLowerer unpruned = new SemanticLowerer(options.withProjectionPushdown(false));
            rewritten = ProjectionPushdown.apply(rewritten, unpruned::lowerRewritten);
        }
        return rewritten;
    }

    /**
     * Lowers an already rewritten plan.
     */
    public RelationNode lowerRewritten(SemanticNode node) {
        return node.accept(this).toRelation();
    }

    public String toSql(SemanticNode node) {
        return lower(node).toSql();
    }

    private Lowered lowerChild(SemanticNode node) {
        return node.accept(this);
    }

    // ==================== Row-level nodes ====================

    @Override
    public Lowered visit(SemanticSource source) {
        TableNode table = new TableNode(source.table().source(), source.table().name(), source.columns());
        return Lowered.row(table, FieldResolution.of(source));
    }

    @Override
    public Lowered visit(SemanticPreAggregate preAggregate) {
        String alias = preAggregate.tableName();
        SemanticSource source = preAggregate.source();
        TableNode table = new TableNode(source.table().source(), alias, source.columns());

        List<Projection> groupings = new ArrayList<>();
        for (String column : preAggregate.grain()) {
            Column found = source.table().source().column(column);
            groupings.add(Projection.of(ColumnReference.of(alias, column, found.dataType()), column));
        }
        List<Projection> partials = new ArrayList<>();
        preAggregate.partials().forEach((name, aggregate) -> partials.add(Projection.of(aggregate, name)));

        RelationNode arm = new SubqueryNode(new GroupByNode(table, groupings, partials), alias);
        return Lowered.row(arm, FieldResolution.of(preAggregate));
    }

    @Override
    public Lowered visit(SemanticFilter filter) {
        Lowered source = lowerChild(filter.source());
        if (source.isRow()) {
            requireUnshaped(source, filter);
            Expression condition = applyFilter(filter, filter.filter(), new RowFieldScope(source.resolution()));
            return source.withCondition(condition);
        }
        Expression condition = applyFilter(filter, filter.filter(), new OutputColumnScope(source.columns()));
        RelationNode filtered = new FilterNode(
                new SubqueryNode(source.relation(), SUBQUERY_ALIAS), condition);
        return Lowered.result(source.stage(), filtered, source.columns());
    }

    @Override
    public Lowered visit(SemanticJoin join) {
        Lowered left = lowerChild(join.left());
        Lowered right = lowerChild(join.right());
        if (!left.isRow() || !right.isRow()) {
            throw new LoweringException(join.nodeType(), "only row-level relations can be joined");
        }
        requireUnshaped(left, join);
        requireUnshaped(right, join);

        FieldResolution resolution = FieldResolution.of(join);
        List<Expression> onConditions = new ArrayList<>();
        if (join.on() != null) {
            onConditions.add(resolve(join,
                    () -> join.on().apply(new RowFieldScope(left.resolution()), new RowFieldScope(right.resolution()))));
        }

        JoinNode joined;
        List<Expression> where = new ArrayList<>(left.conditions());
        if (join.on() == null) {
            joined = JoinNode.cross(left.relation(), right.relation());
            where.addAll(right.conditions());
        } else {
            onConditions.addAll(right.conditions());
            Expression on = LogicalExpression.and(onConditions);
            joined = switch (join.how()) {
                case INNER -> JoinNode.inner(left.relation(), right.relation(), on);
                case LEFT -> JoinNode.leftOuter(left.relation(), right.relation(), on);
            };
        }

        Lowered result = Lowered.row(joined, resolution);
        for (Expression condition : where) {
            result = result.withCondition(condition);
        }
        return result;
    }

    // ==================== Grouping and aggregation ====================

    /**
     * A group-by without an aggregate yields the distinct key values.
     */
    @Override
    public Lowered visit(SemanticGroupBy groupBy) {
        Lowered source = lowerChild(groupBy.source());
        Map<String, SqlDataType> columns = new LinkedHashMap<>();
        List<Projection> keys;
        RelationNode from;
        if (source.isRow()) {
            requireUnshaped(source, groupBy);
            keys = keyProjections(groupBy, new RowFieldScope(source.resolution()));
            from = source.filtered();
        } else {
            keys = keyProjections(groupBy, new OutputColumnScope(source.columns()));
            from = new SubqueryNode(source.relation(), SUBQUERY_ALIAS);
        }
        keys.forEach(p -> columns.put(p.alias(), p.expression().type()));
        return Lowered.result(Lowered.Stage.COLUMNS, new ProjectNode(from, keys, true), columns);
    }

    @Override
    public Lowered visit(SemanticAggregate aggregate) {
        SemanticGroupBy groupBy = aggregate.source() instanceof SemanticGroupBy g ? g : null;
        SemanticNode rowsNode = groupBy != null ? groupBy.source() : aggregate.source();
        Lowered source = lowerChild(rowsNode);

        AggregatePlan plan;
        List<Projection> keys;
        RelationNode grouped;
        RelationNode totals = null;
        if (source.isRow()) {
            if (source.hasPendingShape()) {
                throw new LoweringException(aggregate.nodeType(),
                        "cannot aggregate a row-level relation that is ordered or limited");
            }
            plan = AggregatePlan.forRows(aggregate.aggregates(), source.resolution(), aggregate.nodeType());
            keys = groupBy == null
                    ? List.of()
                    : keyProjections(groupBy, new RowFieldScope(source.resolution()));
            if (aggregate.preAggregated()) {
                grouped = mergeArms(rowsNode, source, keys, plan, plan.bases(), aggregate);
                if (!plan.totals().isEmpty()) {
                    totals = mergeArms(rowsNode, source, List.of(), plan, plan.totals(), aggregate);
                }
            } else {
                grouped = new GroupByNode(source.filtered(), keys, baseProjections(plan.bases()));
                if (!plan.totals().isEmpty()) {
                    totals = new GroupByNode(source.filtered(), List.of(), baseProjections(plan.totals()));
                }
            }
        } else {
            OutputColumnScope scope = new OutputColumnScope(source.columns());
            plan = AggregatePlan.forOutputs(aggregate.aggregates(), scope, aggregate.nodeType());
            keys = groupBy == null ? List.of() : keyProjections(groupBy, scope);
            grouped = new GroupByNode(new SubqueryNode(source.relation(), SUBQUERY_ALIAS), keys,
                    baseProjections(plan.bases()));
        }

        Map<String, SqlDataType> columns = new LinkedHashMap<>();
        keys.forEach(p -> columns.put(p.alias(), p.expression().type()));
        plan.outputs().forEach((name, expression) -> columns.put(name, expression.type()));
        return Lowered.result(Lowered.Stage.GROUPED, outputs(grouped, totals, keys, plan), columns);
    }

    private static List<Projection> baseProjections(List<AggregatePlan.BaseAggregate> bases) {
        List<Projection> projections = new ArrayList<>();
        for (AggregatePlan.BaseAggregate base : bases) {
            projections.add(Projection.of(base.expression(), base.column()));
        }
        return projections;
    }

    /**
     * Projects the requested outputs from the grouped result, binding calculated measures
     * and grand totals.
     */
    private static RelationNode outputs(RelationNode grouped, RelationNode totals, List<Projection> keys,
            AggregatePlan plan) {
        if (!plan.needsOuterProjection()) {
            return grouped;
        }
        RelationNode from = new SubqueryNode(grouped, AggregatePlan.GROUPED_ALIAS);
        if (totals != null) {
            from = JoinNode.cross(from, new SubqueryNode(totals, AggregatePlan.TOTALS_ALIAS));
        }
        List<Projection> projections = new ArrayList<>();
        for (Projection key : keys) {
            projections.add(Projection.of(
                    ColumnReference.of(AggregatePlan.GROUPED_ALIAS, key.alias(), key.expression().type()),
                    key.alias()));
        }
        plan.outputs().forEach((name, expression) -> projections.add(Projection.of(expression, name)));
        return new ProjectNode(from, projections);
    }

    /**
     * Computes pre-aggregated arms separately and merges them on the group keys.
     *
     * For each arm: the distinct (keys, arm grain, partials) rows of the joined relation,
     * so every arm row counts once per group however many rows of other arms it joined,
     * then the final aggregates of the arm per group.
     */
    private RelationNode mergeArms(SemanticNode rowsNode, Lowered rows, List<Projection> keys, AggregatePlan plan,
            List<AggregatePlan.BaseAggregate> bases, SemanticAggregate aggregate) {
        Map<String, List<AggregatePlan.BaseAggregate>> basesByArm = new LinkedHashMap<>();
        for (AggregatePlan.BaseAggregate base : bases) {
            basesByArm.computeIfAbsent(base.owner(), owner -> new ArrayList<>()).add(base);
        }

        List<String> armAliases = new ArrayList<>();
        Map<String, String> aliasByOwner = new LinkedHashMap<>();
        RelationNode merged = null;
        for (Map.Entry<String, List<AggregatePlan.BaseAggregate>> entry : basesByArm.entrySet()) {
            String table = entry.getKey();
            SemanticPreAggregate arm = findArm(rowsNode, table);
            if (arm == null) {
                throw new LoweringException(aggregate.nodeType(), "no pre-aggregated arm for table '" + table + "'");
            }
            String armAlias = ARM_PREFIX + armAliases.size();
            RelationNode armResult = new SubqueryNode(armResult(rows, keys, arm, entry.getValue()), armAlias);
            if (merged == null) {
                merged = armResult;
            } else if (keys.isEmpty()) {
                merged = JoinNode.cross(merged, armResult);
            } else {
                String first = armAliases.get(0);
                List<Expression> conditions = new ArrayList<>();
                for (int i = 0; i < keys.size(); i++) {
                    SqlDataType type = keys.get(i).expression().type();
                    conditions.add(ComparisonExpression.notDistinctFrom(
                            ColumnReference.of(first, KEY_PREFIX + i, type),
                            ColumnReference.of(armAlias, KEY_PREFIX + i, type)));
                }
                merged = JoinNode.inner(merged, armResult, LogicalExpression.and(conditions));
            }
            armAliases.add(armAlias);
            aliasByOwner.put(table, armAlias);
        }

        List<Projection> projections = new ArrayList<>();
        for (int i = 0; i < keys.size(); i++) {
            Projection key = keys.get(i);
            projections.add(Projection.of(
                    ColumnReference.of(armAliases.get(0), KEY_PREFIX + i, key.expression().type()), key.alias()));
        }
        // requested order, not arm order
        for (AggregatePlan.BaseAggregate base : bases) {
            projections.add(Projection.of(ColumnReference.of(aliasByOwner.get(base.owner()), base.column(),
                    base.expression().type()), base.column()));
        }
        return new ProjectNode(merged, projections);
    }

    private static RelationNode armResult(Lowered rows, List<Projection> keys, SemanticPreAggregate arm,
            List<AggregatePlan.BaseAggregate> bases) {
        String table = arm.tableName();
        List<Projection> distinctColumns = new ArrayList<>();
        List<Projection> groupings = new ArrayList<>();
        for (int i = 0; i < keys.size(); i++) {
            Expression key = keys.get(i).expression();
            distinctColumns.add(Projection.of(key, KEY_PREFIX + i));
            groupings.add(Projection.of(ColumnReference.of(table, KEY_PREFIX + i, key.type()), KEY_PREFIX + i));
        }
        for (String column : arm.grain()) {
            SqlDataType type = arm.source().table().source().column(column).dataType();
            distinctColumns.add(Projection.of(ColumnReference.of(table, column, type), column));
        }

        List<Projection> finals = new ArrayList<>();
        for (AggregatePlan.BaseAggregate base : bases) {
            AggregateDecomposition.Decomposed decomposed =
                    AggregateDecomposition.decompose(base.column(), base.expression(), table);
            decomposed.partials().forEach((name, partial) -> distinctColumns.add(
                    Projection.of(ColumnReference.of(table, name, partial.type()), name)));
            finals.add(Projection.of(decomposed.finalExpression(), base.column()));
        }

        RelationNode distinct = new SubqueryNode(new ProjectNode(rows.filtered(), distinctColumns, true), table);
        return new GroupByNode(distinct, groupings, finals);
    }

    private static SemanticPreAggregate findArm(SemanticNode node, String table) {
        if (node instanceof SemanticPreAggregate arm) {
            return arm.tableName().equals(table) ? arm : null;
        }
        if (node instanceof SemanticFilter filter) {
            return findArm(filter.source(), table);
        }
        if (node instanceof SemanticJoin join) {
            SemanticPreAggregate left = findArm(join.left(), table);
            return left != null ? left : findArm(join.right(), table);
        }
        return null;
    }

    private static List<Projection> keyProjections(SemanticGroupBy groupBy, FieldScope scope) {
        List<Projection> keys = new ArrayList<>();
        for (String key : groupBy.keys()) {
            Expression expression = resolve(groupBy, () -> scope.field(key));
            TimeGrain grain = groupBy.timeGrains().get(key);
            if (grain != null) {
                expression = new DateTruncExpression(grain.truncPart(), expression);
            }
            keys.add(Projection.of(expression, key));
        }
        return keys;
    }

    // ==================== Result shaping ====================

    /**
     * Adds columns computed from the aggregated output columns.
     */
    @Override
    public Lowered visit(SemanticMutate mutate) {
        Lowered source = lowerChild(mutate.source());
        if (source.isRow()) {
            throw new LoweringException(mutate.nodeType(), "mutate applies to aggregated results only; "
                    + "post-aggregation columns cannot reference row-level columns " + mutate.computed().keySet());
        }
        OutputColumnScope scope = new OutputColumnScope(source.columns());
        Map<String, Expression> computed = new LinkedHashMap<>();
        for (Map.Entry<String, MutateExpr> entry : mutate.computed().entrySet()) {
            computed.put(entry.getKey(), resolve(mutate, () -> entry.getValue().apply(scope)));
        }

        List<Projection> projections = new ArrayList<>();
        Map<String, SqlDataType> columns = new LinkedHashMap<>();
        source.columns().forEach((name, type) -> {
            Expression expression = computed.containsKey(name) ? computed.get(name) : ColumnReference.of(name, type);
            projections.add(Projection.of(expression, name));
            columns.put(name, expression.type());
        });
        computed.forEach((name, expression) -> {
            if (!columns.containsKey(name)) {
                projections.add(Projection.of(expression, name));
                columns.put(name, expression.type());
            }
        });
        RelationNode relation = new ProjectNode(new SubqueryNode(source.relation(), SUBQUERY_ALIAS), projections);
        return Lowered.result(source.stage(), relation, columns);
    }

    @Override
    public Lowered visit(SemanticOrderBy orderBy) {
        Lowered source = lowerChild(orderBy.source());
        FieldScope scope;
        if (source.isRow()) {
            if (source.limit() != null || source.offset() > 0) {
                throw new LoweringException(orderBy.nodeType(), "cannot order a row-level relation after a limit");
            }
            scope = new RowFieldScope(source.resolution());
        } else {
            scope = new OutputColumnScope(source.columns());
        }
        List<SortNode.SortColumn> columns = new ArrayList<>();
        for (SortKey key : orderBy.keys()) {
            Expression expression = resolve(orderBy, () -> scope.field(key.field()));
            columns.add(key.direction() == SortKey.Direction.DESC
                    ? SortNode.SortColumn.desc(expression)
                    : SortNode.SortColumn.asc(expression));
        }
        if (source.isRow()) {
            // later ordering keys take precedence over earlier ones
            List<SortNode.SortColumn> combined = new ArrayList<>(columns);
            combined.addAll(source.sort());
            return source.withSort(combined);
        }
        return Lowered.result(source.stage(), new SortNode(source.relation(), columns), source.columns());
    }

    @Override
    public Lowered visit(SemanticLimit limit) {
        Lowered source = lowerChild(limit.source());
        if (source.isRow()) {
            if (source.limit() != null || source.offset() > 0) {
                throw new LoweringException(limit.nodeType(), "a row-level relation can only be limited once");
            }
            return source.withLimit(limit.n(), limit.offset());
        }
        return Lowered.result(source.stage(), new LimitNode(source.relation(), limit.n(), limit.offset()),
                source.columns());
    }

    @Override
    public Lowered visit(SemanticProject project) {
        Lowered source = lowerChild(project.source());
        List<Projection> projections = new ArrayList<>();
        Map<String, SqlDataType> columns = new LinkedHashMap<>();
        FieldScope scope = source.isRow()
                ? new RowFieldScope(source.resolution())
                : new OutputColumnScope(source.columns());
        for (String field : project.fields()) {
            Expression expression = resolve(project, () -> scope.field(field));
            projections.add(Projection.of(expression, field));
            columns.put(field, expression.type());
        }
        if (source.isRow()) {
            RelationNode relation = source.shaped(new ProjectNode(source.filtered(), projections));
            return Lowered.result(Lowered.Stage.COLUMNS, relation, columns);
        }
        RelationNode relation = new ProjectNode(new SubqueryNode(source.relation(), SUBQUERY_ALIAS), projections);
        return Lowered.result(Lowered.Stage.COLUMNS, relation, columns);
    }

    // ==================== Helpers ====================

    private static void requireUnshaped(Lowered source, SemanticNode node) {
        if (source.hasPendingShape()) {
            throw new LoweringException(node.nodeType(),
                    "cannot filter, join or group a row-level relation that is ordered or limited");
        }
    }

    private static Expression applyFilter(SemanticNode node, CompiledFilter filter, FieldScope scope) {
        return resolve(node, () -> filter.apply(scope));
    }

    /**
     * Builds an expression of a node, attributing unknown fields to the node.
     */
    private static Expression resolve(SemanticNode node, Supplier<Expression> resolver) {
        try {
            return resolver.get();
        } catch (UnknownFieldException e) {
            throw e.at(node.nodeType());
        }
    }
}
