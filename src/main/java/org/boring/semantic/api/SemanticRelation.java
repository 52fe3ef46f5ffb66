package org.boring.semantic.api;

import org.boring.semantic.execution.Backend;
import org.boring.semantic.execution.BackendQuery;
import org.boring.semantic.execution.BufferedResult;
import org.boring.semantic.filter.CompiledFilter;
import org.boring.semantic.filter.Filter;
import org.boring.semantic.filter.FilterCondition;
import org.boring.semantic.ir.AggregateSpec;
import org.boring.semantic.ir.Cardinality;
import org.boring.semantic.ir.JoinKey;
import org.boring.semantic.ir.JoinType;
import org.boring.semantic.ir.MutateExpr;
import org.boring.semantic.ir.SemanticAggregate;
import org.boring.semantic.ir.SemanticFilter;
import org.boring.semantic.ir.SemanticJoin;
import org.boring.semantic.ir.SemanticLimit;
import org.boring.semantic.ir.SemanticMutate;
import org.boring.semantic.ir.SemanticNode;
import org.boring.semantic.ir.SemanticOrderBy;
import org.boring.semantic.ir.SemanticProject;
import org.boring.semantic.ir.SemanticSource;
import org.boring.semantic.ir.SortKey;
import org.boring.semantic.model.SemanticTable;
import org.boring.semantic.resolve.FieldResolution;
import org.boring.semantic.transpiler.LoweringOptions;
import org.boring.semantic.transpiler.SemanticLowerer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Fluent, immutable query builder over semantic tables.
 *
 * Every operation returns a new relation wrapping a larger plan; nothing is resolved
 * until the plan is lowered.
 *
 * Example:
 * <pre>
 * SemanticRelation.of(customers)
 *     .joinMany(SemanticRelation.of(orders), "customers.customer_id", "orders.customer_id")
 *     .filter("customers.country = 'US'")
 *     .groupBy("customers.segment")
 *     .aggregate("orders.revenue", "customers.total_ltv")
 *     .orderBy(SortKey.desc("orders.revenue"))
 *     .execute(backend);
 * </pre>
 */
public final class SemanticRelation {

    private final SemanticNode node;

    SemanticRelation(SemanticNode node) {
        this.node = Objects.requireNonNull(node, "Node cannot be null");
    }

    public static SemanticRelation of(SemanticTable table) {
        return new SemanticRelation(SemanticSource.of(table));
    }

    /**
     * Wraps an existing plan.
     */
    public static SemanticRelation of(SemanticNode node) {
        return new SemanticRelation(node);
    }

    public SemanticNode node() {
        return node;
    }

    // ==================== Row operations ====================

    public SemanticRelation filter(Filter filter) {
        return new SemanticRelation(new SemanticFilter(node, filter.compile()));
    }

    /**
     * Filters with the text grammar, e.g. {@code "amount > 100 and status in ('paid', 'sent')"}.
     */
    public SemanticRelation filter(String expression) {
        return filter(Filter.expression(expression));
    }

    public SemanticRelation filter(FilterCondition condition) {
        return filter(Filter.where(condition));
    }

    public SemanticRelation filter(CompiledFilter predicate) {
        return filter(Filter.predicate(predicate));
    }

    /**
     * Joins a relation with at most one row per row of this one.
     */
    public SemanticRelation joinOne(SemanticRelation other, String leftField, String rightField) {
        return join(other, JoinKey.on(leftField, rightField), Cardinality.ONE, JoinType.INNER);
    }

    /**
     * Joins a relation with any number of rows per row of this one. The join is a left
     * outer join: rows without matches are kept, so aggregates of this side do not change.
     */
    public SemanticRelation joinMany(SemanticRelation other, String leftField, String rightField) {
        return join(other, JoinKey.on(leftField, rightField), Cardinality.MANY, JoinType.LEFT);
    }

    /**
     * Joins without declaring cardinality. Aggregating measures across such a join fails
     * unless undeclared cardinality is allowed by the lowering options.
     */
    public SemanticRelation join(SemanticRelation other, String leftField, String rightField) {
        return join(other, JoinKey.on(leftField, rightField), Cardinality.UNDECLARED, JoinType.INNER);
    }

    public SemanticRelation joinCross(SemanticRelation other) {
        return new SemanticRelation(new SemanticJoin(node, other.node, null, Cardinality.CROSS, JoinType.INNER));
    }

    public SemanticRelation join(SemanticRelation other, JoinKey on, Cardinality cardinality, JoinType how) {
        Objects.requireNonNull(other, "Joined relation cannot be null");
        return new SemanticRelation(new SemanticJoin(node, other.node, on, cardinality, how));
    }

    // ==================== Grouping and aggregation ====================

    public GroupedRelation groupBy(String... keys) {
        return new GroupedRelation(node, Arrays.asList(keys), Map.of());
    }

    /**
     * Grand totals of declared measures, each output under the name it is requested by.
     */
    public SemanticRelation aggregate(String... measures) {
        return aggregate(measureSpecs(measures));
    }

    /**
     * Grand totals: one row.
     */
    public SemanticRelation aggregate(Map<String, AggregateSpec> aggregates) {
        return new SemanticRelation(new SemanticAggregate(node, aggregates));
    }

    static Map<String, AggregateSpec> measureSpecs(String... measures) {
        Map<String, AggregateSpec> specs = new LinkedHashMap<>();
        for (String measure : measures) {
            if (specs.put(measure, AggregateSpec.measure(measure)) != null) {
                throw new IllegalArgumentException("Measure '" + measure + "' requested twice");
            }
        }
        return specs;
    }

    // ==================== Result shaping ====================

    /**
     * Adds a column computed from the output columns of an aggregated result.
     */
    public SemanticRelation mutate(String name, MutateExpr expr) {
        Map<String, MutateExpr> computed = new LinkedHashMap<>();
        computed.put(name, expr);
        return mutate(computed);
    }

    public SemanticRelation mutate(Map<String, MutateExpr> computed) {
        return new SemanticRelation(new SemanticMutate(node, computed));
    }

    public SemanticRelation orderBy(SortKey... keys) {
        return new SemanticRelation(new SemanticOrderBy(node, Arrays.asList(keys)));
    }

    /**
     * Orders ascending by the given fields.
     */
    public SemanticRelation orderBy(String... fields) {
        List<SortKey> keys = new ArrayList<>();
        for (String field : fields) {
            keys.add(SortKey.asc(field));
        }
        return new SemanticRelation(new SemanticOrderBy(node, keys));
    }

    public SemanticRelation limit(int n) {
        return limit(n, 0);
    }

    public SemanticRelation limit(int n, int offset) {
        return new SemanticRelation(new SemanticLimit(node, n, offset));
    }

    public SemanticRelation select(String... fields) {
        return new SemanticRelation(new SemanticProject(node, Arrays.asList(fields)));
    }

    // ==================== Introspection ====================

    /**
     * @return Every resolvable dimension name of the row-level relation
     */
    public List<String> dimensions() {
        return FieldResolution.of(node).dimensionNames();
    }

    /**
     * @return Every resolvable measure name of the row-level relation
     */
    public List<String> measures() {
        return FieldResolution.of(node).measureNames();
    }

    // ==================== Lowering ====================

    public String sql() {
        return sql(LoweringOptions.defaults());
    }

    public String sql(LoweringOptions options) {
        return new SemanticLowerer(options).toSql(node);
    }

    public BackendQuery lower(Backend backend) {
        return lower(backend, LoweringOptions.defaults());
    }

    public BackendQuery lower(Backend backend, LoweringOptions options) {
        return new SemanticLowerer(options.withDialect(backend.dialect())).lower(node, backend);
    }

    public BufferedResult execute(Backend backend) {
        return lower(backend).execute();
    }

    public BufferedResult execute(Backend backend, LoweringOptions options) {
        return lower(backend, options).execute();
    }

    @Override
    public String toString() {
        return node.toString();
    }
}
