package org.boring.semantic.planner;

import org.boring.semantic.ir.Cardinality;
import org.boring.semantic.ir.SemanticAggregate;
import org.boring.semantic.ir.SemanticFilter;
import org.boring.semantic.ir.SemanticGroupBy;
import org.boring.semantic.ir.SemanticJoin;
import org.boring.semantic.ir.SemanticNode;
import org.boring.semantic.ir.SemanticPreAggregate;
import org.boring.semantic.ir.SemanticSource;
import org.boring.semantic.plan.AggregateExpression;
import org.boring.semantic.plan.ArithmeticExpression;
import org.boring.semantic.plan.ColumnCollector;
import org.boring.semantic.plan.Expression;
import org.boring.semantic.plan.SqlFunctionCall;
import org.boring.semantic.resolve.FieldResolution;
import org.boring.semantic.resolve.RowFieldScope;
import org.boring.semantic.resolve.UnknownFieldException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Makes aggregation across joins safe from fan traps and chasm traps.
 *
 * For every aggregate over a join tree:
 * <ul>
 *   <li>all joins ONE and every aggregate owned by the leftmost table: no rewrite</li>
 *   <li>otherwise each table owning aggregates becomes a {@link SemanticPreAggregate} arm,
 *       aggregated at its own grain before the join, and the aggregate is marked
 *       pre-aggregated so that lowering computes each arm's final values separately</li>
 *   <li>an UNDECLARED join fails with {@link AmbiguousJoinCardinalityException}, or keeps
 *       the raw join with a warning when undeclared cardinality is allowed</li>
 * </ul>
 *
 * An arm's grain is every column of the table used by join conditions, group keys,
 * filters anywhere in the join tree, and distinct-count arguments.
 */
public final class JoinPlanner extends SemanticRewriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(JoinPlanner.class);

    private final boolean allowUndeclaredCardinality;

    public JoinPlanner(boolean allowUndeclaredCardinality) {
        this.allowUndeclaredCardinality = allowUndeclaredCardinality;
    }

    public SemanticNode apply(SemanticNode node) {
        return rewrite(node);
    }

    @Override
    public SemanticNode visit(SemanticAggregate aggregate) {
        SemanticNode source = rewrite(aggregate.source());
        SemanticAggregate rewritten = aggregate.withSource(source, aggregate.preAggregated());
        if (aggregate.preAggregated()) {
            return rewritten;
        }

        SemanticGroupBy groupBy = source instanceof SemanticGroupBy g ? g : null;
        SemanticNode rows = groupBy != null ? groupBy.source() : source;
        if (!isRowLevel(rows)) {
            return rewritten;
        }
        List<SemanticJoin> joins = new ArrayList<>();
        collectJoins(rows, joins);
        if (joins.isEmpty()) {
            return rewritten;
        }

        FieldResolution resolution = FieldResolution.of(rows);
        AggregatePlan plan = AggregatePlan.forRows(aggregate.aggregates(), resolution, aggregate.nodeType());
        Set<String> owners = plan.owners();
        if (owners.isEmpty()) {
            return rewritten;
        }

        for (SemanticJoin join : joins) {
            if (join.cardinality() == Cardinality.UNDECLARED) {
                List<String> names = List.copyOf(aggregate.aggregates().keySet());
                if (!allowUndeclaredCardinality) {
                    throw new AmbiguousJoinCardinalityException(join.on().toString(), names);
                }
                LOGGER.warn("Aggregating {} across join '{}' with undeclared cardinality; "
                        + "keeping the raw join, results may be inflated", names, join.on());
                return rewritten;
            }
        }

        String leftmost = resolution.leftmost().name();
        boolean allOne = joins.stream().allMatch(j -> j.cardinality() == Cardinality.ONE);
        if (allOne && owners.equals(Set.of(leftmost))) {
            LOGGER.debug("Aggregate {} only uses measures of '{}' across ONE joins: no rewrite",
                    aggregate.aggregates().keySet(), leftmost);
            return rewritten;
        }

        List<String> keys = groupBy != null ? groupBy.keys() : List.of();
        Map<String, Set<String>> grain = grainColumns(rows, keys, resolution, plan, aggregate.nodeType());
        SemanticNode armed = new ArmBuilder(owners, grain, plan).rewrite(rows);
        LOGGER.debug("Pre-aggregating arms {} of aggregate {} at grains {}", owners,
                aggregate.aggregates().keySet(), grain);

        SemanticNode newSource = groupBy != null
                ? new SemanticGroupBy(armed, groupBy.keys(), groupBy.timeGrains())
                : armed;
        return aggregate.withSource(newSource, true);
    }

    private static boolean isRowLevel(SemanticNode node) {
        if (node instanceof SemanticSource) {
            return true;
        }
        if (node instanceof SemanticFilter filter) {
            return isRowLevel(filter.source());
        }
        if (node instanceof SemanticJoin join) {
            return isRowLevel(join.left()) && isRowLevel(join.right());
        }
        return false;
    }

    private static void collectJoins(SemanticNode node, List<SemanticJoin> joins) {
        if (node instanceof SemanticFilter filter) {
            collectJoins(filter.source(), joins);
        } else if (node instanceof SemanticJoin join) {
            joins.add(join);
            collectJoins(join.left(), joins);
            collectJoins(join.right(), joins);
        }
    }

    // ==================== Grain ====================

    private static Map<String, Set<String>> grainColumns(SemanticNode rows, List<String> keys,
            FieldResolution resolution, AggregatePlan plan, String nodeType) {
        List<Expression> used = new ArrayList<>();
        RowFieldScope scope = new RowFieldScope(resolution);
        for (String key : keys) {
            try {
                used.add(scope.field(key));
            } catch (UnknownFieldException e) {
                throw e.at(nodeType);
            }
        }
        collectRowExpressions(rows, used);
        for (AggregatePlan.BaseAggregate base : plan.bases()) {
            collectDistinctArguments(base.expression(), used);
        }

        Map<String, Set<String>> referenced = new LinkedHashMap<>();
        for (Expression expression : used) {
            ColumnCollector.collect(expression)
                    .forEach((alias, columns) -> referenced.computeIfAbsent(alias, a -> new LinkedHashSet<>())
                            .addAll(columns));
        }

        Map<String, Set<String>> grain = new LinkedHashMap<>();
        for (String owner : plan.owners()) {
            Set<String> columns = referenced.getOrDefault(owner, Set.of());
            Set<String> ordered = new LinkedHashSet<>();
            resolution.table(owner).ifPresent(table -> {
                for (String column : table.source().columnNames()) {
                    if (columns.contains(column)) {
                        ordered.add(column);
                    }
                }
            });
            grain.put(owner, ordered);
        }
        return grain;
    }

    /**
     * Join conditions and filter predicates, each evaluated in the scope it is lowered in.
     */
    private static void collectRowExpressions(SemanticNode node, List<Expression> used) {
        if (node instanceof SemanticFilter filter) {
            try {
                used.add(filter.filter().apply(new RowFieldScope(FieldResolution.of(filter.source()))));
            } catch (UnknownFieldException e) {
                throw e.at(filter.nodeType());
            }
            collectRowExpressions(filter.source(), used);
        } else if (node instanceof SemanticJoin join) {
            if (join.on() != null) {
                try {
                    used.add(join.on().apply(new RowFieldScope(FieldResolution.of(join.left())),
                            new RowFieldScope(FieldResolution.of(join.right()))));
                } catch (UnknownFieldException e) {
                    throw e.at(join.nodeType());
                }
            }
            collectRowExpressions(join.left(), used);
            collectRowExpressions(join.right(), used);
        }
    }

    private static void collectDistinctArguments(Expression expression, List<Expression> used) {
        if (expression instanceof AggregateExpression aggregate) {
            if (aggregate.function() == AggregateExpression.AggregateFunction.COUNT_DISTINCT) {
                used.add(aggregate.argument());
            }
            return;
        }
        // aggregates nested in arithmetic or function calls
        for (Expression child : children(expression)) {
            collectDistinctArguments(child, used);
        }
    }

    private static List<Expression> children(Expression expression) {
        if (expression instanceof ArithmeticExpression arithmetic) {
            return List.of(arithmetic.left(), arithmetic.right());
        }
        if (expression instanceof SqlFunctionCall call) {
            return call.arguments();
        }
        return List.of();
    }

    // ==================== Arms ====================

    /**
     * Replaces the scans of owning tables with pre-aggregated arms.
     */
    private static final class ArmBuilder extends SemanticRewriter {
        private final Set<String> owners;
        private final Map<String, Set<String>> grain;
        private final AggregatePlan plan;

        ArmBuilder(Set<String> owners, Map<String, Set<String>> grain, AggregatePlan plan) {
            this.owners = owners;
            this.grain = grain;
            this.plan = plan;
        }

        @Override
        public SemanticNode visit(SemanticSource source) {
            String table = source.table().name();
            if (!owners.contains(table)) {
                return source;
            }
            Map<String, AggregateExpression> partials = new LinkedHashMap<>();
            for (AggregatePlan.BaseAggregate base : plan.basesOwnedBy(table)) {
                partials.putAll(AggregateDecomposition.decompose(base.column(), base.expression(), table).partials());
            }
            return new SemanticPreAggregate(source, table, List.copyOf(grain.get(table)), partials);
        }
    }
}
