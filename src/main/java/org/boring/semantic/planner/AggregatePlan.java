package org.boring.semantic.planner;

import org.boring.semantic.ir.AggregateSpec;
import org.boring.semantic.ir.LoweringException;
import org.boring.semantic.model.MeasureResolver;
import org.boring.semantic.plan.AggregateExpression;
import org.boring.semantic.plan.ColumnCollector;
import org.boring.semantic.plan.ColumnReference;
import org.boring.semantic.plan.Expression;
import org.boring.semantic.resolve.FieldResolution;
import org.boring.semantic.resolve.OutputColumnScope;
import org.boring.semantic.resolve.ResolvedField;
import org.boring.semantic.resolve.RowFieldScope;
import org.boring.semantic.resolve.RowScope;
import org.boring.semantic.resolve.UnknownFieldException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The aggregation work behind one {@link org.boring.semantic.ir.SemanticAggregate}.
 *
 * Requested aggregates are reduced to base aggregates (one aggregate expression over the
 * rows of one owning table, computed per group) and output expressions over the base
 * columns. Calculated measures are bound here: their measure references become columns
 * of the grouped result ({@value #GROUPED_ALIAS}) and their {@code all(...)} references
 * columns of the grand-total result ({@value #TOTALS_ALIAS}).
 *
 * Base columns are named after the requested output when a base measure or field aggregate
 * is requested directly, and after the qualified measure name ({@code orders.revenue})
 * when it is only reached through calculated measures.
 */
public final class AggregatePlan {

    public static final String GROUPED_ALIAS = "__grouped";
    public static final String TOTALS_ALIAS = "__totals";

    /**
     * @param column     The column the aggregate is computed as
     * @param owner      The semantic table whose rows are aggregated, null after aggregation
     * @param expression The aggregate expression
     */
    public record BaseAggregate(String column, String owner, Expression expression) {
    }

    private final Map<String, BaseAggregate> bases;
    private final Set<String> totals;
    private final Map<String, Expression> outputs;

    private AggregatePlan(Map<String, BaseAggregate> bases, Set<String> totals, Map<String, Expression> outputs) {
        this.bases = Collections.unmodifiableMap(bases);
        this.totals = Collections.unmodifiableSet(totals);
        this.outputs = Collections.unmodifiableMap(outputs);
    }

    /**
     * Plans aggregates over a row-level relation.
     *
     * @throws LoweringException if a name cannot be resolved or calculated measures are circular
     */
    public static AggregatePlan forRows(Map<String, AggregateSpec> aggregates, FieldResolution resolution,
            String nodeType) {
        return new RowPlanner(resolution, nodeType).plan(aggregates);
    }

    /**
     * Plans aggregates over the output columns of an aggregated result. Only field
     * aggregates are possible there.
     */
    public static AggregatePlan forOutputs(Map<String, AggregateSpec> aggregates, OutputColumnScope columns,
            String nodeType) {
        Map<String, BaseAggregate> bases = new LinkedHashMap<>();
        Map<String, Expression> outputs = new LinkedHashMap<>();
        for (Map.Entry<String, AggregateSpec> entry : aggregates.entrySet()) {
            String name = entry.getKey();
            if (!(entry.getValue() instanceof AggregateSpec.FieldAggregate fieldAggregate)) {
                throw new LoweringException(nodeType, "'" + name + "' references measures, which are not available "
                        + "after aggregation; aggregate an output column instead");
            }
            Expression argument = null;
            if (fieldAggregate.field() != null) {
                try {
                    argument = columns.field(fieldAggregate.field());
                } catch (UnknownFieldException e) {
                    throw e.at(nodeType);
                }
            }
            AggregateExpression expression = new AggregateExpression(fieldAggregate.function(), argument);
            bases.put(name, new BaseAggregate(name, null, expression));
            outputs.put(name, ColumnReference.of(GROUPED_ALIAS, name, expression.type()));
        }
        return new AggregatePlan(bases, new LinkedHashSet<>(), outputs);
    }

    // ==================== Accessors ====================

    public List<BaseAggregate> bases() {
        return List.copyOf(bases.values());
    }

    public List<BaseAggregate> basesOwnedBy(String table) {
        return bases.values().stream().filter(b -> table.equals(b.owner())).toList();
    }

    /**
     * @return The tables owning at least one base aggregate, in first-use order
     */
    public Set<String> owners() {
        Set<String> owners = new LinkedHashSet<>();
        for (BaseAggregate base : bases.values()) {
            if (base.owner() != null) {
                owners.add(base.owner());
            }
        }
        return owners;
    }

    /**
     * @return The base aggregates the grand-total result must provide
     */
    public List<BaseAggregate> totals() {
        return totals.stream().map(bases::get).toList();
    }

    /**
     * @return Output name to expression over {@value #GROUPED_ALIAS} and {@value #TOTALS_ALIAS}
     */
    public Map<String, Expression> outputs() {
        return outputs;
    }

    /**
     * @return false when the grouped result (keys followed by base columns) already is
     *         the requested output
     */
    public boolean needsOuterProjection() {
        if (!totals.isEmpty() || bases.size() != outputs.size()) {
            return true;
        }
        for (Map.Entry<String, Expression> output : outputs.entrySet()) {
            if (!(output.getValue() instanceof ColumnReference ref)
                    || !GROUPED_ALIAS.equals(ref.tableAlias())
                    || !ref.columnName().equals(output.getKey())) {
                return true;
            }
        }
        return false;
    }

    // ==================== Row planning ====================

    private static final class RowPlanner {
        private final FieldResolution resolution;
        private final String nodeType;
        private final Map<String, BaseAggregate> bases = new LinkedHashMap<>();
        private final Map<String, String> columnsByMeasure = new LinkedHashMap<>();
        private final Set<String> totals = new LinkedHashSet<>();
        private final Deque<String> evaluating = new ArrayDeque<>();

        RowPlanner(FieldResolution resolution, String nodeType) {
            this.resolution = resolution;
            this.nodeType = nodeType;
        }

        AggregatePlan plan(Map<String, AggregateSpec> aggregates) {
            // direct requests claim their output names first
            for (Map.Entry<String, AggregateSpec> entry : aggregates.entrySet()) {
                String name = entry.getKey();
                AggregateSpec spec = entry.getValue();
                if (spec instanceof AggregateSpec.MeasureRef ref) {
                    ResolvedField measure = resolveMeasure(ref.measure(), null);
                    if (!measure.measure().isCalculated()) {
                        addBase(measure, name);
                    }
                } else if (spec instanceof AggregateSpec.FieldAggregate fieldAggregate) {
                    addFieldAggregate(name, fieldAggregate);
                }
            }

            Map<String, Expression> outputs = new LinkedHashMap<>();
            for (Map.Entry<String, AggregateSpec> entry : aggregates.entrySet()) {
                String name = entry.getKey();
                AggregateSpec spec = entry.getValue();
                if (spec instanceof AggregateSpec.MeasureRef ref) {
                    outputs.put(name, measure(resolveMeasure(ref.measure(), null), false));
                } else if (spec instanceof AggregateSpec.Calculated calculated) {
                    outputs.put(name, calculated.expr().apply(new Resolver(null, false)));
                } else {
                    outputs.put(name, grouped(name));
                }
            }
            return new AggregatePlan(new LinkedHashMap<>(bases), new LinkedHashSet<>(totals), outputs);
        }

        private ResolvedField resolveMeasure(String name, String owner) {
            try {
                return resolution.measure(name, owner);
            } catch (UnknownFieldException e) {
                throw e.at(nodeType);
            }
        }

        private void addBase(ResolvedField measure, String column) {
            if (columnsByMeasure.containsKey(measure.qualifiedName()) && bases.containsKey(column)) {
                return;
            }
            Expression expression = measure.measure().baseExpr().apply(new RowScope(measure.table()));
            bases.put(column, new BaseAggregate(column, measure.table().name(), expression));
            columnsByMeasure.putIfAbsent(measure.qualifiedName(), column);
        }

        private void addFieldAggregate(String name, AggregateSpec.FieldAggregate fieldAggregate) {
            if (fieldAggregate.field() == null) {
                bases.put(name, new BaseAggregate(name, resolution.leftmost().name(),
                        new AggregateExpression(fieldAggregate.function(), null)));
                return;
            }
            Expression argument;
            try {
                argument = new RowFieldScope(resolution).field(fieldAggregate.field());
            } catch (UnknownFieldException e) {
                throw e.at(nodeType);
            }
            Set<String> tables = ColumnCollector.collect(argument).keySet();
            if (tables.size() > 1) {
                throw new LoweringException(nodeType, "'" + name + "' aggregates columns of several tables: " + tables);
            }
            String owner = tables.isEmpty() ? resolution.leftmost().name() : tables.iterator().next();
            bases.put(name, new BaseAggregate(name, owner, new AggregateExpression(fieldAggregate.function(), argument)));
        }

        /**
         * The value of a measure in the grouped result, or in the totals when {@code total}.
         */
        private Expression measure(ResolvedField measure, boolean total) {
            if (!measure.measure().isCalculated()) {
                String column = columnsByMeasure.get(measure.qualifiedName());
                if (column == null) {
                    column = measure.qualifiedName();
                    addBase(measure, column);
                }
                if (total) {
                    totals.add(column);
                    return ColumnReference.of(TOTALS_ALIAS, column, bases.get(column).expression().type());
                }
                return grouped(column);
            }
            String key = measure.qualifiedName() + (total ? " (all)" : "");
            if (evaluating.contains(key)) {
                List<String> cycle = new ArrayList<>(evaluating);
                Collections.reverse(cycle);
                cycle.add(key);
                throw new LoweringException(nodeType, "circular measure reference: " + String.join(" -> ", cycle));
            }
            evaluating.push(key);
            try {
                return measure.measure().calculatedExpr().apply(new Resolver(measure.table().name(), total));
            } finally {
                evaluating.pop();
            }
        }

        private Expression grouped(String column) {
            return ColumnReference.of(GROUPED_ALIAS, column, bases.get(column).expression().type());
        }

        /**
         * Measure lookup for calculated measures, scoped to the owning table.
         */
        private final class Resolver implements MeasureResolver {
            private final String owner;
            private final boolean total;

            Resolver(String owner, boolean total) {
                this.owner = owner;
                this.total = total;
            }

            @Override
            public Expression measure(String name) {
                return RowPlanner.this.measure(resolveMeasure(name, owner), total);
            }

            @Override
            public Expression all(String name) {
                return RowPlanner.this.measure(resolveMeasure(name, owner), true);
            }
        }
    }
}
