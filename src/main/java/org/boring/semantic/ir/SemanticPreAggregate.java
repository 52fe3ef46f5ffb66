package org.boring.semantic.ir;

import org.boring.semantic.plan.AggregateExpression;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A join arm aggregated at its own grain before it is joined.
 *
 * The arm exposes its grain columns under their own names and table alias, so dimension
 * expressions and join conditions evaluate against it exactly as against the raw table.
 * Only the join planner creates this node.
 *
 * @param source    The arm's table scan
 * @param tableName The semantic table name the arm is aliased as
 * @param grain     The backing columns the arm is grouped by
 * @param partials  Re-aggregable partial aggregates by output column name
 */
public record SemanticPreAggregate(
        SemanticSource source,
        String tableName,
        List<String> grain,
        Map<String, AggregateExpression> partials) implements SemanticNode {

    public SemanticPreAggregate {
        Objects.requireNonNull(source, "Source cannot be null");
        Objects.requireNonNull(tableName, "Table name cannot be null");
        Objects.requireNonNull(grain, "Grain cannot be null");
        Objects.requireNonNull(partials, "Partials cannot be null");
        grain = List.copyOf(grain);
        partials = Collections.unmodifiableMap(new LinkedHashMap<>(partials));
        if (grain.isEmpty() && partials.isEmpty()) {
            throw new IllegalArgumentException("Pre-aggregated arm '" + tableName + "' has neither grain nor partials");
        }
    }

    public SemanticPreAggregate withSource(SemanticSource newSource) {
        return new SemanticPreAggregate(newSource, tableName, grain, partials);
    }

    @Override
    public <T> T accept(SemanticNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return "PreAggregate(" + tableName + " grain=" + grain + " partials=" + partials.keySet() + ")";
    }
}
