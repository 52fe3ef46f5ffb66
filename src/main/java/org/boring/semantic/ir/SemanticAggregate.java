package org.boring.semantic.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Computes aggregates, per group when the source is a {@link SemanticGroupBy}, otherwise as a
 * single grand-total row.
 *
 * @param source        The aggregated relation
 * @param aggregates    Output name to aggregate, in output order
 * @param preAggregated Set by the join planner when the join arms below were pre-aggregated
 */
public record SemanticAggregate(
        SemanticNode source,
        Map<String, AggregateSpec> aggregates,
        boolean preAggregated) implements SemanticNode {

    public SemanticAggregate {
        Objects.requireNonNull(source, "Source cannot be null");
        Objects.requireNonNull(aggregates, "Aggregates cannot be null");
        aggregates = Collections.unmodifiableMap(new LinkedHashMap<>(aggregates));
    }

    public SemanticAggregate(SemanticNode source, Map<String, AggregateSpec> aggregates) {
        this(source, aggregates, false);
    }

    /**
     * @return The same aggregate over a rewritten source
     */
    public SemanticAggregate withSource(SemanticNode newSource, boolean newPreAggregated) {
        return new SemanticAggregate(newSource, aggregates, newPreAggregated);
    }

    @Override
    public <T> T accept(SemanticNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return "Aggregate(" + aggregates.keySet() + (preAggregated ? ", preAggregated" : "") + ", " + source + ")";
    }
}
