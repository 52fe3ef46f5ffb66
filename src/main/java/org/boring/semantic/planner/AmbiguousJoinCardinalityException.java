package org.boring.semantic.planner;

import org.boring.semantic.SemanticException;

import java.util.List;

/**
 * Thrown when measures are aggregated across a join whose cardinality was not declared.
 */
public class AmbiguousJoinCardinalityException extends SemanticException {

    private final String join;
    private final List<String> aggregates;

    public AmbiguousJoinCardinalityException(String join, List<String> aggregates) {
        super("Cannot aggregate " + aggregates + " across join '" + join + "' with undeclared cardinality: "
                + "rows may be counted more than once. Declare the join with joinOne, joinMany or joinCross, "
                + "or set semantic.joins.allowUndeclaredCardinality=true to keep the raw join");
        this.join = join;
        this.aggregates = List.copyOf(aggregates);
    }

    public String join() {
        return join;
    }

    public List<String> aggregates() {
        return aggregates;
    }
}
