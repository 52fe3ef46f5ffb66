package org.boring.semantic.plan;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Represents a GROUP BY operation in the relational plan.
 * Produces SQL GROUP BY clause with aggregate projections.
 * 
 * SQL output:
 * SELECT "t"."region" AS "region", SUM("t"."amount") AS "total"
 * FROM ... GROUP BY "t"."region"
 * 
 * With no grouping columns the node computes a single grand-total row.
 *
 * @param source       The relation being grouped
 * @param groupings    The grouping keys, selected under their aliases
 * @param aggregations The aggregate expressions, selected under their aliases
 */
public record GroupByNode(
        RelationNode source,
        List<Projection> groupings,
        List<Projection> aggregations) implements RelationNode {

    public GroupByNode {
        Objects.requireNonNull(source, "Source node cannot be null");
        Objects.requireNonNull(groupings, "Grouping columns cannot be null");
        Objects.requireNonNull(aggregations, "Aggregations cannot be null");
        if (groupings.isEmpty() && aggregations.isEmpty()) {
            throw new IllegalArgumentException("GROUP BY needs at least one grouping or aggregation");
        }
        groupings = List.copyOf(groupings);
        aggregations = List.copyOf(aggregations);
    }

    /**
     * @return The output column names, grouping keys first
     */
    public List<String> columnNames() {
        return Stream.concat(groupings.stream(), aggregations.stream())
                .map(Projection::alias)
                .toList();
    }

    @Override
    public <T> T accept(RelationNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return "GroupByNode(" + groupings + ", " + aggregations + " <- " + source + ")";
    }
}
