package org.boring.semantic.plan;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A WHERE condition over a relation.
 *
 * Stacked filters over a table, join or named subquery render as one statement whose
 * conditions are AND-ed innermost first; see {@link #conditionChain(RelationNode)}.
 *
 * @param source    The filtered relation
 * @param condition A boolean expression over the source's columns
 */
public record FilterNode(RelationNode source, Expression condition) implements RelationNode {

    public FilterNode {
        Objects.requireNonNull(source, "Source cannot be null");
        Objects.requireNonNull(condition, "Condition cannot be null");
    }

    /**
     * @return The source filtered by the conjunction of the conditions, or the source itself
     *         when there are none
     */
    public static RelationNode where(RelationNode source, List<Expression> conditions) {
        if (conditions.isEmpty()) {
            return source;
        }
        return new FilterNode(source, LogicalExpression.and(conditions));
    }

    /**
     * @return The conditions of the filters stacked on top of a relation, innermost first
     */
    public static List<Expression> conditionChain(RelationNode node) {
        List<Expression> conditions = new ArrayList<>();
        RelationNode current = node;
        while (current instanceof FilterNode filter) {
            conditions.add(0, filter.condition());
            current = filter.source();
        }
        return conditions;
    }

    /**
     * @return The first relation below the filters stacked on top of a relation
     */
    public static RelationNode unfiltered(RelationNode node) {
        RelationNode current = node;
        while (current instanceof FilterNode filter) {
            current = filter.source();
        }
        return current;
    }

    @Override
    public <T> T accept(RelationNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return "Filter(" + condition + ", " + source + ")";
    }
}
