package org.boring.semantic.plan;

import java.util.Objects;

/**
 * A nested query used as a named relation: (SELECT ...) AS "alias".
 *
 * @param source The nested query
 * @param alias  The relation alias columns are qualified with
 */
public record SubqueryNode(
        RelationNode source,
        String alias) implements RelationNode {

    public SubqueryNode {
        Objects.requireNonNull(source, "Source cannot be null");
        Objects.requireNonNull(alias, "Alias cannot be null");
        if (alias.isBlank()) {
            throw new IllegalArgumentException("Alias cannot be blank");
        }
    }

    @Override
    public <T> T accept(RelationNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return "SubqueryNode(" + source + " AS " + alias + ")";
    }
}
