package org.boring.semantic.ir;

import java.util.List;
import java.util.Objects;

/**
 * Orders the result by fields.
 */
public record SemanticOrderBy(
        SemanticNode source,
        List<SortKey> keys) implements SemanticNode {

    public SemanticOrderBy {
        Objects.requireNonNull(source, "Source cannot be null");
        Objects.requireNonNull(keys, "Keys cannot be null");
        if (keys.isEmpty()) {
            throw new IllegalArgumentException("At least one sort key is required");
        }
        keys = List.copyOf(keys);
    }

    @Override
    public <T> T accept(SemanticNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return "OrderBy(" + keys + ", " + source + ")";
    }
}
