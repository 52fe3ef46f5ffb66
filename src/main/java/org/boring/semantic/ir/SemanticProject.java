package org.boring.semantic.ir;

import java.util.List;
import java.util.Objects;

/**
 * Selects fields: dimensions before aggregation, output columns after.
 */
public record SemanticProject(
        SemanticNode source,
        List<String> fields) implements SemanticNode {

    public SemanticProject {
        Objects.requireNonNull(source, "Source cannot be null");
        Objects.requireNonNull(fields, "Fields cannot be null");
        if (fields.isEmpty()) {
            throw new IllegalArgumentException("At least one field is required");
        }
        fields = List.copyOf(fields);
    }

    @Override
    public <T> T accept(SemanticNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return "Project(" + fields + ", " + source + ")";
    }
}
