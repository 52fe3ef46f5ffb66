package org.boring.semantic.ir;

import org.boring.semantic.filter.CompiledFilter;

import java.util.Objects;

/**
 * Keeps the rows (or, after aggregation, the groups) satisfying a compiled filter.
 */
public record SemanticFilter(
        SemanticNode source,
        CompiledFilter filter) implements SemanticNode {

    public SemanticFilter {
        Objects.requireNonNull(source, "Source cannot be null");
        Objects.requireNonNull(filter, "Filter cannot be null");
    }

    @Override
    public <T> T accept(SemanticNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return "Filter(" + source + ")";
    }
}
