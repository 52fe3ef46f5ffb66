package org.boring.semantic.ir;

import java.util.Objects;

/**
 * Keeps at most {@code n} rows after skipping {@code offset}.
 */
public record SemanticLimit(
        SemanticNode source,
        int n,
        int offset) implements SemanticNode {

    public SemanticLimit {
        Objects.requireNonNull(source, "Source cannot be null");
        if (n < 0 || offset < 0) {
            throw new IllegalArgumentException("Limit and offset must be non-negative");
        }
    }

    @Override
    public <T> T accept(SemanticNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return "Limit(" + n + (offset > 0 ? " offset " + offset : "") + ", " + source + ")";
    }
}
