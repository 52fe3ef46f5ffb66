package org.boring.semantic.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Adds columns computed from the output columns of an aggregated result.
 */
public record SemanticMutate(
        SemanticNode source,
        Map<String, MutateExpr> computed) implements SemanticNode {

    public SemanticMutate {
        Objects.requireNonNull(source, "Source cannot be null");
        Objects.requireNonNull(computed, "Computed columns cannot be null");
        if (computed.isEmpty()) {
            throw new IllegalArgumentException("Mutate requires at least one computed column");
        }
        computed = Collections.unmodifiableMap(new LinkedHashMap<>(computed));
    }

    @Override
    public <T> T accept(SemanticNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return "Mutate(" + computed.keySet() + ", " + source + ")";
    }
}
