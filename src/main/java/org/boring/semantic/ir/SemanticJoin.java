package org.boring.semantic.ir;

import java.util.Objects;

/**
 * Joins two semantic relations.
 *
 * @param left        The left input
 * @param right       The right input
 * @param on          The join condition, null only for CROSS joins
 * @param cardinality Declared right-side cardinality per left row
 * @param how         INNER or LEFT
 */
public record SemanticJoin(
        SemanticNode left,
        SemanticNode right,
        JoinKey on,
        Cardinality cardinality,
        JoinType how) implements SemanticNode {

    public SemanticJoin {
        Objects.requireNonNull(left, "Left relation cannot be null");
        Objects.requireNonNull(right, "Right relation cannot be null");
        Objects.requireNonNull(cardinality, "Cardinality cannot be null");
        Objects.requireNonNull(how, "Join type cannot be null");
        if ((cardinality == Cardinality.CROSS) != (on == null)) {
            throw new IllegalArgumentException("Only CROSS joins are declared without a join condition");
        }
    }

    @Override
    public <T> T accept(SemanticNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return "Join[" + cardinality + ", " + how + (on == null ? "" : ", " + on) + "](" + left + ", " + right + ")";
    }
}
