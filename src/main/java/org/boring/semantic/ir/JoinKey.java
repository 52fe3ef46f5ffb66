package org.boring.semantic.ir;

import org.boring.semantic.model.FieldScope;
import org.boring.semantic.plan.ComparisonExpression;
import org.boring.semantic.plan.Expression;

import java.util.Objects;

/**
 * The condition of a semantic join, built over the fields of both sides.
 *
 * @param condition   Builds the join predicate from the left and right field scopes
 * @param description Human readable form, for plan descriptions and errors
 */
public record JoinKey(
        Condition condition,
        String description) {

    @FunctionalInterface
    public interface Condition {
        Expression apply(FieldScope left, FieldScope right);
    }

    public JoinKey {
        Objects.requireNonNull(condition, "Join condition cannot be null");
        description = description == null ? "<condition>" : description;
    }

    /**
     * Equi-join on a field present on both sides under the same name.
     */
    public static JoinKey on(String field) {
        return on(field, field);
    }

    /**
     * Equi-join of a left field to a right field.
     */
    public static JoinKey on(String leftField, String rightField) {
        return new JoinKey(
                (left, right) -> ComparisonExpression.equals(left.field(leftField), right.field(rightField)),
                leftField + " = " + rightField);
    }

    /**
     * Join on an arbitrary predicate.
     */
    public static JoinKey of(Condition condition) {
        return new JoinKey(condition, null);
    }

    public Expression apply(FieldScope left, FieldScope right) {
        return condition.apply(left, right);
    }

    @Override
    public String toString() {
        return description;
    }
}
