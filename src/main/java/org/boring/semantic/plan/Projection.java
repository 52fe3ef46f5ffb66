package org.boring.semantic.plan;

import java.util.Objects;

/**
 * A single output column: an expression and the name it is selected as.
 *
 * @param expression The computed expression
 * @param alias      The output column name
 */
public record Projection(
        Expression expression,
        String alias) {

    public Projection {
        Objects.requireNonNull(expression, "Expression cannot be null");
        Objects.requireNonNull(alias, "Alias cannot be null");
        if (alias.isBlank()) {
            throw new IllegalArgumentException("Alias cannot be blank");
        }
    }

    public static Projection of(Expression expression, String alias) {
        return new Projection(expression, alias);
    }

    @Override
    public String toString() {
        return expression + " AS " + alias;
    }
}
