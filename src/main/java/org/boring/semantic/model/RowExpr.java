package org.boring.semantic.model;

import org.boring.semantic.plan.Expression;

/**
 * A row-level expression builder: dimension expressions and base measure aggregations.
 */
@FunctionalInterface
public interface RowExpr {

    Expression apply(TableScope row);
}
