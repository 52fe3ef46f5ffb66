package org.boring.semantic.model;

import org.boring.semantic.plan.Expression;

/**
 * The expression of a calculated measure, built over other measures by name.
 */
@FunctionalInterface
public interface MeasureExpr {

    Expression apply(MeasureResolver measures);
}
