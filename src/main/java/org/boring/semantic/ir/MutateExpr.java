package org.boring.semantic.ir;

import org.boring.semantic.model.FieldScope;
import org.boring.semantic.plan.Expression;

/**
 * A post-aggregation column, computed from the output columns of an aggregated result.
 */
@FunctionalInterface
public interface MutateExpr {

    Expression apply(FieldScope columns);
}
