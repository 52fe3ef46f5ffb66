package org.boring.semantic.filter;

import org.boring.semantic.model.FieldScope;
import org.boring.semantic.plan.Expression;

/**
 * A filter in its single compiled form: a predicate builder over the fields in scope.
 *
 * The same compiled filter is applied to the real row scope when lowering and to
 * analysis scopes by the rewrite passes.
 */
@FunctionalInterface
public interface CompiledFilter {

    Expression apply(FieldScope fields);
}
