package org.boring.semantic.model;

import org.boring.semantic.plan.Expression;

import java.util.List;

/**
 * Name-based access to the fields of a relation, used by filters, join conditions
 * and post-aggregation expressions.
 *
 * Before aggregation a field is a dimension (or a raw column); after aggregation it is
 * an output column of the aggregated result.
 */
public interface FieldScope {

    /**
     * @param name A bare or qualified field name
     * @return The field's expression
     * @throws org.boring.semantic.resolve.UnknownFieldException if the name cannot be resolved
     */
    Expression field(String name);

    /**
     * @return The names this scope resolves, for error messages
     */
    List<String> availableFields();
}
