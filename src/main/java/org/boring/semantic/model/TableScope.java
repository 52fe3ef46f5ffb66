package org.boring.semantic.model;

import org.boring.semantic.plan.Expression;

import java.util.List;

/**
 * The row handle dimension and measure expressions are built against.
 *
 * A scope belongs to one semantic table; {@link #column(String)} returns a reference
 * to one of its backing columns, qualified the way the surrounding query needs it.
 */
public interface TableScope {

    /**
     * @return The semantic table name this scope reads from
     */
    String name();

    /**
     * @param column The backing column name
     * @return An expression referencing the column
     */
    Expression column(String column);

    /**
     * @return The backing column names available to expressions
     */
    List<String> columns();
}
