package org.boring.semantic.execution;

import org.boring.semantic.transpiler.SQLDialect;

/**
 * A relational backend that runs generated SQL.
 */
public interface Backend {

    /**
     * @return The dialect SQL must be rendered in for this backend
     */
    SQLDialect dialect();

    /**
     * Runs a query and materializes its result.
     *
     * @throws QueryExecutionException if the backend fails
     */
    BufferedResult execute(String sql);
}
