package org.boring.semantic.execution;

import org.boring.semantic.SemanticException;

/**
 * Thrown when the backend rejects or fails a generated query.
 */
public class QueryExecutionException extends SemanticException {

    private final String sql;

    public QueryExecutionException(String sql, Throwable cause) {
        super("Query execution failed: " + cause.getMessage() + "\nSQL: " + sql, cause);
        this.sql = sql;
    }

    /**
     * @return The SQL text that failed
     */
    public String sql() {
        return sql;
    }
}
