package org.boring.semantic.execution;

import org.boring.semantic.plan.RelationNode;
import org.boring.semantic.transpiler.SQLDialect;
import org.boring.semantic.transpiler.SQLGenerator;

import java.util.Objects;

/**
 * A lowered query: one relational plan for one backend.
 *
 * @param plan    The relational plan
 * @param dialect The dialect the plan renders in
 * @param backend The backend that runs it, null when only SQL is needed
 */
public record BackendQuery(
        RelationNode plan,
        SQLDialect dialect,
        Backend backend) {

    public BackendQuery {
        Objects.requireNonNull(plan, "Plan cannot be null");
        Objects.requireNonNull(dialect, "Dialect cannot be null");
    }

    public String toSql() {
        return new SQLGenerator(dialect).generate(plan);
    }

    /**
     * Runs the query on its backend.
     *
     * @throws IllegalStateException    if the query was lowered without a backend
     * @throws QueryExecutionException  if the backend fails
     */
    public BufferedResult execute() {
        if (backend == null) {
            throw new IllegalStateException("Query has no backend to execute on: " + toSql());
        }
        return backend.execute(toSql());
    }
}
