package org.boring.semantic.ir;

/**
 * Sealed interface for the semantic query plan (the IR the fluent API builds).
 *
 * Each variant owns its inputs by value and refers to dimensions and measures by name only,
 * so rewrite passes are plain structural tree transforms:
 * - SemanticSource: a semantic table scan (leaf)
 * - SemanticFilter / SemanticJoin: row-level operations
 * - SemanticGroupBy + SemanticAggregate: grouping and measures
 * - SemanticMutate / SemanticOrderBy / SemanticLimit / SemanticProject: result shaping
 * - SemanticPreAggregate: a join arm aggregated at its own grain (introduced by the join planner)
 */
public sealed interface SemanticNode
        permits SemanticSource, SemanticFilter, SemanticJoin, SemanticGroupBy, SemanticAggregate,
        SemanticMutate, SemanticOrderBy, SemanticLimit, SemanticProject, SemanticPreAggregate {

    /**
     * Accept method for the visitor pattern.
     *
     * @param visitor The visitor to accept
     * @param <T>     The return type of the visitor
     * @return The result of visiting this node
     */
    <T> T accept(SemanticNodeVisitor<T> visitor);

    /**
     * @return A short node type name for diagnostics
     */
    default String nodeType() {
        return getClass().getSimpleName();
    }
}
