package org.boring.semantic.plan;

/**
 * Sealed interface representing nodes in the relational algebra tree.
 * This is the backend-facing plan the semantic lowering produces.
 * 
 * The hierarchy models relational operations that can be pushed down to SQL:
 * - TableNode: Physical table scan (FROM clause)
 * - SubqueryNode: A nested query used as a named relation
 * - JoinNode: Table join (JOIN clause)
 * - FilterNode: Row filtering (WHERE clause)
 * - ProjectNode: Column projection (SELECT clause)
 * - GroupByNode: Grouped aggregation (GROUP BY clause)
 * - SortNode / LimitNode: ORDER BY and LIMIT/OFFSET
 */
public sealed interface RelationNode
        permits TableNode, SubqueryNode, JoinNode, FilterNode, ProjectNode, GroupByNode, SortNode, LimitNode {

    /**
     * Accept method for the visitor pattern.
     * 
     * @param visitor The visitor to accept
     * @param <T>     The return type of the visitor
     * @return The result of visiting this node
     */
    <T> T accept(RelationNodeVisitor<T> visitor);
}
