package org.boring.semantic.plan;

import java.util.Objects;

/**
 * Represents a JOIN operation in the relational algebra tree.
 * 
 * This node combines two relation nodes based on a join condition.
 * Supports INNER, LEFT OUTER and CROSS joins.
 * 
 * @param left The left input relation
 * @param right The right input relation
 * @param condition The join condition, null only for CROSS joins
 * @param joinType The type of join
 */
public record JoinNode(
        RelationNode left,
        RelationNode right,
        Expression condition,
        JoinType joinType
) implements RelationNode {
    
    public JoinNode {
        Objects.requireNonNull(left, "Left relation cannot be null");
        Objects.requireNonNull(right, "Right relation cannot be null");
        Objects.requireNonNull(joinType, "Join type cannot be null");
        if (joinType != JoinType.CROSS) {
            Objects.requireNonNull(condition, "Join condition cannot be null");
        } else if (condition != null) {
            throw new IllegalArgumentException("CROSS JOIN does not take a condition");
        }
    }
    
    /**
     * Creates an INNER JOIN.
     */
    public static JoinNode inner(RelationNode left, RelationNode right, Expression condition) {
        return new JoinNode(left, right, condition, JoinType.INNER);
    }
    
    /**
     * Creates a LEFT OUTER JOIN.
     */
    public static JoinNode leftOuter(RelationNode left, RelationNode right, Expression condition) {
        return new JoinNode(left, right, condition, JoinType.LEFT_OUTER);
    }

    /**
     * Creates a CROSS JOIN.
     */
    public static JoinNode cross(RelationNode left, RelationNode right) {
        return new JoinNode(left, right, null, JoinType.CROSS);
    }
    
    @Override
    public <T> T accept(RelationNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
    
    /**
     * Types of SQL joins.
     */
    public enum JoinType {
        INNER("INNER JOIN"),
        LEFT_OUTER("LEFT OUTER JOIN"),
        CROSS("CROSS JOIN");
        
        private final String sql;
        
        JoinType(String sql) {
            this.sql = sql;
        }
        
        public String toSql() {
            return sql;
        }
    }
}
