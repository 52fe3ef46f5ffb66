package org.boring.semantic.plan;

import java.util.Objects;

/**
 * LIMIT and OFFSET over a relation. A relation may be offset without a row limit.
 *
 * @param source The limited relation, usually sorted
 * @param limit  The maximum row count, or null for all remaining rows
 * @param offset The rows skipped first
 */
public record LimitNode(RelationNode source, Integer limit, int offset) implements RelationNode {

    public LimitNode {
        Objects.requireNonNull(source, "Source cannot be null");
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("Limit cannot be negative: " + limit);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("Offset cannot be negative: " + offset);
        }
        if (limit == null && offset == 0) {
            throw new IllegalArgumentException("A limit node needs a limit or an offset");
        }
    }

    /**
     * @return The source limited and offset, or the source itself when neither is set
     */
    public static RelationNode apply(RelationNode source, Integer limit, int offset) {
        if (limit == null && offset == 0) {
            return source;
        }
        return new LimitNode(source, limit, offset);
    }

    @Override
    public <T> T accept(RelationNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return "Limit(" + (limit == null ? "all" : limit) + (offset > 0 ? " offset " + offset : "") + ", " + source + ")";
    }
}
