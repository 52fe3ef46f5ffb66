package org.boring.semantic.plan;

import java.util.List;
import java.util.Objects;

/**
 * Represents a projection operation in the relational algebra.
 * This corresponds to the SELECT clause in SQL.
 * 
 * @param source The source relation to project
 * @param projections The list of columns to project with their aliases
 * @param distinct Whether duplicate rows are removed (SELECT DISTINCT)
 */
public record ProjectNode(
        RelationNode source,
        List<Projection> projections,
        boolean distinct
) implements RelationNode {
    
    public ProjectNode {
        Objects.requireNonNull(source, "Source cannot be null");
        Objects.requireNonNull(projections, "Projections cannot be null");
        
        if (projections.isEmpty()) {
            throw new IllegalArgumentException("Projections cannot be empty");
        }
        
        // Ensure immutability
        projections = List.copyOf(projections);
    }

    public ProjectNode(RelationNode source, List<Projection> projections) {
        this(source, projections, false);
    }
    
    /**
     * Factory for creating a ProjectNode with varargs projections.
     */
    public static ProjectNode of(RelationNode source, Projection... projections) {
        return new ProjectNode(source, List.of(projections), false);
    }

    /**
     * @return The output column names in order
     */
    public List<String> columnNames() {
        return projections.stream().map(Projection::alias).toList();
    }
    
    @Override
    public <T> T accept(RelationNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
    
    @Override
    public String toString() {
        return "ProjectNode(" + (distinct ? "DISTINCT " : "") + projections + " <- " + source + ")";
    }
}
