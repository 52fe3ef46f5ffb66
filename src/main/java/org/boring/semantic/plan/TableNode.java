package org.boring.semantic.plan;

import org.boring.semantic.store.Table;

import java.util.List;
import java.util.Objects;

/**
 * Represents a physical table scan in the relational algebra.
 * This corresponds to the FROM clause in SQL.
 * 
 * @param table   The physical table to scan
 * @param alias   The table alias for SQL generation
 * @param columns The columns to read, empty to read every column
 */
public record TableNode(
        Table table,
        String alias,
        List<String> columns
) implements RelationNode {
    
    public TableNode {
        Objects.requireNonNull(table, "Table cannot be null");
        Objects.requireNonNull(alias, "Alias cannot be null");
        Objects.requireNonNull(columns, "Columns cannot be null");
        
        if (alias.isBlank()) {
            throw new IllegalArgumentException("Alias cannot be blank");
        }
        columns = List.copyOf(columns);
        for (String column : columns) {
            table.column(column);
        }
    }
    
    /**
     * Creates a TableNode reading every column.
     */
    public TableNode(Table table, String alias) {
        this(table, alias, List.of());
    }

    /**
     * @return true when the scan is restricted to a subset of columns
     */
    public boolean isPruned() {
        return !columns.isEmpty();
    }
    
    @Override
    public <T> T accept(RelationNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
    
    @Override
    public String toString() {
        return "TableNode(" + table.qualifiedName() + " AS " + alias
                + (columns.isEmpty() ? "" : " " + columns) + ")";
    }
}
