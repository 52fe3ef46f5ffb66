package org.boring.semantic.store;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Represents a physical relational table: the external relation a semantic table reads from.
 * 
 * @param schemaName The database schema (can be empty for default schema)
 * @param name The table name
 * @param columns Immutable list of columns
 */
public record Table(
        String schemaName,
        String name,
        List<Column> columns
) {
    public Table {
        Objects.requireNonNull(schemaName, "Schema cannot be null (use empty string for default)");
        Objects.requireNonNull(name, "Table name cannot be null");
        Objects.requireNonNull(columns, "Columns cannot be null");
        
        if (name.isBlank()) {
            throw new IllegalArgumentException("Table name cannot be blank");
        }
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("Table " + name + " must declare at least one column");
        }
        
        // Ensure immutability
        columns = List.copyOf(columns);
    }
    
    /**
     * Creates a table in the default schema.
     */
    public Table(String name, List<Column> columns) {
        this("", name, columns);
    }
    
    /**
     * @return The fully qualified table name (schema.table or just table)
     */
    public String qualifiedName() {
        return schemaName.isEmpty() ? name : schemaName + "." + name;
    }

    /**
     * The relation schema as ordered (column name, type) pairs.
     */
    public Map<String, SqlDataType> schema() {
        Map<String, SqlDataType> schema = new LinkedHashMap<>();
        for (Column column : columns) {
            schema.put(column.name(), column.dataType());
        }
        return schema;
    }

    /**
     * @return The column names in declaration order
     */
    public List<String> columnNames() {
        return columns.stream().map(Column::name).toList();
    }
    
    /**
     * Finds a column by name.
     * 
     * @param columnName The column name to search for
     * @return Optional containing the column if found
     */
    public Optional<Column> findColumn(String columnName) {
        return columns.stream()
                .filter(c -> c.name().equals(columnName))
                .findFirst();
    }
    
    /**
     * @param columnName The column name to look up
     * @return The column
     * @throws IllegalArgumentException if column not found
     */
    public Column column(String columnName) {
        return findColumn(columnName)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Column '" + columnName + "' not found in table " + qualifiedName()
                                + ". Available columns: " + columnNames()));
    }
}
