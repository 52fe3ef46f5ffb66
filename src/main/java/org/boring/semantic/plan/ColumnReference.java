package org.boring.semantic.plan;

import org.boring.semantic.store.SqlDataType;

import java.util.Objects;

/**
 * Represents a reference to a column in the relational plan.
 * 
 * @param tableAlias The alias of the relation containing the column, empty for an unqualified reference
 * @param columnName The column name
 * @param columnType The SQL type of this column (for type-aware compilation)
 */
public record ColumnReference(
        String tableAlias,
        String columnName,
        SqlDataType columnType) implements Expression {

    public ColumnReference {
        Objects.requireNonNull(tableAlias, "Table alias cannot be null");
        Objects.requireNonNull(columnName, "Column name cannot be null");
        Objects.requireNonNull(columnType, "Column type cannot be null");
    }

    /**
     * Creates a column reference qualified by a table alias.
     */
    public static ColumnReference of(String tableAlias, String columnName, SqlDataType type) {
        return new ColumnReference(tableAlias, columnName, type);
    }

    /**
     * Creates a column reference without a table alias.
     */
    public static ColumnReference of(String columnName, SqlDataType type) {
        return new ColumnReference("", columnName, type);
    }

    /**
     * @return true when the reference carries a table alias
     */
    public boolean isQualified() {
        return !tableAlias.isEmpty();
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitColumnReference(this);
    }

    @Override
    public SqlDataType type() {
        return columnType;
    }

    @Override
    public String toString() {
        return tableAlias.isEmpty() ? columnName : tableAlias + "." + columnName;
    }
}
