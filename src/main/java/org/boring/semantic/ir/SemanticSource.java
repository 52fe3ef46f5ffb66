package org.boring.semantic.ir;

import org.boring.semantic.model.SemanticTable;

import java.util.List;
import java.util.Objects;

/**
 * Leaf node: a scan of a semantic table.
 *
 * @param table   The semantic table
 * @param columns The backing columns to read, empty to read every column
 */
public record SemanticSource(
        SemanticTable table,
        List<String> columns) implements SemanticNode {

    public SemanticSource {
        Objects.requireNonNull(table, "Table cannot be null");
        Objects.requireNonNull(columns, "Columns cannot be null");
        columns = List.copyOf(columns);
        for (String column : columns) {
            table.source().column(column);
        }
    }

    public static SemanticSource of(SemanticTable table) {
        return new SemanticSource(table, List.of());
    }

    /**
     * @return A scan of the same table restricted to the given columns
     */
    public SemanticSource withColumns(List<String> newColumns) {
        return new SemanticSource(table, newColumns);
    }

    @Override
    public <T> T accept(SemanticNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return "Source(" + table.name() + (columns.isEmpty() ? "" : " " + columns) + ")";
    }
}
