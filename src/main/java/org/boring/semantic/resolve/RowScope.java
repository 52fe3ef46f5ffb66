package org.boring.semantic.resolve;

import org.boring.semantic.model.SemanticTable;
import org.boring.semantic.model.TableScope;
import org.boring.semantic.plan.ColumnReference;
import org.boring.semantic.plan.Expression;
import org.boring.semantic.store.Column;

import java.util.List;
import java.util.Objects;

/**
 * A row of one semantic table inside a row-level query, where every table is aliased
 * by its semantic name.
 */
public final class RowScope implements TableScope {

    private final SemanticTable table;

    public RowScope(SemanticTable table) {
        this.table = Objects.requireNonNull(table, "Table cannot be null");
    }

    @Override
    public String name() {
        return table.name();
    }

    /**
     * @throws UnknownFieldException if the table has no such column
     */
    @Override
    public Expression column(String column) {
        Column found = table.source().findColumn(column)
                .orElseThrow(() -> new UnknownFieldException(table.name() + "." + column, columns()));
        return ColumnReference.of(table.name(), found.name(), found.dataType());
    }

    @Override
    public List<String> columns() {
        return table.source().columnNames();
    }
}
