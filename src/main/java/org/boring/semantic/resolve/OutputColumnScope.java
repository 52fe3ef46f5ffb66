package org.boring.semantic.resolve;

import org.boring.semantic.model.FieldScope;
import org.boring.semantic.plan.ColumnReference;
import org.boring.semantic.plan.Expression;
import org.boring.semantic.store.SqlDataType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The output columns of an aggregated (or projected) result.
 *
 * Columns are referenced unqualified. A name matches exactly, or by a unique
 * {@code .name} suffix in either direction ({@code name} finds {@code customers.name},
 * and {@code customers.name} finds {@code name}).
 */
public final class OutputColumnScope implements FieldScope {

    private final Map<String, SqlDataType> columns;

    public OutputColumnScope(Map<String, SqlDataType> columns) {
        this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }

    public Map<String, SqlDataType> columns() {
        return columns;
    }

    @Override
    public Expression field(String name) {
        String column = resolve(name);
        return ColumnReference.of(column, columns.get(column));
    }

    /**
     * @return The output column the name refers to
     * @throws UnknownFieldException if none or several columns match
     */
    public String resolve(String name) {
        if (columns.containsKey(name)) {
            return name;
        }
        List<String> matches = new ArrayList<>();
        for (String column : columns.keySet()) {
            if (column.endsWith("." + name) || name.endsWith("." + column)) {
                matches.add(column);
            }
        }
        if (matches.size() == 1) {
            return matches.get(0);
        }
        throw new UnknownFieldException(name, availableFields());
    }

    @Override
    public List<String> availableFields() {
        return List.copyOf(columns.keySet());
    }
}
