package org.boring.semantic.resolve;

import org.boring.semantic.model.FieldScope;
import org.boring.semantic.model.SemanticTable;
import org.boring.semantic.plan.Expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Fields of a row-level relation: dimensions first, then raw backing columns.
 *
 * A raw column is found as {@code table.column}, or bare on the first table that has it.
 */
public final class RowFieldScope implements FieldScope {

    private final FieldResolution resolution;

    public RowFieldScope(FieldResolution resolution) {
        this.resolution = Objects.requireNonNull(resolution, "Resolution cannot be null");
    }

    public FieldResolution resolution() {
        return resolution;
    }

    @Override
    public Expression field(String name) {
        Optional<ResolvedField> dimension = resolution.findDimension(name);
        if (dimension.isPresent()) {
            ResolvedField resolved = dimension.get();
            return resolved.dimension().evaluate(new RowScope(resolved.table()));
        }
        Optional<SemanticTable> owner = columnOwner(name);
        if (owner.isPresent()) {
            return new RowScope(owner.get()).column(columnName(name));
        }
        throw new UnknownFieldException(name, availableFields());
    }

    @Override
    public List<String> availableFields() {
        List<String> names = new ArrayList<>(resolution.dimensionNames());
        for (SemanticTable table : resolution.tables()) {
            for (String column : table.source().columnNames()) {
                names.add(table.name() + "." + column);
            }
        }
        return names;
    }

    private Optional<SemanticTable> columnOwner(String name) {
        int dot = name.lastIndexOf('.');
        if (dot > 0) {
            String tableName = name.substring(0, dot);
            String column = name.substring(dot + 1);
            return resolution.table(tableName)
                    .filter(t -> t.source().findColumn(column).isPresent());
        }
        return resolution.tables().stream()
                .filter(t -> t.source().findColumn(name).isPresent())
                .findFirst();
    }

    private static String columnName(String name) {
        return name.substring(name.lastIndexOf('.') + 1);
    }
}
