package org.boring.semantic.resolve;

import org.boring.semantic.model.Dimension;
import org.boring.semantic.model.Measure;
import org.boring.semantic.model.SemanticTable;

import java.util.Objects;

/**
 * A dimension or measure found by {@link FieldResolution}.
 *
 * @param table The owning semantic table
 * @param name  The field name on the table
 */
public record ResolvedField(SemanticTable table, String name) {

    public ResolvedField {
        Objects.requireNonNull(table, "Table cannot be null");
        Objects.requireNonNull(name, "Name cannot be null");
    }

    /**
     * @return The {@code table.field} name
     */
    public String qualifiedName() {
        return table.name() + "." + name;
    }

    public Dimension dimension() {
        return table.dimension(name)
                .orElseThrow(() -> new IllegalStateException(qualifiedName() + " is not a dimension"));
    }

    public Measure measure() {
        return table.measure(name)
                .orElseThrow(() -> new IllegalStateException(qualifiedName() + " is not a measure"));
    }
}
