package org.boring.semantic.model;

import org.boring.semantic.SemanticException;

import java.util.List;

/**
 * Thrown when a dimension or measure name is declared twice on one semantic table.
 */
public class DuplicateFieldException extends SemanticException {

    private final String tableName;
    private final String fieldName;

    public DuplicateFieldException(String tableName, String fieldName, List<String> existing) {
        super("Field '" + fieldName + "' is already defined on semantic table '" + tableName
                + "'. Existing fields: " + existing);
        this.tableName = tableName;
        this.fieldName = fieldName;
    }

    public String tableName() {
        return tableName;
    }

    public String fieldName() {
        return fieldName;
    }
}
