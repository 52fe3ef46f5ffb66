package org.boring.semantic.resolve;

import java.util.List;

/**
 * Thrown when a dimension or measure name cannot be resolved in a joined query.
 */
public class UnresolvedFieldException extends UnknownFieldException {

    public UnresolvedFieldException(String field, String kind, List<String> known) {
        super("Cannot resolve " + kind + " '" + field + "'. Known " + kind + "s: " + known, field, known);
    }
}
