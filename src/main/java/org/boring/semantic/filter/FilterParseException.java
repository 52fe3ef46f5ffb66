package org.boring.semantic.filter;

import org.boring.semantic.SemanticException;

/**
 * Thrown when a string filter expression or a JSON filter cannot be parsed.
 */
public class FilterParseException extends SemanticException {

    public FilterParseException(String message) {
        super(message);
    }

    public FilterParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
