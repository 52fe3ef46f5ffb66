package org.boring.semantic.filter;

import org.boring.semantic.SemanticException;

import java.util.List;

/**
 * Thrown when a filter uses an operator outside the supported taxonomy.
 */
public class UnsupportedOperatorException extends SemanticException {

    private final String operator;

    public UnsupportedOperatorException(String operator, List<String> supported) {
        super("Unsupported filter operator '" + operator + "'. Supported operators: " + supported);
        this.operator = operator;
    }

    public String operator() {
        return operator;
    }
}
