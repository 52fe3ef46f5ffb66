package org.boring.semantic.ir;

import org.boring.semantic.SemanticException;

/**
 * Thrown when a semantic node cannot be lowered to a backend query: a plan shape the
 * backend query cannot express, or circular calculated measures. Fields that do not
 * resolve raise {@link org.boring.semantic.resolve.UnknownFieldException} instead.
 */
public class LoweringException extends SemanticException {

    private final String nodeType;

    public LoweringException(String nodeType, String message) {
        super(nodeType + ": " + message);
        this.nodeType = nodeType;
    }

    public String nodeType() {
        return nodeType;
    }
}
