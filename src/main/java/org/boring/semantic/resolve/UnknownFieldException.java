package org.boring.semantic.resolve;

import org.boring.semantic.SemanticException;

import java.util.List;

/**
 * Thrown when a field name matches no dimension, measure or column in scope.
 *
 * Raised while a plan is rewritten or lowered, it also names the type of the semantic
 * node whose field failed to resolve ({@code SemanticFilter}, {@code SemanticAggregate}, ...).
 */
public class UnknownFieldException extends SemanticException {

    private final String field;
    private final List<String> available;
    private final String nodeType;

    public UnknownFieldException(String field, List<String> available) {
        this("Unknown field '" + field + "'. Available fields: " + available, field, available);
    }

    protected UnknownFieldException(String message, String field, List<String> available) {
        this(message, field, available, null, null);
    }

    private UnknownFieldException(String message, String field, List<String> available, String nodeType,
            Throwable cause) {
        super(message, cause);
        this.field = field;
        this.available = List.copyOf(available);
        this.nodeType = nodeType;
    }

    /**
     * @return The same failure attributed to a node of the semantic plan; a failure
     *         already attributed keeps its node
     */
    public UnknownFieldException at(String semanticNodeType) {
        if (nodeType != null) {
            return this;
        }
        return new UnknownFieldException(semanticNodeType + ": " + getMessage(), field, available,
                semanticNodeType, this);
    }

    public String field() {
        return field;
    }

    public List<String> available() {
        return available;
    }

    /**
     * @return The semantic node type the field belongs to, null when raised outside a plan
     */
    public String nodeType() {
        return nodeType;
    }
}
