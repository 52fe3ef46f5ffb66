package org.boring.semantic;

/**
 * Base class of every error raised while building, rewriting or lowering a semantic query.
 *
 * All subclasses are unchecked: they describe a mistake in the query or the model that the
 * caller can correct, never a process-fatal condition.
 */
public class SemanticException extends RuntimeException {

    public SemanticException(String message) {
        super(message);
    }

    public SemanticException(String message, Throwable cause) {
        super(message, cause);
    }
}
