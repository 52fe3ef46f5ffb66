package org.boring.semantic.model;

import org.boring.semantic.SemanticException;

/**
 * Thrown when a time grain finer than a dimension's smallest declared grain is requested.
 */
public class GrainTooFineException extends SemanticException {

    private final String dimension;
    private final TimeGrain requested;
    private final TimeGrain smallest;

    public GrainTooFineException(String dimension, TimeGrain requested, TimeGrain smallest) {
        super("Requested time grain '" + requested + "' is finer than the smallest allowed grain '"
                + smallest + "' for time dimension '" + dimension + "'");
        this.dimension = dimension;
        this.requested = requested;
        this.smallest = smallest;
    }

    public String dimension() {
        return dimension;
    }

    public TimeGrain requested() {
        return requested;
    }

    public TimeGrain smallest() {
        return smallest;
    }
}
