package org.boring.semantic.ir;

/**
 * How many rows of the right side of a join match one row of the left side.
 */
public enum Cardinality {
    /** At most one right row per left row. */
    ONE,
    /** Any number of right rows per left row. */
    MANY,
    /** Every right row matches every left row. */
    CROSS,
    /** Not declared; aggregating across such a join is ambiguous. */
    UNDECLARED
}
