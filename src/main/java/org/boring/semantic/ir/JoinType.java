package org.boring.semantic.ir;

/**
 * Join semantics for unmatched left rows.
 */
public enum JoinType {
    INNER,
    LEFT
}
