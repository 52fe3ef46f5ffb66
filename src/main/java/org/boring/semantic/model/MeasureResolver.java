package org.boring.semantic.model;

import org.boring.semantic.plan.Expression;

/**
 * Resolves measure names for calculated measures at lowering time.
 *
 * Names are looked up with the same precedence as everywhere else in a joined query,
 * except that a bare name is first tried against the calculated measure's own table.
 */
public interface MeasureResolver {

    /**
     * @param name A bare or qualified measure name
     * @return The measure's value for the current group
     */
    Expression measure(String name);

    /**
     * @param name A bare or qualified measure name
     * @return The measure's value across all groups (the grand total)
     */
    Expression all(String name);
}
