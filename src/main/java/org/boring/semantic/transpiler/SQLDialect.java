package org.boring.semantic.transpiler;

/**
 * Backend-specific rendering of the pieces of SQL the semantic layer emits.
 *
 * Statements themselves are built by {@link SQLGenerator}; a dialect only decides how
 * names, literals and the time-grain truncation are spelled.
 */
public interface SQLDialect {

    /**
     * @return The dialect name, e.g. "DuckDB"
     */
    String name();

    /**
     * Quotes a table alias, column name or output column name. Output names such as
     * {@code customers.country} contain dots and must stay a single identifier.
     */
    String quoteIdentifier(String identifier);

    String quoteStringLiteral(String value);

    String formatBoolean(boolean value);

    /**
     * @param isoDate A date in {@code yyyy-MM-dd} form
     */
    String formatDateLiteral(String isoDate);

    /**
     * @param isoTimestamp A timestamp in {@code yyyy-MM-dd HH:mm:ss} form
     */
    String formatTimestampLiteral(String isoTimestamp);

    /**
     * Truncates a rendered date or timestamp expression to a time grain.
     *
     * @param unit     The grain's unit, e.g. "month"
     * @param argument The already rendered expression
     */
    String formatDateTrunc(String unit, String argument);

    default String formatNull() {
        return "NULL";
    }
}
