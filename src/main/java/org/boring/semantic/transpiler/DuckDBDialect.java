package org.boring.semantic.transpiler;

/**
 * DuckDB, the reference backend.
 *
 * Identifiers are double-quoted and strings single-quoted, each escaping its quote by
 * doubling it. Date and timestamp values are written as typed literals,
 * {@code DATE '2024-02-01'}.
 */
public final class DuckDBDialect implements SQLDialect {

    public static final DuckDBDialect INSTANCE = new DuckDBDialect();

    private DuckDBDialect() {
    }

    @Override
    public String name() {
        return "DuckDB";
    }

    @Override
    public String quoteIdentifier(String identifier) {
        return '"' + identifier.replace("\"", "\"\"") + '"';
    }

    @Override
    public String quoteStringLiteral(String value) {
        return '\'' + value.replace("'", "''") + '\'';
    }

    @Override
    public String formatBoolean(boolean value) {
        return value ? "TRUE" : "FALSE";
    }

    @Override
    public String formatDateLiteral(String isoDate) {
        return "DATE " + quoteStringLiteral(isoDate);
    }

    @Override
    public String formatTimestampLiteral(String isoTimestamp) {
        return "TIMESTAMP " + quoteStringLiteral(isoTimestamp);
    }

    @Override
    public String formatDateTrunc(String unit, String argument) {
        return "date_trunc(" + quoteStringLiteral(unit) + ", " + argument + ")";
    }

    @Override
    public String toString() {
        return name();
    }
}
